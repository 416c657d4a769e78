package org.xslt.xslCompiler.compiler;

/** Interface for reporting errors. */
public interface IErrorReporter {
    /** Report a problem (error or warning).
     *
     * @param warning   If true, this is a warning.
     * @param continuation If true, this is the continuation of a multi-line message.
     * @param errorType Type of error.
     * @param message   Message to report.
     */
    void reportProblem(boolean warning, boolean continuation, String errorType, String message);

    default void reportError(String errorType, String message) {
        this.reportProblem(false, false, errorType, message);
    }

    /** True if any error (but not a warning) has been reported. */
    boolean hasErrors();
}
