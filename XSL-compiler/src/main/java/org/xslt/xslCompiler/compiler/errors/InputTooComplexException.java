package org.xslt.xslCompiler.compiler.errors;

/** Thrown when the IR graph is nested deeper than the configured bound.
 * This is the only error a caller is expected to recover from: it can reject
 * the input, or retry with the complexity limit disabled.
 * The exception does not carry any part of the graph. */
public final class InputTooComplexException extends BaseCompilerException {
    /** The bound that was exceeded. */
    public final int maxDepth;

    public InputTooComplexException(int maxDepth) {
        super("The input is too complex: expressions are nested deeper than " + maxDepth + " levels", null);
        this.maxDepth = maxDepth;
    }

    @Override
    public String getErrorKind() {
        return "Input too complex";
    }
}
