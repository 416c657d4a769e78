package org.xslt.util;

import java.util.function.Supplier;

/** Text output which indents every line by the current nesting level.
 * Only '\n' is treated as a line separator. */
@SuppressWarnings("UnusedReturnValue")
public interface IIndentStream {
    /** Write text that contains no line separator. */
    IIndentStream appendFast(String string);

    /** Start a new line; the indentation is written before the next text. */
    IIndentStream newline();

    /** Indent subsequent lines one more level and start a new line. */
    IIndentStream increase();

    /** Indent subsequent lines one less level.  Does not start a new line. */
    IIndentStream decrease();

    default IIndentStream append(String string) {
        int start = 0;
        int end;
        while ((end = string.indexOf('\n', start)) >= 0) {
            this.appendFast(string.substring(start, end));
            this.newline();
            start = end + 1;
        }
        return this.appendFast(string.substring(start));
    }

    default IIndentStream append(boolean value) {
        return this.appendFast(Boolean.toString(value));
    }

    default IIndentStream append(int value) {
        return this.appendFast(Integer.toString(value));
    }

    default IIndentStream append(long value) {
        return this.appendFast(Long.toString(value));
    }

    default IIndentStream append(ToIndentableString value) {
        return value.toString(this);
    }

    /** The supplier is only called if the output is not discarded. */
    default IIndentStream appendSupplier(Supplier<String> supplier) {
        return this.append(supplier.get());
    }
}
