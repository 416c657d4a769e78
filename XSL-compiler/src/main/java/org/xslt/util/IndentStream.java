/*
 * Copyright 2022 VMware, Inc.
 * SPDX-License-Identifier: MIT
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all
 * copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 */

package org.xslt.util;

import java.io.IOException;
import java.io.UncheckedIOException;

/** {@link IIndentStream} writing to an {@link Appendable}, four spaces per level. */
public class IndentStream implements IIndentStream {
    static final String LEVEL = "    ";

    private Appendable output;
    private int level;
    /** True at the start of a line, before the indentation was written. */
    private boolean atLineStart;

    public IndentStream(Appendable output) {
        this.output = output;
        this.level = 0;
        this.atLineStart = false;
    }

    /** Redirect the output; the current indentation is kept.
     * @return The previous output. */
    public Appendable setOutputStream(Appendable output) {
        Appendable result = this.output;
        this.output = output;
        return result;
    }

    void write(CharSequence text) {
        try {
            this.output.append(text);
        } catch (IOException ex) {
            throw new UncheckedIOException(ex);
        }
    }

    @Override
    public IIndentStream appendFast(String string) {
        if (string.isEmpty())
            return this;
        if (this.atLineStart) {
            this.atLineStart = false;
            this.write(LEVEL.repeat(this.level));
        }
        this.write(string);
        return this;
    }

    @Override
    public IIndentStream newline() {
        this.write("\n");
        this.atLineStart = true;
        return this;
    }

    @Override
    public IIndentStream increase() {
        this.level++;
        return this.newline();
    }

    @Override
    public IIndentStream decrease() {
        this.level--;
        Utilities.enforce(this.level >= 0, "Negative indentation");
        return this;
    }

    @Override
    public String toString() {
        return this.output.toString();
    }
}
