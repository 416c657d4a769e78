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

package org.xslt.xslCompiler.compiler;

import org.xslt.xslCompiler.compiler.errors.BaseCompilerException;
import org.xslt.xslCompiler.compiler.errors.CompilationError;
import org.xslt.xslCompiler.compiler.errors.CompilerMessages;
import org.xslt.xslCompiler.compiler.visitors.ComplexityCheck;
import org.xslt.xslCompiler.compiler.visitors.IrTransform;
import org.xslt.xslCompiler.ir.IrNode;
import org.xslt.util.IWritesLogs;
import org.xslt.util.Logger;

import java.util.List;
import java.util.Map;

/** Holds the state of one compilation: the options and the messages produced.
 * The front end which produces the IR graph and the back end which consumes it
 * are not part of this class; it runs the passes in between. */
public class XslCompiler implements IWritesLogs {
    public final CompilerOptions options;
    public final CompilerMessages messages;

    public XslCompiler(CompilerOptions options) {
        this.options = options;
        this.messages = new CompilerMessages();
        this.setLoggingLevels();
    }

    public XslCompiler() {
        this(CompilerOptions.getDefault());
    }

    void setLoggingLevels() {
        for (Map.Entry<String, String> entry: this.options.ioOptions.loggingLevel.entrySet()) {
            int level;
            try {
                level = Integer.parseInt(entry.getValue());
            } catch (NumberFormatException ex) {
                throw new CompilationError("Illegal logging level " + entry.getValue() +
                        " for " + entry.getKey(), ex);
            }
            Logger.INSTANCE.setLoggingLevel(entry.getKey(), level);
        }
    }

    /** Validate the options, reporting problems to the compiler messages. */
    public boolean validateOptions() {
        return this.options.validate(this.messages);
    }

    /** Run the depth guard on a graph if the options ask for it.
     * @throws org.xslt.xslCompiler.compiler.errors.InputTooComplexException if the graph is too deep. */
    public void checkComplexity(IrNode root) {
        ComplexityCheck.checkIfEnabled(this, root);
    }

    /** Apply a sequence of passes to a graph.  The depth guard runs first;
     * if the graph is too deep no pass runs.
     * Errors are recorded in {@link #messages} and rethrown. */
    public IrNode optimize(IrNode root, List<IrTransform> passes) {
        try {
            this.checkComplexity(root);
            for (IrTransform pass: passes) {
                Logger.INSTANCE.belowLevel(this, 1)
                        .append("Running ")
                        .appendSupplier(pass::toString)
                        .newline();
                root = pass.apply(root);
            }
            return root;
        } catch (BaseCompilerException ex) {
            this.messages.reportError(ex);
            throw ex;
        }
    }

    public boolean hasErrors() {
        return this.messages.hasErrors();
    }
}
