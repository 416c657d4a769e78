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

import org.xslt.xslCompiler.compiler.errors.CompilationError;

import java.util.HashMap;
import java.util.Map;
import java.util.function.Supplier;

/** Debug logging with a level per class.
 *
 * <p>A class logs a message with {@code Logger.INSTANCE.belowLevel(this, level)};
 * the message is written if the level configured for the class, or for one of its
 * superclasses, is at least {@code level}.  Otherwise the returned stream discards
 * everything, including suppliers, which are never called. */
public class Logger {
    /** Output used for suppressed messages. */
    static final class Discard implements IIndentStream {
        @Override
        public IIndentStream appendFast(String string) {
            return this;
        }

        @Override
        public IIndentStream append(String string) {
            return this;
        }

        @Override
        public IIndentStream append(ToIndentableString value) {
            return this;
        }

        @Override
        public IIndentStream appendSupplier(Supplier<String> supplier) {
            return this;
        }

        @Override
        public IIndentStream newline() {
            return this;
        }

        @Override
        public IIndentStream increase() {
            return this;
        }

        @Override
        public IIndentStream decrease() {
            return this;
        }
    }

    /** Packages searched for the class names given to {@link #setLoggingLevel(String, int)}. */
    static final String[] PACKAGES = {
            "org.xslt.xslCompiler.compiler",
            "org.xslt.xslCompiler.compiler.visitors",
            "org.xslt.xslCompiler.compiler.backend",
    };

    public static final Logger INSTANCE = new Logger();

    private final Map<Class<?>, Integer> levels;
    private final IndentStream debugStream;
    private final IIndentStream discard;

    private Logger() {
        this.levels = new HashMap<>();
        this.debugStream = new IndentStream(System.err);
        this.discard = new Discard();
    }

    public IIndentStream belowLevel(Class<?> clazz, int level) {
        if (this.getLoggingLevel(clazz) >= level)
            return this.debugStream;
        return this.discard;
    }

    public IIndentStream belowLevel(IWritesLogs module, int level) {
        return this.belowLevel(module.getClass(), level);
    }

    /** The level of the class, inherited from the closest superclass which has one; 0 if none. */
    public synchronized int getLoggingLevel(Class<?> clazz) {
        for (Class<?> c = clazz; c != null; c = c.getSuperclass()) {
            Integer level = this.levels.get(c);
            if (level != null)
                return level;
        }
        return 0;
    }

    /** @return The previous level of the class. */
    @SuppressWarnings("UnusedReturnValue")
    public synchronized int setLoggingLevel(Class<?> clazz, int level) {
        Integer previous = this.levels.put(clazz, level);
        return previous == null ? 0 : previous;
    }

    /** Set the level of a class given by its simple name, e.g., "CloneVisitor".
     * @throws CompilationError if no compiler class has this name. */
    @SuppressWarnings("UnusedReturnValue")
    public int setLoggingLevel(String className, int level) {
        return this.setLoggingLevel(this.locateClass(className), level);
    }

    Class<?> locateClass(String className) {
        for (String pack: PACKAGES) {
            try {
                return Class.forName(pack + "." + className);
            } catch (ClassNotFoundException ex) {
                // not in this package
            }
        }
        throw new CompilationError("Class " + Utilities.singleQuote(className) + " not found for setting up logging");
    }

    /** Redirect the debug output; the indentation is not reset.
     * @return The previous output. */
    public Appendable setDebugStream(Appendable output) {
        return this.debugStream.setOutputStream(output);
    }
}
