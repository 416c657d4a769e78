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

import com.beust.jcommander.DynamicParameter;
import com.beust.jcommander.JCommander;
import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParameterException;
import com.beust.jcommander.ParametersDelegate;
import org.xslt.xslCompiler.compiler.errors.CompilationError;

import java.util.HashMap;
import java.util.Map;

/** Options for the XSL compiler.
 * The fields are not final since JCommander writes them through reflection. */
@SuppressWarnings("CanBeFinal")
public class CompilerOptions {
    /** Default bound on the nesting depth of an IR graph. */
    public static final int DEFAULT_MAX_DEPTH = 800;

    /** Append "name=mine!=theirs" if the two values differ. */
    static void diffField(StringBuilder builder, String name, Object mine, Object theirs) {
        if (mine.equals(theirs))
            return;
        if (builder.length() > 0)
            builder.append(", ");
        builder.append(name).append("=").append(mine).append("!=").append(theirs);
    }

    /** Options which change the accepted programs. */
    @SuppressWarnings("CanBeFinal")
    public static class Language {
        /** If true the depth of the IR graph is checked before any pass runs. */
        @Parameter(names = "--limitComplexity", arity = 1,
                description = "Reject programs whose expressions are nested too deeply")
        public boolean enforceComplexityLimit = true;
        @Parameter(names = "--maxDepth",
                description = "Maximum nesting depth accepted when the complexity limit is enforced")
        public int maxDepth = DEFAULT_MAX_DEPTH;

        public boolean same(Language other) {
            return this.diff(other).isEmpty();
        }

        public boolean validate(IErrorReporter reporter) {
            if (this.maxDepth > 0)
                return true;
            reporter.reportError("Invalid options",
                    "Option --maxDepth must be positive, not " + this.maxDepth);
            return false;
        }

        /** Differences from the other options; empty if there are none. */
        public String diff(Language other) {
            StringBuilder builder = new StringBuilder();
            diffField(builder, "enforceComplexityLimit", this.enforceComplexityLimit, other.enforceComplexityLimit);
            diffField(builder, "maxDepth", this.maxDepth, other.maxDepth);
            return builder.length() == 0 ? "" : "Language{" + builder + "}";
        }

        @Override
        public String toString() {
            return "Language{enforceComplexityLimit=" + this.enforceComplexityLimit +
                    ", maxDepth=" + this.maxDepth + "}";
        }
    }

    /** Options which control diagnostics. */
    @SuppressWarnings("CanBeFinal")
    public static class IO {
        /** Class simple name to logging level, e.g., -TCloneVisitor=2 */
        @DynamicParameter(names = "-T",
                description = "Logging level for a compiler class, as -TClass=level (can be repeated)")
        public Map<String, String> loggingLevel = new HashMap<>();
        @Parameter(names = "-v", description = "Output verbosity")
        public int verbosity = 0;

        /** Logging levels are not compared. */
        public boolean same(IO other) {
            return this.verbosity == other.verbosity;
        }

        public boolean validate(IErrorReporter reporter) {
            if (this.verbosity >= 0)
                return true;
            reporter.reportError("Invalid options", "Verbosity cannot be negative");
            return false;
        }

        public String diff(IO other) {
            StringBuilder builder = new StringBuilder();
            diffField(builder, "verbosity", this.verbosity, other.verbosity);
            return builder.length() == 0 ? "" : "IO{" + builder + "}";
        }

        @Override
        public String toString() {
            return "IO{loggingLevel=" + this.loggingLevel +
                    ", verbosity=" + this.verbosity + "}";
        }
    }

    @Parameter(names = {"-h", "--help", "-?"}, help = true, description = "Show this message and exit")
    public boolean help;
    @ParametersDelegate
    public IO ioOptions = new IO();
    @ParametersDelegate
    public Language languageOptions = new Language();

    public static CompilerOptions getDefault() {
        return new CompilerOptions();
    }

    JCommander commander() {
        JCommander commander = JCommander.newBuilder()
                .addObject(this)
                .build();
        commander.setProgramName("xsl-compiler");
        return commander;
    }

    /** Parse command-line arguments.
     * @throws CompilationError if the arguments cannot be parsed. */
    public static CompilerOptions fromArguments(String... arguments) {
        CompilerOptions options = new CompilerOptions();
        try {
            options.commander().parse(arguments);
        } catch (ParameterException ex) {
            throw new CompilationError("Invalid options: " + ex.getMessage(), ex);
        }
        return options;
    }

    /** Description of all options, as printed by --help. */
    public String usage() {
        StringBuilder builder = new StringBuilder();
        this.commander().getUsageFormatter().usage(builder);
        return builder.toString();
    }

    public boolean same(CompilerOptions other) {
        return this.languageOptions.same(other.languageOptions) &&
                this.ioOptions.same(other.ioOptions);
    }

    /** Differences from the other options; empty if there are none. */
    public String diff(CompilerOptions other) {
        return this.languageOptions.diff(other.languageOptions) +
                this.ioOptions.diff(other.ioOptions);
    }

    /** Check the option values, reporting problems; true if they are all valid. */
    public boolean validate(IErrorReporter reporter) {
        boolean language = this.languageOptions.validate(reporter);
        boolean io = this.ioOptions.validate(reporter);
        return language && io;
    }

    @Override
    public String toString() {
        return "CompilerOptions{help=" + this.help +
                ", " + this.ioOptions +
                ", " + this.languageOptions + "}";
    }
}
