package org.xslt.xslCompiler.compiler.errors;

import org.xslt.xslCompiler.ir.IrNode;

import javax.annotation.Nullable;

/** Problem with the input handed to the compiler: a serialized graph, an option, etc. */
public final class CompilationError extends BaseCompilerException {
    public CompilationError(String message) {
        super(message, null);
    }

    public CompilationError(String message, @Nullable IrNode node) {
        super(message, node);
    }

    public CompilationError(String message, Throwable cause) {
        super(message, null, cause);
    }

    @Override
    public String getErrorKind() {
        return "Compilation error";
    }
}
