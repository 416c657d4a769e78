package org.xslt.xslCompiler.compiler.errors;

import org.xslt.xslCompiler.ir.IrNode;

import javax.annotation.Nullable;

/** Signals a bug in the compiler -- some expected invariant doesn't hold.
 * Malformed IR graphs handed over by the builder end up here too. */
public final class InternalCompilerError extends BaseCompilerException {
    public InternalCompilerError(String message) {
        super(message, null);
    }

    public InternalCompilerError(String message, @Nullable IrNode node) {
        super(message, node);
    }

    @Override
    public String getErrorKind() {
        return "Compiler error";
    }
}
