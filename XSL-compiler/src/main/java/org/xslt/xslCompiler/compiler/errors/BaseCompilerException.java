package org.xslt.xslCompiler.compiler.errors;

import org.xslt.xslCompiler.ir.IrNode;

import javax.annotation.Nullable;

/** Base class for exceptions which are thrown by the compiler. */
public abstract class BaseCompilerException extends RuntimeException {
    /** IR node that was being processed when the problem was found, if known. */
    @Nullable
    public final IrNode irNode;

    protected BaseCompilerException(String message, @Nullable IrNode irNode, @Nullable Throwable throwable) {
        super(message, throwable);
        this.irNode = irNode;
    }

    protected BaseCompilerException(String message, @Nullable IrNode irNode) {
        this(message, irNode, null);
    }

    public abstract String getErrorKind();
}
