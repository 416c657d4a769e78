package org.xslt.xslCompiler.compiler.errors;

import org.xslt.xslCompiler.ir.IrNode;

import javax.annotation.Nullable;

/** Exception thrown when the compiler encounters a construct
 * that is legal, but is not supported by some stage. */
public class UnimplementedException extends BaseCompilerException {
    public static final String KIND = "Not yet implemented";

    public UnimplementedException(String message, @Nullable IrNode node) {
        super(message, node);
    }

    @Override
    public String getErrorKind() {
        return KIND;
    }
}
