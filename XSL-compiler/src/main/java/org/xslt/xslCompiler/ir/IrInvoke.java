package org.xslt.xslCompiler.ir;

import javax.annotation.Nullable;
import java.util.List;

/** Call of a function defined in the program; the function child is always a reference. */
public class IrInvoke extends IrBinary {
    public IrInvoke(@Nullable IrNode function, @Nullable IrNode arguments) {
        super(NodeKind.INVOKE, function, arguments);
    }

    public IrFunction getFunction() {
        return this.getLeft().to(IrFunction.class);
    }

    public IrList getArguments() {
        return this.getRight().to(IrList.class);
    }

    @Override
    public IrNode withChildren(List<IrNode> children) {
        return new IrInvoke(children.get(0), children.get(1));
    }
}
