package org.xslt.xslCompiler.ir;

import javax.annotation.Nullable;
import java.util.List;

/** Call of an extension function which is resolved by name at run time. */
public class IrInvokeLateBound extends IrBinary {
    public IrInvokeLateBound(@Nullable IrNode name, @Nullable IrNode arguments) {
        super(NodeKind.XSLT_INVOKE_LATE_BOUND, name, arguments);
    }

    public IrName getName() {
        return this.getLeft().to(IrName.class);
    }

    public IrList getArguments() {
        return this.getRight().to(IrList.class);
    }

    @Override
    public IrNode withChildren(List<IrNode> children) {
        return new IrInvokeLateBound(children.get(0), children.get(1));
    }
}
