package org.xslt.xslCompiler.ir;

import javax.annotation.Nullable;
import java.util.List;

/** Call of an extension method which was resolved during compilation.
 * The method itself is held by an object literal. */
public class IrInvokeEarlyBound extends IrTernary {
    public IrInvokeEarlyBound(@Nullable IrNode name, @Nullable IrNode method, @Nullable IrNode arguments) {
        super(NodeKind.XSLT_INVOKE_EARLY_BOUND, name, method, arguments);
    }

    public IrName getName() {
        return this.getLeft().to(IrName.class);
    }

    public Object getMethod() {
        return this.getCenter().to(IrLiteral.class).getObject();
    }

    public IrList getArguments() {
        return this.getRight().to(IrList.class);
    }

    @Override
    public IrNode withChildren(List<IrNode> children) {
        return new IrInvokeEarlyBound(children.get(0), children.get(1), children.get(2));
    }
}
