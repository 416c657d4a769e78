package org.xslt.xslCompiler.ir;

import javax.annotation.Nullable;
import java.util.List;

public class IrUnary extends IrNode {
    public IrUnary(NodeKind kind, @Nullable IrNode child) {
        super(kind, child);
        checkShape(kind, NodeKind.Shape.UNARY);
        this.checkGeneric(IrUnary.class);
    }

    public IrNode getOperand() {
        return this.getRequiredChild(0);
    }

    @Override
    public IrNode withChildren(List<IrNode> children) {
        return new IrUnary(this.kind, children.get(0));
    }
}
