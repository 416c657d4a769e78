package org.xslt.xslCompiler.ir;

import javax.annotation.Nullable;
import java.util.List;

public class IrTernary extends IrNode {
    public IrTernary(NodeKind kind, @Nullable IrNode left, @Nullable IrNode center, @Nullable IrNode right) {
        super(kind, left, center, right);
        checkShape(kind, NodeKind.Shape.TERNARY);
        this.checkGeneric(IrTernary.class);
    }

    public IrNode getLeft() {
        return this.getRequiredChild(0);
    }

    public IrNode getCenter() {
        return this.getRequiredChild(1);
    }

    public IrNode getRight() {
        return this.getRequiredChild(2);
    }

    @Override
    public IrNode withChildren(List<IrNode> children) {
        return new IrTernary(this.kind, children.get(0), children.get(1), children.get(2));
    }
}
