package org.xslt.xslCompiler.ir;

import javax.annotation.Nullable;
import java.util.List;

public class IrBinary extends IrNode {
    public IrBinary(NodeKind kind, @Nullable IrNode left, @Nullable IrNode right) {
        super(kind, left, right);
        checkShape(kind, NodeKind.Shape.BINARY);
        this.checkGeneric(IrBinary.class);
    }

    public IrNode getLeft() {
        return this.getRequiredChild(0);
    }

    public IrNode getRight() {
        return this.getRequiredChild(1);
    }

    @Override
    public IrNode withChildren(List<IrNode> children) {
        return new IrBinary(this.kind, children.get(0), children.get(1));
    }
}
