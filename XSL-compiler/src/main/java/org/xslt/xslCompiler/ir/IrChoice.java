package org.xslt.xslCompiler.ir;

import javax.annotation.Nullable;
import java.util.List;

/** Selects a branch by the integer value of an expression. */
public class IrChoice extends IrBinary {
    public IrChoice(@Nullable IrNode expression, @Nullable IrNode branches) {
        super(NodeKind.CHOICE, expression, branches);
    }

    public IrNode getExpression() {
        return this.getLeft();
    }

    public IrList getBranches() {
        return this.getRight().to(IrList.class);
    }

    @Override
    public IrNode withChildren(List<IrNode> children) {
        return new IrChoice(children.get(0), children.get(1));
    }
}
