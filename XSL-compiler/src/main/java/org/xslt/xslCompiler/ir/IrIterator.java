package org.xslt.xslCompiler.ir;

import javax.annotation.Nullable;
import java.util.Collections;
import java.util.List;

/** A FOR variable, bound to each item of its binding in turn, or a LET variable,
 * bound to the whole value of its binding. */
public class IrIterator extends IrReference {
    public IrIterator(NodeKind kind, @Nullable IrNode binding) {
        super(kind, Collections.singletonList(binding));
        checkKind(kind, NodeKind.FOR, NodeKind.LET);
    }

    public IrNode getBinding() {
        return this.getRequiredChild(0);
    }

    public void setBinding(IrNode binding) {
        this.setChild(0, binding);
    }

    @Override
    public IrNode withChildren(List<IrNode> children) {
        return this.copyDebugInfo(new IrIterator(this.kind, children.get(0)));
    }
}
