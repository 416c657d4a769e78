package org.xslt.xslCompiler.ir;

import javax.annotation.Nullable;
import java.util.List;

/** LOOP, FILTER and SORT: the first child defines an iteration variable,
 * the second child (body, predicate or sort key list) uses it. */
public class IrLoop extends IrBinary {
    public IrLoop(NodeKind kind, @Nullable IrNode variable, @Nullable IrNode body) {
        super(kind, variable, body);
        checkKind(kind, NodeKind.LOOP, NodeKind.FILTER, NodeKind.SORT);
    }

    public IrIterator getVariable() {
        return this.getLeft().to(IrIterator.class);
    }

    public IrNode getBody() {
        return this.getRight();
    }

    @Override
    public IrNode withChildren(List<IrNode> children) {
        return new IrLoop(this.kind, children.get(0), children.get(1));
    }
}
