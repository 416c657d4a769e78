package org.xslt.xslCompiler.ir;

import javax.annotation.Nullable;
import java.util.Arrays;
import java.util.List;

/** An ordered list of children; used for the meta lists, sequences and unknown nodes. */
public class IrList extends IrNode {
    public IrList(NodeKind kind, List<IrNode> children) {
        super(kind, children);
        checkShape(kind, NodeKind.Shape.LIST);
    }

    public IrList(NodeKind kind, IrNode... children) {
        this(kind, Arrays.asList(children));
    }

    /** Append a child.  Only legal while the graph is still under construction. */
    public IrList add(@Nullable IrNode child) {
        this.children.add(child);
        return this;
    }

    @Override
    public IrNode withChildren(List<IrNode> children) {
        return new IrList(this.kind, children);
    }
}
