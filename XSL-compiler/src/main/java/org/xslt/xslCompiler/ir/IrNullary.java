package org.xslt.xslCompiler.ir;

import java.util.List;

/** A node without children and without payload: true, false, the XML context. */
public class IrNullary extends IrNode {
    public IrNullary(NodeKind kind) {
        super(kind);
        checkKind(kind, NodeKind.TRUE, NodeKind.FALSE, NodeKind.XML_CONTEXT);
    }

    @Override
    public IrNode withChildren(List<IrNode> children) {
        return new IrNullary(this.kind);
    }
}
