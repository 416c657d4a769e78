package org.xslt.xslCompiler.ir;

import javax.annotation.Nullable;
import java.util.List;

/** An external document, given by name and base URI. */
public class IrDataSource extends IrBinary {
    public IrDataSource(@Nullable IrNode name, @Nullable IrNode baseUri) {
        super(NodeKind.DATA_SOURCE, name, baseUri);
    }

    public IrNode getName() {
        return this.getLeft();
    }

    public IrNode getBaseUri() {
        return this.getRight();
    }

    @Override
    public IrNode withChildren(List<IrNode> children) {
        return new IrDataSource(children.get(0), children.get(1));
    }
}
