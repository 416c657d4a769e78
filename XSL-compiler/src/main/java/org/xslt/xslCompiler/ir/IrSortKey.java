package org.xslt.xslCompiler.ir;

import javax.annotation.Nullable;
import java.util.List;

public class IrSortKey extends IrBinary {
    public IrSortKey(@Nullable IrNode key, @Nullable IrNode collation) {
        super(NodeKind.SORT_KEY, key, collation);
    }

    public IrNode getKey() {
        return this.getLeft();
    }

    public IrNode getCollation() {
        return this.getRight();
    }

    @Override
    public IrNode withChildren(List<IrNode> children) {
        return new IrSortKey(children.get(0), children.get(1));
    }
}
