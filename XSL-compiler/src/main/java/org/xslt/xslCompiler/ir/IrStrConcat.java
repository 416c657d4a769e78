package org.xslt.xslCompiler.ir;

import javax.annotation.Nullable;
import java.util.List;

public class IrStrConcat extends IrBinary {
    public IrStrConcat(@Nullable IrNode delimiter, @Nullable IrNode values) {
        super(NodeKind.STR_CONCAT, delimiter, values);
    }

    public IrNode getDelimiter() {
        return this.getLeft();
    }

    public IrNode getValues() {
        return this.getRight();
    }

    @Override
    public IrNode withChildren(List<IrNode> children) {
        return new IrStrConcat(children.get(0), children.get(1));
    }
}
