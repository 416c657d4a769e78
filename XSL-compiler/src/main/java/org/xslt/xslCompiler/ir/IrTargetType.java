package org.xslt.xslCompiler.ir;

import javax.annotation.Nullable;
import java.util.List;

/** Operators which relate a value to a type: TYPE_ASSERT, IS_TYPE, XSLT_CONVERT.
 * The second child is a {@link NodeKind#LITERAL_TYPE} literal. */
public class IrTargetType extends IrBinary {
    public IrTargetType(NodeKind kind, @Nullable IrNode source, @Nullable IrNode targetType) {
        super(kind, source, targetType);
        checkKind(kind, NodeKind.TYPE_ASSERT, NodeKind.IS_TYPE, NodeKind.XSLT_CONVERT);
    }

    public IrNode getSource() {
        return this.getLeft();
    }

    public IrTypeDescriptor getTargetType() {
        return this.getRight().to(IrLiteral.class).getTypeDescriptor();
    }

    @Override
    public IrNode withChildren(List<IrNode> children) {
        return new IrTargetType(this.kind, children.get(0), children.get(1));
    }
}
