package org.xslt.xslCompiler.ir;

import javax.annotation.Nullable;
import java.util.Arrays;
import java.util.List;

/** A global or formal parameter.  Both the default value and the name are optional. */
public class IrParameter extends IrReference {
    public IrParameter(@Nullable IrNode defaultValue, @Nullable IrNode name) {
        super(NodeKind.PARAMETER, Arrays.asList(defaultValue, name));
    }

    @Nullable
    public IrNode getDefaultValue() {
        return this.getChild(0);
    }

    @Nullable
    public IrName getName() {
        IrNode name = this.getChild(1);
        if (name == null)
            return null;
        return name.to(IrName.class);
    }

    @Override
    public IrNode withChildren(List<IrNode> children) {
        return this.copyDebugInfo(new IrParameter(children.get(0), children.get(1)));
    }
}
