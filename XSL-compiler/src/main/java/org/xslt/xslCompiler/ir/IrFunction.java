package org.xslt.xslCompiler.ir;

import javax.annotation.Nullable;
import java.util.Arrays;
import java.util.List;

/** A function definition.
 * Children: the formal parameter list, the body, and a boolean literal telling
 * whether the body has side effects.  The body may be filled in after
 * allocation, so that a function can invoke itself. */
public class IrFunction extends IrReference {
    public IrFunction(@Nullable IrNode arguments, @Nullable IrNode definition, @Nullable IrNode sideEffects) {
        super(NodeKind.FUNCTION, Arrays.asList(arguments, definition, sideEffects));
    }

    public IrList getArguments() {
        return this.getRequiredChild(0).to(IrList.class);
    }

    public IrNode getDefinition() {
        return this.getRequiredChild(1);
    }

    public void setDefinition(IrNode definition) {
        this.setChild(1, definition);
    }

    public boolean hasSideEffects() {
        IrNode sideEffects = this.getChild(2);
        return sideEffects != null && sideEffects.getKind() == NodeKind.TRUE;
    }

    @Override
    public IrNode withChildren(List<IrNode> children) {
        return this.copyDebugInfo(new IrFunction(children.get(0), children.get(1), children.get(2)));
    }
}
