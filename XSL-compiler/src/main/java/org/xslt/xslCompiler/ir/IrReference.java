package org.xslt.xslCompiler.ir;

import org.xslt.util.IIndentStream;

import javax.annotation.Nullable;
import java.util.Arrays;
import java.util.List;

/** Base class for binder nodes: iteration variables, let bindings, parameters and functions.
 * A binder is allocated once; every use of the name links to the same object.
 * Whether a particular link is the definition or a reference depends on the parent
 * holding it, not on the node itself. */
public abstract class IrReference extends IrNode {
    /** Name used only in dumps and error messages. */
    @Nullable
    protected String debugName;

    protected IrReference(NodeKind kind, List<IrNode> children) {
        super(kind, children);
        checkKind(kind, NodeKind.FOR, NodeKind.LET, NodeKind.PARAMETER, NodeKind.FUNCTION);
    }

    protected IrReference(NodeKind kind, IrNode... children) {
        this(kind, Arrays.asList(children));
    }

    @Nullable
    public String getDebugName() {
        return this.debugName;
    }

    public IrReference setDebugName(@Nullable String debugName) {
        this.debugName = debugName;
        return this;
    }

    /** Copy the debugging information from another binder; used by {@link #withChildren}. */
    protected <T extends IrReference> T copyDebugInfo(T result) {
        result.setDebugName(this.debugName);
        return result;
    }

    @Override
    protected IIndentStream appendPayload(IIndentStream builder) {
        if (this.debugName != null)
            builder.append(" $").append(this.debugName);
        return builder;
    }
}
