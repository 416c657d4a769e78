package org.xslt.xslCompiler.compiler.visitors;

import org.xslt.xslCompiler.compiler.XslCompiler;
import org.xslt.xslCompiler.ir.IrFunction;
import org.xslt.xslCompiler.ir.IrIterator;
import org.xslt.xslCompiler.ir.IrNode;
import org.xslt.xslCompiler.ir.IrParameter;
import org.xslt.util.Logger;

import javax.annotation.Nullable;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Map;
import java.util.Set;

/** Counts the references to each binder and records which binders are defined. */
public class ReferenceCounter extends IrVisitor {
    final Set<IrNode> defined;
    final Map<IrNode, Integer> references;

    public ReferenceCounter(XslCompiler compiler) {
        super(compiler);
        this.defined = Collections.newSetFromMap(new IdentityHashMap<>());
        this.references = new IdentityHashMap<>();
    }

    public boolean isDefined(IrNode binder) {
        return this.defined.contains(binder);
    }

    public int getReferenceCount(IrNode binder) {
        return this.references.getOrDefault(binder, 0);
    }

    /** Binders which are referenced but never defined in the graph visited. */
    public Set<IrNode> getUndefined() {
        Set<IrNode> result = Collections.newSetFromMap(new IdentityHashMap<>());
        for (IrNode binder: this.references.keySet())
            if (!this.defined.contains(binder))
                result.add(binder);
        return result;
    }

    @Nullable
    @Override
    public IrNode visit(@Nullable IrNode node) {
        if (node != null && node.isBinder())
            this.defined.add(node);
        return super.visit(node);
    }

    IrNode count(IrNode binder) {
        this.references.merge(binder, 1, Integer::sum);
        return binder;
    }

    @Override
    protected IrNode visitForReference(IrIterator node) {
        return this.count(node);
    }

    @Override
    protected IrNode visitLetReference(IrIterator node) {
        return this.count(node);
    }

    @Override
    protected IrNode visitParameterReference(IrParameter node) {
        return this.count(node);
    }

    @Override
    protected IrNode visitFunctionReference(IrFunction node) {
        return this.count(node);
    }

    @Override
    public void endVisit() {
        Logger.INSTANCE.belowLevel(this, 2)
                .append(this.defined.size())
                .append(" binders defined, ")
                .append(this.references.size())
                .append(" referenced")
                .newline();
    }
}
