package org.xslt.xslCompiler.compiler.visitors;

import org.xslt.xslCompiler.compiler.XslCompiler;
import org.xslt.xslCompiler.ir.IrFunction;
import org.xslt.xslCompiler.ir.IrIterator;
import org.xslt.xslCompiler.ir.IrNode;
import org.xslt.xslCompiler.ir.IrParameter;
import org.xslt.util.Utilities;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/** For each binder definition, the binders referenced from inside it,
 * including from definitions nested within it. */
public class BinderDependencies extends IrVisitor {
    final Map<IrNode, Set<IrNode>> dependencies;
    final List<IrNode> open;

    public BinderDependencies(XslCompiler compiler) {
        super(compiler);
        this.dependencies = new IdentityHashMap<>();
        this.open = new ArrayList<>();
    }

    /** Binders whose definitions were found. */
    public Set<IrNode> getBinders() {
        return Collections.unmodifiableSet(this.dependencies.keySet());
    }

    /** Binders referenced from the definition of the specified binder. */
    public Set<IrNode> getDependencies(IrNode binder) {
        return Collections.unmodifiableSet(Utilities.getExists(this.dependencies, binder));
    }

    @Nullable
    @Override
    public IrNode visit(@Nullable IrNode node) {
        if (node == null || !node.isBinder())
            return super.visit(node);
        this.dependencies.computeIfAbsent(node, k -> Collections.newSetFromMap(new IdentityHashMap<>()));
        this.open.add(node);
        IrNode result = super.visit(node);
        Utilities.removeLast(this.open);
        return result;
    }

    IrNode referenced(IrNode binder) {
        for (IrNode b: this.open)
            this.dependencies.get(b).add(binder);
        return binder;
    }

    @Override
    protected IrNode visitForReference(IrIterator node) {
        return this.referenced(node);
    }

    @Override
    protected IrNode visitLetReference(IrIterator node) {
        return this.referenced(node);
    }

    @Override
    protected IrNode visitParameterReference(IrParameter node) {
        return this.referenced(node);
    }

    @Override
    protected IrNode visitFunctionReference(IrFunction node) {
        return this.referenced(node);
    }
}
