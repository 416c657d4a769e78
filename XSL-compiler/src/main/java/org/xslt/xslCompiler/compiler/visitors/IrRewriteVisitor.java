/*
 * Copyright 2022 VMware, Inc.
 * SPDX-License-Identifier: MIT
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all
 * copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 */

package org.xslt.xslCompiler.compiler.visitors;

import org.xslt.xslCompiler.compiler.XslCompiler;
import org.xslt.xslCompiler.ir.IrFunction;
import org.xslt.xslCompiler.ir.IrIterator;
import org.xslt.xslCompiler.ir.IrNode;
import org.xslt.xslCompiler.ir.IrParameter;
import org.xslt.util.IWritesLogs;
import org.xslt.util.Logger;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/** Base class for passes which build a new graph from an old one.
 *
 * <p>Each handler returns the node that replaces its argument.  By default a
 * node is rebuilt only if one of its children was replaced, so unchanged
 * subgraphs keep their identity.  If {@link #force} is set every node is rebuilt.
 *
 * <p>A node reached twice through definition edges is rewritten once.  When the
 * definition of a binder is replaced by another binder, all references to the
 * old binder are retargeted to the new one, including references which were
 * visited before the definition. */
public abstract class IrRewriteVisitor extends IrVisitor implements IWritesLogs {
    protected final boolean force;
    /** Old binder to the binder which replaces it. */
    protected final Map<IrNode, IrNode> substitutions;
    /** Result of rewriting each node reached through a definition edge. */
    protected final Map<IrNode, IrNode> rewritten;

    protected IrRewriteVisitor(XslCompiler compiler, boolean force) {
        super(compiler);
        this.force = force;
        this.substitutions = new IdentityHashMap<>();
        this.rewritten = new IdentityHashMap<>();
    }

    @Override
    public IrNode apply(IrNode node) {
        IrNode result = super.apply(node);
        if (this.substitutions.isEmpty())
            return result;
        RetargetReferences retarget = new RetargetReferences(this.compiler, this.substitutions);
        return retarget.apply(result);
    }

    /** Record that 'old' is replaced by 'newNode'. */
    protected void map(IrNode old, IrNode newNode) {
        if (old == newNode)
            return;
        Logger.INSTANCE.belowLevel(this, 1)
                .appendSupplier(this::toString)
                .append(":")
                .appendSupplier(old::toString)
                .append(" -> ")
                .appendSupplier(newNode::toString)
                .newline();
    }

    @Nullable
    @Override
    public IrNode visit(@Nullable IrNode node) {
        if (node == null)
            return this.visitNull();
        IrNode done = this.rewritten.get(node);
        if (done != null)
            return done;
        IrNode result = super.visit(node);
        result = node.checkNull(result);
        this.rewritten.put(node, result);
        if (node.isBinder() && result != node && result.isBinder())
            this.substitutions.put(node, result);
        return result;
    }

    @Override
    protected IrNode visitChildren(IrNode parent) {
        this.push(parent);
        List<IrNode> children = new ArrayList<>(parent.getChildCount());
        boolean changed = false;
        for (int i = 0; i < parent.getChildCount(); i++) {
            IrNode child = parent.getChild(i);
            IrNode result;
            if (this.isReference(parent, i))
                result = this.visitReference(child);
            else
                result = this.visit(child);
            changed = changed || result != child;
            children.add(result);
        }
        this.pop(parent);
        if (!changed && !this.force)
            return parent;
        IrNode result = parent.withChildren(children);
        this.map(parent, result);
        return result;
    }

    /** The current replacement of a binder reached through a reference edge. */
    protected IrNode resolve(IrNode binder) {
        return this.substitutions.getOrDefault(binder, binder);
    }

    @Override
    protected IrNode visitForReference(IrIterator node) {
        return this.resolve(node);
    }

    @Override
    protected IrNode visitLetReference(IrIterator node) {
        return this.resolve(node);
    }

    @Override
    protected IrNode visitParameterReference(IrParameter node) {
        return this.resolve(node);
    }

    @Override
    protected IrNode visitFunctionReference(IrFunction node) {
        return this.resolve(node);
    }
}
