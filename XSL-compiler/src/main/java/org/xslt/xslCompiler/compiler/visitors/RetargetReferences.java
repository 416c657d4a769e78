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
import org.xslt.xslCompiler.compiler.errors.InternalCompilerError;
import org.xslt.xslCompiler.ir.IrNode;
import org.xslt.util.IWritesLogs;
import org.xslt.util.Logger;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/** Rebuilds a graph so that no reference points to a binder which has been replaced.
 *
 * <p>A rewrite may replace a binder after some references to it were already
 * rebuilt, e.g., a function that invokes itself or a function invoked before it
 * is defined.  Every binder whose definition mentions such a stale binder,
 * directly or through other affected binders, must be rebuilt too.  Since these
 * binders may refer to each other in a cycle, the replacements are allocated
 * first and their children are filled in afterwards. */
public class RetargetReferences extends IrVisitor implements IWritesLogs {
    /** Binder to its final replacement. */
    final Map<IrNode, IrNode> substitutions;
    /** Binders of the graph being rebuilt, to their unfilled replacements. */
    final Map<IrNode, IrNode> shells;
    final Map<IrNode, IrNode> rebuilt;

    public RetargetReferences(XslCompiler compiler, Map<IrNode, IrNode> substitutions) {
        super(compiler);
        this.substitutions = new IdentityHashMap<>(substitutions);
        this.shells = new IdentityHashMap<>();
        this.rebuilt = new IdentityHashMap<>();
    }

    @Override
    public void startVisit(IrNode node) {
        super.startVisit(node);
        BinderDependencies dependencies = new BinderDependencies(this.compiler);
        dependencies.apply(node);

        Set<IrNode> affected = Collections.newSetFromMap(new IdentityHashMap<>());
        boolean changed = true;
        while (changed) {
            changed = false;
            for (IrNode binder: dependencies.getBinders()) {
                if (affected.contains(binder))
                    continue;
                for (IrNode used: dependencies.getDependencies(binder)) {
                    if (this.substitutions.containsKey(used) || affected.contains(used)) {
                        affected.add(binder);
                        changed = true;
                        break;
                    }
                }
            }
        }

        for (IrNode binder: affected) {
            IrNode shell = binder.withChildren(binder.getChildren());
            this.shells.put(binder, shell);
        }
        for (Map.Entry<IrNode, IrNode> entry: this.substitutions.entrySet()) {
            IrNode shell = this.shells.get(entry.getValue());
            if (shell != null)
                entry.setValue(shell);
        }
        this.substitutions.putAll(this.shells);
        Logger.INSTANCE.belowLevel(this, 2)
                .append("Retargeting references to ")
                .append(this.substitutions.size())
                .append(" binders")
                .newline();
    }

    @Nullable
    @Override
    public IrNode visit(@Nullable IrNode node) {
        if (node == null)
            return this.visitNull();
        IrNode done = this.rebuilt.get(node);
        if (done != null)
            return done;

        IrNode shell = this.shells.get(node);
        if (shell != null) {
            this.rebuilt.put(node, shell);
            this.push(node);
            for (int i = 0; i < node.getChildCount(); i++)
                shell.setChild(i, this.rebuildChild(node, i));
            this.pop(node);
            Logger.INSTANCE.belowLevel(this, 1)
                    .appendSupplier(this::toString)
                    .append(":")
                    .appendSupplier(node::toString)
                    .append(" -> ")
                    .appendSupplier(shell::toString)
                    .newline();
            return shell;
        }

        this.push(node);
        List<IrNode> children = new ArrayList<>(node.getChildCount());
        boolean changed = false;
        for (int i = 0; i < node.getChildCount(); i++) {
            IrNode child = node.getChild(i);
            IrNode result = this.rebuildChild(node, i);
            changed = changed || result != child;
            children.add(result);
        }
        this.pop(node);
        IrNode result = node;
        if (changed) {
            if (node.isBinder())
                throw new InternalCompilerError("Binder changed without being retargeted", node);
            result = node.withChildren(children);
        }
        this.rebuilt.put(node, result);
        return result;
    }

    @Nullable
    IrNode rebuildChild(IrNode parent, int index) {
        IrNode child = parent.getChild(index);
        if (this.isReference(parent, index))
            return this.visitReference(child);
        return this.visit(child);
    }

    @Nullable
    @Override
    protected IrNode visitReference(@Nullable IrNode node) {
        if (node == null)
            return this.visitNull();
        return this.substitutions.getOrDefault(node, node);
    }
}
