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

import org.xslt.xslCompiler.compiler.CompilerOptions;
import org.xslt.xslCompiler.compiler.ICompilerComponent;
import org.xslt.xslCompiler.compiler.XslCompiler;
import org.xslt.xslCompiler.compiler.errors.CompilationError;
import org.xslt.xslCompiler.compiler.errors.InputTooComplexException;
import org.xslt.xslCompiler.compiler.errors.InternalCompilerError;
import org.xslt.xslCompiler.ir.IrNode;
import org.xslt.util.IWritesLogs;
import org.xslt.util.Logger;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.Map;
import java.util.Set;

/** Rejects graphs which are nested too deeply for the passes that follow,
 * which all recurse on the Java stack.
 *
 * <p>The root is at depth 0 and each child is one level deeper than its parent;
 * a node deeper than the maximum fails the check.  A binder is expanded only at
 * its first occurrence, whether that occurrence is the definition or a use;
 * later occurrences are considered already checked.  This also stops the walk
 * on recursive functions.
 *
 * <p>A shared node which is not a binder is expanded again only when it is
 * reached deeper than before, since its descendants then sit deeper too.  Each
 * node is thus expanded at most once per depth, and a DAG with many levels of
 * sharing is checked in time proportional to its size times the bound.
 *
 * <p>The check itself keeps its work list on the heap, so it works for any bound.
 * An instance can check a single graph. */
public class ComplexityCheck implements IrTransform, IWritesLogs, ICompilerComponent {
    final XslCompiler compiler;
    final int maxDepth;
    final Set<IrNode> visitedBinders;
    /** Deepest level at which each shared non-binder was expanded. */
    final Map<IrNode, Integer> expandedAt;
    boolean used;

    static final class Frame {
        final IrNode node;
        final int depth;

        Frame(IrNode node, int depth) {
            this.node = node;
            this.depth = depth;
        }
    }

    public ComplexityCheck(XslCompiler compiler, int maxDepth) {
        if (maxDepth <= 0)
            throw new InternalCompilerError("Maximum depth must be positive, not " + maxDepth);
        this.compiler = compiler;
        this.maxDepth = maxDepth;
        this.visitedBinders = Collections.newSetFromMap(new IdentityHashMap<>());
        this.expandedAt = new IdentityHashMap<>();
        this.used = false;
    }

    /** Uses the bound from the compiler options.
     * @throws CompilationError if the configured bound is not positive. */
    public ComplexityCheck(XslCompiler compiler) {
        this(compiler, configuredDepth(compiler));
    }

    static int configuredDepth(XslCompiler compiler) {
        int maxDepth = compiler.options.languageOptions.maxDepth;
        if (maxDepth <= 0)
            throw new CompilationError("Invalid options: option --maxDepth must be positive, not " + maxDepth);
        return maxDepth;
    }

    @Override
    public XslCompiler compiler() {
        return this.compiler;
    }

    /** Check the graph if the compiler options enable the complexity limit. */
    public static void checkIfEnabled(XslCompiler compiler, IrNode root) {
        CompilerOptions.Language options = compiler.options.languageOptions;
        if (!options.enforceComplexityLimit)
            return;
        new ComplexityCheck(compiler).check(root);
    }

    /** Walk the graph in preorder.
     * @throws InputTooComplexException if some node is deeper than the maximum. */
    public void check(IrNode root) {
        if (this.used)
            throw new InternalCompilerError("ComplexityCheck can only be used once", root);
        this.used = true;

        int nodes = 0;
        int deepest = 0;
        Deque<Frame> stack = new ArrayDeque<>();
        stack.push(new Frame(root, 0));
        while (!stack.isEmpty()) {
            Frame frame = stack.pop();
            IrNode node = frame.node;
            if (frame.depth > this.maxDepth) {
                Logger.INSTANCE.belowLevel(this, 1)
                        .append("Depth limit exceeded at ")
                        .append(node)
                        .newline();
                throw new InputTooComplexException(this.maxDepth);
            }
            if (node.isBinder()) {
                if (!this.visitedBinders.add(node))
                    continue;
            } else if (node.getChildCount() > 0) {
                Integer previous = this.expandedAt.get(node);
                if (previous != null && previous >= frame.depth)
                    continue;
                this.expandedAt.put(node, frame.depth);
            }
            nodes++;
            deepest = Math.max(deepest, frame.depth);
            // Children are pushed in reverse so that they are popped in order.
            for (int i = node.getChildCount() - 1; i >= 0; i--) {
                IrNode child = node.getChild(i);
                if (child != null)
                    stack.push(new Frame(child, frame.depth + 1));
            }
        }
        Logger.INSTANCE.belowLevel(this, 2)
                .append("Checked ")
                .append(nodes)
                .append(" nodes, depth ")
                .append(deepest)
                .newline();
    }

    /** Checks the graph and returns it unchanged. */
    @Override
    public IrNode apply(IrNode root) {
        this.check(root);
        return root;
    }

    @Override
    public String toString() {
        return "ComplexityCheck(" + this.maxDepth + ")";
    }
}
