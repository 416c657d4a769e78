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

package org.xslt.xslCompiler.ir;

import org.xslt.xslCompiler.compiler.errors.InternalCompilerError;
import org.xslt.util.ICastable;
import org.xslt.util.IHasId;
import org.xslt.util.IIndentStream;
import org.xslt.util.IndentStream;
import org.xslt.util.ToIndentableString;
import org.xslt.util.Utilities;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/** Base class for all IR nodes.
 *
 * <p>Nodes have reference identity: two nodes are the same only if they are the
 * same Java object.  {@link #equals} and {@link #hashCode} are not overridden.
 * Binder nodes ({@link NodeKind#isBinder()}) are allocated once and linked from
 * every place that uses them, so the graph is a DAG and not a tree.
 *
 * <p>The children are essentially final.  {@link #setChild} may only be
 * called while the graph is still being built, e.g., to close the loop of a
 * function which invokes itself.  Passes never mutate nodes; they build new ones.
 *
 * <p>A child may be null; this marks an absent optional operand. */
public abstract class IrNode implements ICastable, IHasId, ToIndentableString {
    static final AtomicLong nextId = new AtomicLong();

    public final long id;
    protected final NodeKind kind;
    protected final List<IrNode> children;

    protected IrNode(NodeKind kind, List<IrNode> children) {
        this.id = nextId.getAndIncrement();
        this.kind = kind;
        NodeKind.Shape shape = kind.getShape();
        if (shape.isFixed() && children.size() != shape.arity)
            throw new InternalCompilerError("Node of kind " + kind + " must have " + shape.arity +
                    " children, but " + children.size() + " were supplied");
        this.children = new ArrayList<>(children);
    }

    protected IrNode(NodeKind kind, IrNode... children) {
        this(kind, Arrays.asList(children));
    }

    public NodeKind getKind() {
        return this.kind;
    }

    @Override
    public long getId() {
        return this.id;
    }

    public int getChildCount() {
        return this.children.size();
    }

    /** The child with the specified index; null if the slot is empty. */
    @Nullable
    public IrNode getChild(int index) {
        this.checkIndex(index);
        return this.children.get(index);
    }

    /** Child that the builder must have provided. */
    public IrNode getRequiredChild(int index) {
        return this.checkNull(this.getChild(index));
    }

    /** Unmodifiable view of the children. */
    public List<IrNode> getChildren() {
        return Collections.unmodifiableList(this.children);
    }

    /** Set a child.  Only legal while the graph is still under construction. */
    public void setChild(int index, @Nullable IrNode child) {
        this.checkIndex(index);
        this.children.set(index, child);
    }

    void checkIndex(int index) {
        if (index < 0 || index >= this.children.size())
            throw new InternalCompilerError("Child index " + index + " out of range for " + this +
                    " with " + this.children.size() + " children", this);
    }

    /** A new node with the same kind and payload as this one, but with different children.
     * Binder nodes keep their debugging name. */
    public abstract IrNode withChildren(List<IrNode> children);

    public boolean isBinder() {
        return this.kind.isBinder();
    }

    public <T> T checkNull(@Nullable T value) {
        if (value == null)
            throw new InternalCompilerError("Did not expect a null value", this);
        return value;
    }

    /** Kinds accepted by a node class; called by constructors. */
    protected static void checkKind(NodeKind kind, NodeKind... allowed) {
        for (NodeKind k: allowed)
            if (k == kind)
                return;
        throw new InternalCompilerError("Unexpected node kind " + kind + ", expected one of " + Arrays.toString(allowed));
    }

    /** Called by the constructors of the generic shape classes: a kind with a dedicated
     * node class may only be built by that class or by {@link IrFactory#create}. */
    protected void checkGeneric(Class<? extends IrNode> genericClass) {
        if (this.getClass() == genericClass && this.kind.hasDedicatedClass())
            throw new InternalCompilerError("Node of kind " + this.kind + " cannot be built as a " +
                    genericClass.getSimpleName() + "; use IrFactory.create");
    }

    protected static void checkShape(NodeKind kind, NodeKind.Shape shape) {
        Utilities.enforce(kind.getShape() == shape,
                "Node kind " + kind + " has shape " + kind.getShape() + ", not " + shape);
    }

    /** Print the data held by the node, other than the children. */
    protected IIndentStream appendPayload(IIndentStream builder) {
        return builder;
    }

    /** Prints only this node, never its children, so it is safe on cyclic reference chains. */
    @Override
    public IIndentStream toString(IIndentStream builder) {
        builder.append(this.kind.name())
                .append("#")
                .append(this.id);
        return this.appendPayload(builder);
    }

    @Override
    public String toString() {
        IndentStream stream = new IndentStream(new StringBuilder());
        this.toString(stream);
        return stream.toString();
    }
}
