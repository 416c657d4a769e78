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

package org.xslt.xslCompiler.compiler.backend;

import org.xslt.xslCompiler.compiler.XslCompiler;
import org.xslt.xslCompiler.compiler.errors.UnimplementedException;
import org.xslt.xslCompiler.compiler.visitors.IrVisitor;
import org.xslt.xslCompiler.ir.IrLiteral;
import org.xslt.xslCompiler.ir.IrName;
import org.xslt.xslCompiler.ir.IrNode;
import org.xslt.xslCompiler.ir.IrReference;
import org.xslt.util.IndentStream;
import org.xslt.util.JsonStream;

import javax.annotation.Nullable;
import java.util.HashSet;
import java.util.Set;

/** Serializes an IR graph as JSON.
 *
 * <p>A node is written as an object with "kind", "id", its payload and a
 * "children" array; absent children are written as null.  A reference to a
 * binder is written as {"ref": id}, and a node which was already written
 * as {"node": id}, so the shape of the graph survives a round trip through
 * {@link JsonDecoder}. */
public class ToJsonVisitor extends IrVisitor {
    public final JsonStream stream;
    final Set<Long> serialized;

    public ToJsonVisitor(XslCompiler compiler, JsonStream stream) {
        super(compiler);
        this.stream = stream;
        this.serialized = new HashSet<>();
    }

    /** JSON representation of the graph rooted at the specified node. */
    public static String toJson(XslCompiler compiler, IrNode root) {
        JsonStream stream = new JsonStream(new IndentStream(new StringBuilder()));
        ToJsonVisitor visitor = new ToJsonVisitor(compiler, stream);
        visitor.apply(root);
        return stream.toString();
    }

    void property(String name) {
        this.stream.label(name);
    }

    boolean checkDone(IrNode node) {
        if (this.serialized.contains(node.getId())) {
            this.stream.beginObject()
                    .label("node")
                    .append(node.getId())
                    .endObject();
            return true;
        }
        return false;
    }

    @Nullable
    @Override
    public IrNode visit(@Nullable IrNode node) {
        if (node == null)
            return this.visitNull();
        if (this.checkDone(node))
            return node;
        this.serialized.add(node.getId());
        this.stream.beginObject();
        this.property("kind");
        this.stream.append(node.getKind().name());
        this.property("id");
        this.stream.append(node.getId());
        this.writePayload(node);
        super.visit(node);
        this.stream.endObject();
        return node;
    }

    void writePayload(IrNode node) {
        IrReference reference = node.as(IrReference.class);
        if (reference != null && reference.getDebugName() != null) {
            this.property("name");
            this.stream.append(reference.getDebugName());
            return;
        }
        IrName name = node.as(IrName.class);
        if (name != null) {
            this.property("local");
            this.stream.append(name.localName);
            this.property("namespace");
            this.stream.append(name.namespaceUri);
            this.property("prefix");
            this.stream.append(name.prefix);
            return;
        }
        IrLiteral literal = node.as(IrLiteral.class);
        if (literal == null)
            return;
        switch (literal.getKind()) {
            case LITERAL_STRING:
                this.property("value");
                this.stream.append(literal.getString());
                break;
            case LITERAL_INT32:
                this.property("value");
                this.stream.append(literal.getInt32());
                break;
            case LITERAL_INT64:
                this.property("value");
                this.stream.append(literal.getInt64());
                break;
            case LITERAL_DOUBLE:
                // As a string, since JSON has no NaN or infinities
                this.property("value");
                this.stream.append(Double.toString(literal.getDouble()));
                break;
            case LITERAL_DECIMAL:
                this.property("value");
                this.stream.append(literal.getDecimal().toString());
                break;
            case LITERAL_TYPE:
                this.property("value");
                this.stream.append(literal.getTypeDescriptor().code);
                break;
            default:
                throw new UnimplementedException("Cannot serialize a literal of kind " + literal.getKind(), node);
        }
    }

    @Override
    protected IrNode visitChildren(IrNode parent) {
        this.property("children");
        this.stream.beginArray();
        super.visitChildren(parent);
        this.stream.endArray();
        return parent;
    }

    @Nullable
    @Override
    protected IrNode visitNull() {
        this.stream.appendNull();
        return null;
    }

    @Nullable
    @Override
    protected IrNode visitReference(@Nullable IrNode node) {
        if (node == null)
            return this.visitNull();
        this.stream.beginObject()
                .label("ref")
                .append(node.getId())
                .endObject();
        return node;
    }
}
