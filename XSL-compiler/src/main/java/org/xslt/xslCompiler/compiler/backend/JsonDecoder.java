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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.xslt.xslCompiler.compiler.errors.CompilationError;
import org.xslt.xslCompiler.ir.IrFactory;
import org.xslt.xslCompiler.ir.IrLiteral;
import org.xslt.xslCompiler.ir.IrName;
import org.xslt.xslCompiler.ir.IrNode;
import org.xslt.xslCompiler.ir.IrReference;
import org.xslt.xslCompiler.ir.IrTypeDescriptor;
import org.xslt.xslCompiler.ir.NodeKind;
import org.xslt.util.Utilities;

import javax.annotation.Nullable;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/** Rebuilds an IR graph from the JSON produced by {@link ToJsonVisitor}.
 *
 * <p>Binders are allocated before anything else is decoded, so that references
 * which precede the definition, or which occur inside it, resolve to the same
 * object as the definition.  Malformed input is reported as a {@link CompilationError}.
 * A decoder instance is used for a single document. */
public class JsonDecoder {
    static class Cache {
        final Map<Long, IrNode> decoded;

        Cache() {
            this.decoded = new HashMap<>();
        }

        public IrNode lookup(long id, JsonNode node) {
            IrNode result = this.decoded.get(id);
            if (result == null)
                throw new CompilationError("Could not find node with id " + id + ": " + Utilities.toDepth(node, 1));
            return result;
        }

        public boolean contains(long id) {
            return this.decoded.containsKey(id);
        }

        public void cache(long originalId, IrNode result) {
            if (this.decoded.containsKey(originalId))
                throw new CompilationError("Duplicate node id " + originalId);
            this.decoded.put(originalId, result);
        }
    }

    /** Binders, by their id in the document; allocated in the first phase. */
    final Cache binders;
    /** All nodes decoded so far, by their id in the document. */
    final Cache nodes;

    public JsonDecoder() {
        this.binders = new Cache();
        this.nodes = new Cache();
    }

    /** Parse and decode a JSON document. */
    public IrNode decode(String json) {
        ObjectMapper mapper = Utilities.deterministicObjectMapper();
        JsonNode tree;
        try {
            tree = mapper.readTree(json);
        } catch (JsonProcessingException ex) {
            throw new CompilationError("Malformed JSON: " + ex.getOriginalMessage(), ex);
        }
        return this.decode(tree);
    }

    public IrNode decode(JsonNode tree) {
        this.allocateBinders(tree);
        IrNode result = this.decodeNode(tree);
        if (result == null)
            throw new CompilationError("Document does not contain a node");
        return result;
    }

    static NodeKind getKind(JsonNode node) {
        String kind = Utilities.getStringProperty(node, "kind");
        try {
            return NodeKind.valueOf(kind);
        } catch (IllegalArgumentException ex) {
            throw new CompilationError("Unknown node kind " + Utilities.singleQuote(kind), ex);
        }
    }

    static List<JsonNode> getChildren(JsonNode node) {
        JsonNode children = Utilities.getProperty(node, "children");
        if (!children.isArray())
            throw new CompilationError("'children' is not an array: " + Utilities.toDepth(node, 1));
        List<JsonNode> result = new ArrayList<>(children.size());
        children.forEach(result::add);
        return result;
    }

    /** First phase: create all binders, with empty children. */
    void allocateBinders(JsonNode node) {
        if (node.isNull())
            return;
        if (!node.isObject())
            throw new CompilationError("Expected a JSON object, got " + Utilities.toDepth(node, 1));
        if (node.has("ref") || node.has("node"))
            return;
        NodeKind kind = getKind(node);
        List<JsonNode> children = getChildren(node);
        if (kind.isBinder()) {
            long id = Utilities.getLongProperty(node, "id");
            this.checkArity(kind, children.size(), node);
            IrNode binder = IrFactory.create(kind, Collections.nCopies(children.size(), null));
            JsonNode name = node.get("name");
            if (name != null)
                binder.to(IrReference.class).setDebugName(name.asText());
            this.binders.cache(id, binder);
        }
        for (JsonNode child: children)
            this.allocateBinders(child);
    }

    void checkArity(NodeKind kind, int count, JsonNode node) {
        if (kind.getShape().isFixed() && kind.getArity() != count)
            throw new CompilationError("Node of kind " + kind + " must have " + kind.getArity() +
                    " children, but has " + count + ": " + Utilities.toDepth(node, 1));
    }

    /** Second phase: decode the graph, filling in the binders. */
    @Nullable
    IrNode decodeNode(JsonNode node) {
        if (node.isNull())
            return null;
        JsonNode ref = node.get("ref");
        if (ref != null)
            return this.binders.lookup(ref.asLong(), node);
        JsonNode seen = node.get("node");
        if (seen != null)
            return this.nodes.lookup(seen.asLong(), node);

        NodeKind kind = getKind(node);
        long id = Utilities.getLongProperty(node, "id");
        List<IrNode> children = new ArrayList<>();
        for (JsonNode child: getChildren(node))
            children.add(this.decodeNode(child));
        this.checkArity(kind, children.size(), node);

        IrNode result;
        if (kind.isBinder()) {
            result = this.binders.lookup(id, node);
            for (int i = 0; i < children.size(); i++)
                result.setChild(i, children.get(i));
        } else if (kind == NodeKind.LITERAL_QNAME) {
            result = new IrName(
                    Utilities.getStringProperty(node, "local"),
                    Utilities.getStringProperty(node, "namespace"),
                    Utilities.getStringProperty(node, "prefix"));
        } else if (kind.getFamily() == NodeKind.Family.LITERAL && kind.getArity() == 0 &&
                kind != NodeKind.TRUE && kind != NodeKind.FALSE) {
            result = new IrLiteral(kind, this.decodeValue(kind, node));
        } else {
            result = IrFactory.create(kind, children);
        }
        this.nodes.cache(id, result);
        return result;
    }

    Object decodeValue(NodeKind kind, JsonNode node) {
        JsonNode value = Utilities.getProperty(node, "value");
        try {
            switch (kind) {
                case LITERAL_STRING:
                    return value.asText();
                case LITERAL_INT32:
                    if (!value.isIntegralNumber() || !value.canConvertToInt())
                        throw new CompilationError("Not a 32-bit integer: " + value);
                    return value.asInt();
                case LITERAL_INT64:
                    if (!value.isIntegralNumber() || !value.canConvertToLong())
                        throw new CompilationError("Not a 64-bit integer: " + value);
                    return value.asLong();
                case LITERAL_DOUBLE:
                    return Double.parseDouble(value.asText());
                case LITERAL_DECIMAL:
                    return new BigDecimal(value.asText());
                case LITERAL_TYPE:
                    return new IrTypeDescriptor(value.asText());
                default:
                    throw new CompilationError("Cannot decode a literal of kind " + kind);
            }
        } catch (NumberFormatException ex) {
            throw new CompilationError("Illegal value for " + kind + ": " + value, ex);
        }
    }
}
