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

import javax.annotation.Nullable;
import java.math.BigDecimal;
import java.util.Arrays;
import java.util.List;

/** Builds IR nodes.
 * {@link #create(NodeKind, List)} chooses the node class for a kind and can build
 * any node without a payload; the other methods are shortcuts for common constructs. */
public final class IrFactory {
    private IrFactory() {}

    public static IrNode create(NodeKind kind, IrNode... children) {
        return create(kind, Arrays.asList(children));
    }

    /** Build a node of the specified kind.
     * Literals with a payload cannot be built this way; use the literal methods.
     * For binder kinds the children may be null and filled in later. */
    public static IrNode create(NodeKind kind, List<IrNode> children) {
        NodeKind.Shape shape = kind.getShape();
        if (shape.isFixed() && children.size() != shape.arity)
            throw new InternalCompilerError("Node of kind " + kind + " must have " + shape.arity +
                    " children, but " + children.size() + " were supplied");
        switch (kind) {
            case PROGRAM:
                return new IrProgram(children.get(0), children.get(1), children.get(2), children.get(3));
            case FOR:
            case LET:
                return new IrIterator(kind, children.get(0));
            case PARAMETER:
                return new IrParameter(children.get(0), children.get(1));
            case FUNCTION:
                return new IrFunction(children.get(0), children.get(1), children.get(2));
            case LOOP:
            case FILTER:
            case SORT:
                return new IrLoop(kind, children.get(0), children.get(1));
            case INVOKE:
                return new IrInvoke(children.get(0), children.get(1));
            case SORT_KEY:
                return new IrSortKey(children.get(0), children.get(1));
            case TYPE_ASSERT:
            case IS_TYPE:
            case XSLT_CONVERT:
                return new IrTargetType(kind, children.get(0), children.get(1));
            case DATA_SOURCE:
                return new IrDataSource(children.get(0), children.get(1));
            case CHOICE:
                return new IrChoice(children.get(0), children.get(1));
            case STR_CONCAT:
                return new IrStrConcat(children.get(0), children.get(1));
            case XSLT_INVOKE_LATE_BOUND:
                return new IrInvokeLateBound(children.get(0), children.get(1));
            case XSLT_INVOKE_EARLY_BOUND:
                return new IrInvokeEarlyBound(children.get(0), children.get(1), children.get(2));
            case TRUE:
            case FALSE:
            case XML_CONTEXT:
                return new IrNullary(kind);
            case LITERAL_STRING:
            case LITERAL_INT32:
            case LITERAL_INT64:
            case LITERAL_DOUBLE:
            case LITERAL_DECIMAL:
            case LITERAL_QNAME:
            case LITERAL_TYPE:
            case LITERAL_OBJECT:
                throw new InternalCompilerError("Literal of kind " + kind + " needs a payload");
            default:
                break;
        }
        switch (shape) {
            case UNARY:
                return new IrUnary(kind, children.get(0));
            case BINARY:
                return new IrBinary(kind, children.get(0), children.get(1));
            case TERNARY:
                return new IrTernary(kind, children.get(0), children.get(1), children.get(2));
            case LIST:
                return new IrList(kind, children);
            default:
                throw new InternalCompilerError("Unexpected shape " + shape + " for " + kind);
        }
    }

    public static IrLiteral literal(String value) {
        return new IrLiteral(NodeKind.LITERAL_STRING, value);
    }

    public static IrLiteral literal(int value) {
        return new IrLiteral(NodeKind.LITERAL_INT32, value);
    }

    public static IrLiteral literal(long value) {
        return new IrLiteral(NodeKind.LITERAL_INT64, value);
    }

    public static IrLiteral literal(double value) {
        return new IrLiteral(NodeKind.LITERAL_DOUBLE, value);
    }

    public static IrLiteral literal(BigDecimal value) {
        return new IrLiteral(NodeKind.LITERAL_DECIMAL, value);
    }

    public static IrLiteral literal(IrTypeDescriptor type) {
        return new IrLiteral(NodeKind.LITERAL_TYPE, type);
    }

    public static IrLiteral literalObject(Object value) {
        return new IrLiteral(NodeKind.LITERAL_OBJECT, value);
    }

    public static IrName name(String localName, String namespaceUri, String prefix) {
        return new IrName(localName, namespaceUri, prefix);
    }

    public static IrNode bool(boolean value) {
        return new IrNullary(value ? NodeKind.TRUE : NodeKind.FALSE);
    }

    public static IrList list(NodeKind kind, IrNode... children) {
        return new IrList(kind, children);
    }

    public static IrIterator forVar(@Nullable IrNode binding) {
        return new IrIterator(NodeKind.FOR, binding);
    }

    public static IrIterator let(@Nullable IrNode binding) {
        return new IrIterator(NodeKind.LET, binding);
    }

    public static IrParameter parameter(@Nullable IrNode defaultValue, @Nullable IrName name) {
        return new IrParameter(defaultValue, name);
    }

    /** A function whose body is filled in later with {@link IrFunction#setDefinition}. */
    public static IrFunction function(IrList formals, boolean sideEffects) {
        return new IrFunction(formals, null, bool(sideEffects));
    }

    public static IrFunction function(IrList formals, IrNode definition, boolean sideEffects) {
        return new IrFunction(formals, definition, bool(sideEffects));
    }

    public static IrInvoke invoke(IrFunction function, IrNode... arguments) {
        return new IrInvoke(function, list(NodeKind.ACTUAL_PARAMETER_LIST, arguments));
    }

    public static IrLoop loop(IrIterator variable, IrNode body) {
        return new IrLoop(NodeKind.LOOP, variable, body);
    }

    public static IrLoop filter(IrIterator variable, IrNode predicate) {
        return new IrLoop(NodeKind.FILTER, variable, predicate);
    }

    public static IrLoop sort(IrIterator variable, IrList keys) {
        return new IrLoop(NodeKind.SORT, variable, keys);
    }

    public static IrSortKey sortKey(IrNode key, IrNode collation) {
        return new IrSortKey(key, collation);
    }

    /** Only for kinds without a node class of their own; see {@link NodeKind#hasDedicatedClass}. */
    public static IrNode unary(NodeKind kind, IrNode child) {
        return new IrUnary(kind, child);
    }

    public static IrNode binary(NodeKind kind, IrNode left, IrNode right) {
        return new IrBinary(kind, left, right);
    }

    public static IrNode conditional(IrNode condition, IrNode whenTrue, IrNode whenFalse) {
        return new IrTernary(NodeKind.CONDITIONAL, condition, whenTrue, whenFalse);
    }

    public static IrTargetType typeAssert(IrNode source, IrTypeDescriptor type) {
        return new IrTargetType(NodeKind.TYPE_ASSERT, source, literal(type));
    }

    public static IrProgram program(IrList globalParameters, IrList globalVariables,
                                    IrList functions, IrNode root) {
        return new IrProgram(globalParameters, globalVariables, functions, root);
    }
}
