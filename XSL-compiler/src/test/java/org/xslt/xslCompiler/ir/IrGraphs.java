package org.xslt.xslCompiler.ir;

import java.math.BigDecimal;
import java.util.Collections;

/** Small graphs shared by several tests. */
public class IrGraphs {
    private IrGraphs() {}

    /** A chain of NOT nodes; the leaf is at the specified depth below the root. */
    public static IrNode chain(int depth, IrNode leaf) {
        IrNode result = leaf;
        for (int i = 0; i < depth; i++)
            result = IrFactory.unary(NodeKind.NOT, result);
        return result;
    }

    public static IrNode chain(int depth) {
        return chain(depth, IrFactory.bool(true));
    }

    /** for $x in (1, 2, 3) return $x + 1 */
    public static IrLoop sumLoop() {
        IrIterator x = IrFactory.forVar(IrFactory.list(NodeKind.SEQUENCE,
                IrFactory.literal(1), IrFactory.literal(2), IrFactory.literal(3)));
        x.setDebugName("x");
        return IrFactory.loop(x, IrFactory.binary(NodeKind.ADD, x, IrFactory.literal(1)));
    }

    /** A program with a global parameter $p and a function f($n) which invokes itself:
     * f($n) = if ($n le 0) then 0 else f($n - 1); the root computes f($p). */
    public static IrProgram recursiveProgram() {
        IrParameter p = IrFactory.parameter(IrFactory.literal(10), new IrName("p"));
        p.setDebugName("p");
        IrParameter n = IrFactory.parameter(null, new IrName("n"));
        n.setDebugName("n");
        IrFunction f = IrFactory.function(IrFactory.list(NodeKind.FORMAL_PARAMETER_LIST, n), false);
        f.setDebugName("f");
        f.setDefinition(IrFactory.conditional(
                IrFactory.binary(NodeKind.LE, n, IrFactory.literal(0)),
                IrFactory.literal(0),
                IrFactory.invoke(f, IrFactory.binary(NodeKind.SUBTRACT, n, IrFactory.literal(1)))));
        return IrFactory.program(
                IrFactory.list(NodeKind.GLOBAL_PARAMETER_LIST, p),
                IrFactory.list(NodeKind.GLOBAL_VARIABLE_LIST),
                IrFactory.list(NodeKind.FUNCTION_LIST, f),
                IrFactory.invoke(f, p));
    }

    /** Two functions which invoke each other; f is listed before g. */
    public static IrProgram mutualRecursion() {
        IrFunction f = IrFactory.function(IrFactory.list(NodeKind.FORMAL_PARAMETER_LIST), false);
        f.setDebugName("f");
        IrFunction g = IrFactory.function(IrFactory.list(NodeKind.FORMAL_PARAMETER_LIST), false);
        g.setDebugName("g");
        f.setDefinition(IrFactory.binary(NodeKind.ADD, IrFactory.literal(1), IrFactory.invoke(g)));
        g.setDefinition(IrFactory.binary(NodeKind.ADD, IrFactory.literal(2), IrFactory.invoke(f)));
        return IrFactory.program(
                IrFactory.list(NodeKind.GLOBAL_PARAMETER_LIST),
                IrFactory.list(NodeKind.GLOBAL_VARIABLE_LIST),
                IrFactory.list(NodeKind.FUNCTION_LIST, f, g),
                IrFactory.invoke(f));
    }

    /** Some node of each kind. */
    public static IrNode sample(NodeKind kind) {
        switch (kind) {
            case LITERAL_STRING:
                return IrFactory.literal("s");
            case LITERAL_INT32:
                return IrFactory.literal(1);
            case LITERAL_INT64:
                return IrFactory.literal(1L);
            case LITERAL_DOUBLE:
                return IrFactory.literal(1.0);
            case LITERAL_DECIMAL:
                return IrFactory.literal(BigDecimal.ONE);
            case LITERAL_QNAME:
                return new IrName("n");
            case LITERAL_TYPE:
                return IrFactory.literal(new IrTypeDescriptor("item*"));
            case LITERAL_OBJECT:
                return IrFactory.literalObject("object");
            default:
                int count = kind.getShape().isFixed() ? kind.getArity() : 0;
                return IrFactory.create(kind, Collections.nCopies(count, null));
        }
    }
}
