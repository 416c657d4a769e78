package org.xslt.xslCompiler.compiler.visitors;

import org.xslt.xslCompiler.compiler.XslCompiler;
import org.xslt.xslCompiler.ir.IrBinary;
import org.xslt.xslCompiler.ir.IrFactory;
import org.xslt.xslCompiler.ir.IrFunction;
import org.xslt.xslCompiler.ir.IrGraphs;
import org.xslt.xslCompiler.ir.IrInvoke;
import org.xslt.xslCompiler.ir.IrIterator;
import org.xslt.xslCompiler.ir.IrLiteral;
import org.xslt.xslCompiler.ir.IrLoop;
import org.xslt.xslCompiler.ir.IrNode;
import org.xslt.xslCompiler.ir.IrParameter;
import org.xslt.xslCompiler.ir.IrProgram;
import org.xslt.xslCompiler.ir.IrTernary;
import org.xslt.xslCompiler.ir.NodeKind;
import org.junit.Assert;
import org.junit.Test;

public class RewriteVisitorTests {
    /** Replaces every 32-bit integer literal with a given value. */
    static class ReplaceLiteral extends IrRewriteVisitor {
        final int from;
        final int to;

        ReplaceLiteral(XslCompiler compiler, int from, int to) {
            super(compiler, false);
            this.from = from;
            this.to = to;
        }

        @Override
        public IrNode visitLiteralInt32(IrLiteral node) {
            if (node.getInt32() != this.from)
                return super.visitLiteralInt32(node);
            IrNode result = IrFactory.literal(this.to);
            this.map(node, result);
            return result;
        }
    }

    static void checkAllDefined(XslCompiler compiler, IrNode root) {
        ReferenceCounter counter = new ReferenceCounter(compiler);
        counter.apply(root);
        Assert.assertTrue(counter.getUndefined().isEmpty());
    }

    @Test
    public void testUnchangedGraphKeepsIdentity() {
        XslCompiler compiler = new XslCompiler();
        IrProgram program = IrGraphs.recursiveProgram();
        Assert.assertSame(program, new ReplaceLiteral(compiler, 99, 100).apply(program));
        IrLoop loop = IrGraphs.sumLoop();
        Assert.assertSame(loop, new ReplaceLiteral(compiler, 99, 100).apply(loop));
    }

    @Test
    public void testOnlyAncestorsRebuilt() {
        XslCompiler compiler = new XslCompiler();
        IrNode three = IrFactory.literal(3);
        IrNode negate = IrFactory.unary(NodeKind.NEGATE, IrFactory.literal(5));
        IrNode inner = IrFactory.binary(NodeKind.ADD, IrFactory.literal(1), three);
        IrNode root = IrFactory.binary(NodeKind.ADD, inner, negate);

        IrNode result = new ReplaceLiteral(compiler, 1, 2).apply(root);
        Assert.assertNotSame(root, result);
        IrBinary add = result.to(IrBinary.class);
        Assert.assertSame(negate, add.getRight());
        IrBinary newInner = add.getLeft().to(IrBinary.class);
        Assert.assertNotSame(inner, newInner);
        Assert.assertSame(three, newInner.getRight());
        Assert.assertEquals(2, newInner.getLeft().to(IrLiteral.class).getInt32());
    }

    @Test
    public void testSharedSubgraphRewrittenOnce() {
        XslCompiler compiler = new XslCompiler();
        IrNode shared = IrFactory.unary(NodeKind.NEGATE, IrFactory.literal(1));
        IrNode root = IrFactory.binary(NodeKind.MULTIPLY, shared, shared);
        IrBinary result = new ReplaceLiteral(compiler, 1, 2).apply(root).to(IrBinary.class);
        Assert.assertNotSame(shared, result.getLeft());
        Assert.assertSame(result.getLeft(), result.getRight());
    }

    @Test
    public void testLoopVariableRetargeted() {
        XslCompiler compiler = new XslCompiler();
        IrLoop loop = IrGraphs.sumLoop();
        IrLoop result = new ReplaceLiteral(compiler, 2, 20).apply(loop).to(IrLoop.class);
        IrIterator x = result.getVariable();
        Assert.assertNotSame(loop.getVariable(), x);
        Assert.assertEquals("x", x.getDebugName());
        Assert.assertEquals(20, x.getBinding().getRequiredChild(1).to(IrLiteral.class).getInt32());
        Assert.assertSame(x, result.getBody().getRequiredChild(0));
    }

    @Test
    public void testGlobalParameterRetargeted() {
        XslCompiler compiler = new XslCompiler();
        IrProgram program = IrGraphs.recursiveProgram();
        IrProgram result = new ReplaceLiteral(compiler, 10, 11).apply(program).to(IrProgram.class);
        IrParameter p = result.getGlobalParameters().getRequiredChild(0).to(IrParameter.class);
        Assert.assertNotSame(program.getGlobalParameters().getRequiredChild(0), p);
        Assert.assertEquals(11, p.getDefaultValue().to(IrLiteral.class).getInt32());
        IrInvoke root = result.getRoot().to(IrInvoke.class);
        Assert.assertSame(p, root.getArguments().getRequiredChild(0));
        // The function does not mention the parameter, so it is not rebuilt
        Assert.assertSame(program.getFunctions(), result.getFunctions());
        checkAllDefined(compiler, result);
    }

    @Test
    public void testSelfRecursiveFunctionRetargeted() {
        XslCompiler compiler = new XslCompiler();
        IrProgram program = IrGraphs.recursiveProgram();
        IrFunction f = program.getFunctions().getRequiredChild(0).to(IrFunction.class);
        IrProgram result = new ReplaceLiteral(compiler, 0, 7).apply(program).to(IrProgram.class);

        IrFunction newF = result.getFunctions().getRequiredChild(0).to(IrFunction.class);
        Assert.assertNotSame(f, newF);
        Assert.assertEquals("f", newF.getDebugName());
        IrTernary body = newF.getDefinition().to(IrTernary.class);
        Assert.assertEquals(7, body.getCenter().to(IrLiteral.class).getInt32());
        Assert.assertSame(newF, body.getRight().to(IrInvoke.class).getFunction());
        Assert.assertSame(newF, result.getRoot().to(IrInvoke.class).getFunction());
        // The formal parameter is unchanged, and still used by the new body
        IrNode n = newF.getArguments().getRequiredChild(0);
        Assert.assertSame(f.getArguments().getRequiredChild(0), n);
        Assert.assertSame(n, body.getLeft().getRequiredChild(0));
        checkAllDefined(compiler, result);
    }

    @Test
    public void testForwardReferenceRetargeted() {
        XslCompiler compiler = new XslCompiler();
        IrProgram program = IrGraphs.mutualRecursion();
        IrNode f = program.getFunctions().getRequiredChild(0);
        IrNode g = program.getFunctions().getRequiredChild(1);
        // Only the body of g changes; f invokes g, so f must be rebuilt too
        IrProgram result = new ReplaceLiteral(compiler, 2, 3).apply(program).to(IrProgram.class);

        IrFunction newF = result.getFunctions().getRequiredChild(0).to(IrFunction.class);
        IrFunction newG = result.getFunctions().getRequiredChild(1).to(IrFunction.class);
        Assert.assertNotSame(f, newF);
        Assert.assertNotSame(g, newG);
        Assert.assertSame(newG, newF.getDefinition().getRequiredChild(1).to(IrInvoke.class).getFunction());
        Assert.assertSame(newF, newG.getDefinition().getRequiredChild(1).to(IrInvoke.class).getFunction());
        Assert.assertSame(newF, result.getRoot().to(IrInvoke.class).getFunction());
        Assert.assertEquals(3, newG.getDefinition().getRequiredChild(0).to(IrLiteral.class).getInt32());
        checkAllDefined(compiler, result);
    }
}
