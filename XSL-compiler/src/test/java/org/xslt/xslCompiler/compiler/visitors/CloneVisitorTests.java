package org.xslt.xslCompiler.compiler.visitors;

import org.xslt.xslCompiler.compiler.XslCompiler;
import org.xslt.xslCompiler.ir.IrFunction;
import org.xslt.xslCompiler.ir.IrGraphs;
import org.xslt.xslCompiler.ir.IrInvoke;
import org.xslt.xslCompiler.ir.IrLoop;
import org.xslt.xslCompiler.ir.IrNode;
import org.xslt.xslCompiler.ir.IrProgram;
import org.junit.Assert;
import org.junit.Test;

import javax.annotation.Nullable;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Set;

public class CloneVisitorTests {
    /** All nodes reachable from a root. */
    static Set<IrNode> reachable(XslCompiler compiler, IrNode root) {
        Set<IrNode> result = Collections.newSetFromMap(new IdentityHashMap<>());
        IrVisitor visitor = new IrVisitor(compiler) {
            @Nullable
            @Override
            public IrNode visit(@Nullable IrNode node) {
                if (node != null)
                    result.add(node);
                return super.visit(node);
            }
        };
        visitor.apply(root);
        return result;
    }

    static void checkClone(XslCompiler compiler, IrNode original) {
        IrNode clone = new CloneVisitor(compiler).apply(original);
        Set<IrNode> before = reachable(compiler, original);
        Set<IrNode> after = reachable(compiler, clone);
        Assert.assertEquals(before.size(), after.size());
        for (IrNode node: after)
            Assert.assertFalse(node.toString(), before.contains(node));

        VisitorTests.Recorder originalShape = new VisitorTests.Recorder(compiler);
        originalShape.apply(original);
        VisitorTests.Recorder cloneShape = new VisitorTests.Recorder(compiler);
        cloneShape.apply(clone);
        Assert.assertEquals(originalShape.events, cloneShape.events);

        ReferenceCounter counter = new ReferenceCounter(compiler);
        counter.apply(clone);
        Assert.assertTrue(counter.getUndefined().isEmpty());
    }

    @Test
    public void testCloneLoop() {
        XslCompiler compiler = new XslCompiler();
        IrLoop loop = IrGraphs.sumLoop();
        checkClone(compiler, loop);
        IrLoop clone = new CloneVisitor(compiler).apply(loop).to(IrLoop.class);
        Assert.assertNotSame(loop.getVariable(), clone.getVariable());
        Assert.assertSame(clone.getVariable(), clone.getBody().getRequiredChild(0));
        Assert.assertEquals("x", clone.getVariable().getDebugName());
    }

    @Test
    public void testCloneRecursiveFunction() {
        XslCompiler compiler = new XslCompiler();
        IrProgram program = IrGraphs.recursiveProgram();
        checkClone(compiler, program);
        IrProgram clone = new CloneVisitor(compiler).apply(program).to(IrProgram.class);
        IrFunction f = clone.getFunctions().getRequiredChild(0).to(IrFunction.class);
        Assert.assertSame(f, f.getDefinition().getRequiredChild(2).to(IrInvoke.class).getFunction());
        Assert.assertSame(f, clone.getRoot().to(IrInvoke.class).getFunction());
        Assert.assertSame(clone.getGlobalParameters().getRequiredChild(0),
                clone.getRoot().to(IrInvoke.class).getArguments().getRequiredChild(0));
    }

    @Test
    public void testCloneMutualRecursion() {
        XslCompiler compiler = new XslCompiler();
        checkClone(compiler, IrGraphs.mutualRecursion());
    }
}
