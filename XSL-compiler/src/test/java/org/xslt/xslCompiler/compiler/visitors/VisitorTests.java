package org.xslt.xslCompiler.compiler.visitors;

import org.xslt.xslCompiler.compiler.XslCompiler;
import org.xslt.xslCompiler.ir.IrBinary;
import org.xslt.xslCompiler.ir.IrFactory;
import org.xslt.xslCompiler.ir.IrFunction;
import org.xslt.xslCompiler.ir.IrGraphs;
import org.xslt.xslCompiler.ir.IrLiteral;
import org.xslt.xslCompiler.ir.IrLoop;
import org.xslt.xslCompiler.ir.IrNode;
import org.xslt.xslCompiler.ir.IrParameter;
import org.xslt.xslCompiler.ir.IrProgram;
import org.xslt.xslCompiler.ir.NodeKind;
import org.junit.Assert;
import org.junit.Test;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

public class VisitorTests {
    /** Records every definition and reference visited. */
    static class Recorder extends IrVisitor {
        final List<String> events = new ArrayList<>();
        int unknown = 0;

        Recorder(XslCompiler compiler) {
            super(compiler);
        }

        @Nullable
        @Override
        public IrNode visit(@Nullable IrNode node) {
            this.events.add(node == null ? "null" : node.getKind().name());
            return super.visit(node);
        }

        @Nullable
        @Override
        protected IrNode visitReference(@Nullable IrNode node) {
            this.events.add("-> " + (node == null ? "null" : node.getKind().name()));
            return super.visitReference(node);
        }

        @Override
        protected IrNode visitUnknown(IrNode node) {
            this.unknown++;
            return super.visitUnknown(node);
        }
    }

    @Test
    public void testLeafIsUnchanged() {
        XslCompiler compiler = new XslCompiler();
        IrLiteral literal = IrFactory.literal("leaf");
        Recorder recorder = new Recorder(compiler);
        Assert.assertSame(literal, recorder.apply(literal));
        Assert.assertEquals(List.of("LITERAL_STRING"), recorder.events);
    }

    @Test
    public void testPreorder() {
        XslCompiler compiler = new XslCompiler();
        IrNode expression = IrFactory.binary(NodeKind.ADD,
                IrFactory.literal(1), IrFactory.unary(NodeKind.NEGATE, IrFactory.literal(2)));
        Recorder recorder = new Recorder(compiler);
        recorder.apply(expression);
        Assert.assertEquals(List.of("ADD", "LITERAL_INT32", "NEGATE", "LITERAL_INT32"), recorder.events);
    }

    @Test
    public void testIntegerList() {
        XslCompiler compiler = new XslCompiler();
        IrNode list = IrFactory.list(NodeKind.SEQUENCE,
                IrFactory.literal(1), IrFactory.literal(2), IrFactory.literal(3));
        Recorder recorder = new Recorder(compiler);
        IrNode result = recorder.apply(list);
        Assert.assertSame(list, result);
        Assert.assertEquals(3, result.getChildCount());
        for (int i = 0; i < 3; i++)
            Assert.assertEquals(i + 1, result.getRequiredChild(i).to(IrLiteral.class).getInt32());
        Assert.assertEquals(4, recorder.events.size());
    }

    @Test
    public void testLoopVisitsVariableOnce() {
        XslCompiler compiler = new XslCompiler();
        IrLoop loop = IrGraphs.sumLoop();
        Recorder recorder = new Recorder(compiler);
        recorder.apply(loop);
        Assert.assertEquals(List.of(
                "LOOP", "FOR", "SEQUENCE", "LITERAL_INT32", "LITERAL_INT32", "LITERAL_INT32",
                "ADD", "-> FOR", "LITERAL_INT32"), recorder.events);
        Assert.assertEquals(0, recorder.unknown);
    }

    @Test
    public void testLoopVariableAsBody() {
        XslCompiler compiler = new XslCompiler();
        IrLoop loop = IrGraphs.sumLoop();
        IrLoop identity = IrFactory.loop(loop.getVariable(), loop.getVariable());
        Recorder recorder = new Recorder(compiler);
        recorder.apply(identity);
        Assert.assertEquals("FOR", recorder.events.get(1));
        Assert.assertEquals("-> FOR", recorder.events.get(recorder.events.size() - 1));
    }

    @Test
    public void testRecursiveFunctionTerminates() {
        XslCompiler compiler = new XslCompiler();
        IrProgram program = IrGraphs.recursiveProgram();
        IrFunction f = program.getFunctions().getRequiredChild(0).to(IrFunction.class);
        IrParameter p = program.getGlobalParameters().getRequiredChild(0).to(IrParameter.class);
        IrParameter n = f.getArguments().getRequiredChild(0).to(IrParameter.class);

        ReferenceCounter counter = new ReferenceCounter(compiler);
        counter.apply(program);
        Assert.assertTrue(counter.isDefined(f));
        Assert.assertTrue(counter.isDefined(p));
        Assert.assertTrue(counter.isDefined(n));
        Assert.assertEquals(2, counter.getReferenceCount(f));
        Assert.assertEquals(1, counter.getReferenceCount(p));
        Assert.assertEquals(2, counter.getReferenceCount(n));
        Assert.assertTrue(counter.getUndefined().isEmpty());
    }

    @Test
    public void testMutualRecursionTerminates() {
        XslCompiler compiler = new XslCompiler();
        IrProgram program = IrGraphs.mutualRecursion();
        IrNode f = program.getFunctions().getRequiredChild(0);
        IrNode g = program.getFunctions().getRequiredChild(1);
        ReferenceCounter counter = new ReferenceCounter(compiler);
        counter.apply(program);
        Assert.assertEquals(2, counter.getReferenceCount(f));
        Assert.assertEquals(1, counter.getReferenceCount(g));
    }

    @Test
    public void testUndefinedBinder() {
        XslCompiler compiler = new XslCompiler();
        IrFunction f = IrFactory.function(IrFactory.list(NodeKind.FORMAL_PARAMETER_LIST), IrFactory.literal(1), false);
        ReferenceCounter counter = new ReferenceCounter(compiler);
        counter.apply(IrFactory.invoke(f));
        Assert.assertFalse(counter.isDefined(f));
        Assert.assertEquals(1, counter.getUndefined().size());
    }

    @Test
    public void testUnknownKind() {
        XslCompiler compiler = new XslCompiler();
        IrNode unknown = IrFactory.list(NodeKind.UNKNOWN, IrFactory.literal(1), IrFactory.literal(2));
        Recorder recorder = new Recorder(compiler);
        recorder.apply(unknown);
        Assert.assertEquals(1, recorder.unknown);
        Assert.assertEquals(List.of("UNKNOWN", "LITERAL_INT32", "LITERAL_INT32"), recorder.events);
    }

    @Test
    public void testEveryKindHasHandler() {
        XslCompiler compiler = new XslCompiler();
        for (NodeKind kind: NodeKind.values()) {
            IrNode node = IrGraphs.sample(kind);
            Recorder recorder = new Recorder(compiler);
            Assert.assertSame(node, recorder.apply(node));
            Assert.assertEquals(kind.toString(), kind == NodeKind.UNKNOWN ? 1 : 0, recorder.unknown);
        }
    }

    @Test
    public void testReferenceToNonBinderIsUnknown() {
        XslCompiler compiler = new XslCompiler();
        Recorder recorder = new Recorder(compiler);
        IrLiteral literal = IrFactory.literal(3);
        Assert.assertSame(literal, recorder.visitReference(literal));
        Assert.assertEquals(1, recorder.unknown);
    }

    @Test
    public void testVisitAssumeReference() {
        XslCompiler compiler = new XslCompiler();
        IrLoop loop = IrGraphs.sumLoop();
        Recorder recorder = new Recorder(compiler);
        recorder.visitAssumeReference(loop.getVariable());
        recorder.visitAssumeReference(loop);
        Assert.assertEquals("-> FOR", recorder.events.get(0));
        Assert.assertEquals("LOOP", recorder.events.get(1));
        Assert.assertEquals(0, recorder.unknown);
    }

    @Test
    public void testNullChildren() {
        XslCompiler compiler = new XslCompiler();
        IrNode parameters = IrFactory.list(NodeKind.GLOBAL_PARAMETER_LIST, IrFactory.parameter(null, null));
        Recorder recorder = new Recorder(compiler);
        recorder.apply(parameters);
        Assert.assertEquals(List.of("GLOBAL_PARAMETER_LIST", "PARAMETER", "null", "null"), recorder.events);
        Assert.assertNull(recorder.visit(null));
    }

    @Test
    public void testParentContext() {
        XslCompiler compiler = new XslCompiler();
        IrNode add = IrFactory.binary(NodeKind.ADD, IrFactory.literal(1), IrFactory.literal(2));
        List<IrNode> parents = new ArrayList<>();
        IrVisitor visitor = new IrVisitor(compiler) {
            @Override
            public IrNode visitAdd(IrBinary node) {
                parents.add(this.getParent());
                return super.visitAdd(node);
            }

            @Override
            public IrNode visitLiteralInt32(IrLiteral node) {
                parents.add(this.getParent());
                return super.visitLiteralInt32(node);
            }
        };
        visitor.apply(add);
        Assert.assertEquals(3, parents.size());
        Assert.assertNull(parents.get(0));
        Assert.assertSame(add, parents.get(1));
        Assert.assertSame(add, parents.get(2));
    }

    @Test
    public void testVisitorIdsUniqueAcrossThreads() throws Exception {
        XslCompiler compiler = new XslCompiler();
        int threads = 8;
        int perThread = 1000;
        Set<Long> ids = ConcurrentHashMap.newKeySet();
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        try {
            CountDownLatch start = new CountDownLatch(1);
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < threads; t++) {
                futures.add(executor.submit(() -> {
                    start.await();
                    for (int i = 0; i < perThread; i++)
                        ids.add(new Recorder(compiler).getId());
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future: futures)
                future.get(30, TimeUnit.SECONDS);
        } finally {
            executor.shutdownNow();
        }
        Assert.assertEquals(threads * perThread, ids.size());
    }
}
