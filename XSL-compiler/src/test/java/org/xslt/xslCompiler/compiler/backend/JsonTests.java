package org.xslt.xslCompiler.compiler.backend;

import org.xslt.xslCompiler.compiler.XslCompiler;
import org.xslt.xslCompiler.compiler.errors.CompilationError;
import org.xslt.xslCompiler.compiler.errors.UnimplementedException;
import org.xslt.xslCompiler.ir.IrFactory;
import org.xslt.xslCompiler.ir.IrFunction;
import org.xslt.xslCompiler.ir.IrGraphs;
import org.xslt.xslCompiler.ir.IrInvoke;
import org.xslt.xslCompiler.ir.IrLiteral;
import org.xslt.xslCompiler.ir.IrLoop;
import org.xslt.xslCompiler.ir.IrName;
import org.xslt.xslCompiler.ir.IrNode;
import org.xslt.xslCompiler.ir.IrParameter;
import org.xslt.xslCompiler.ir.IrProgram;
import org.xslt.xslCompiler.ir.IrTypeDescriptor;
import org.xslt.xslCompiler.ir.NodeKind;
import org.junit.Assert;
import org.junit.Test;

import java.math.BigDecimal;

public class JsonTests {
    static IrNode roundTrip(XslCompiler compiler, IrNode node) {
        String json = ToJsonVisitor.toJson(compiler, node);
        return new JsonDecoder().decode(json);
    }

    static String dumpWithoutIds(XslCompiler compiler, IrNode node) {
        return IrWriter.toString(compiler, node).replaceAll("#[0-9]+", "");
    }

    @Test
    public void testLoopRoundTrip() {
        XslCompiler compiler = new XslCompiler();
        IrLoop loop = IrGraphs.sumLoop();
        IrLoop decoded = roundTrip(compiler, loop).to(IrLoop.class);
        Assert.assertEquals(dumpWithoutIds(compiler, loop), dumpWithoutIds(compiler, decoded));
        Assert.assertSame(decoded.getVariable(), decoded.getBody().getRequiredChild(0));
        Assert.assertEquals("x", decoded.getVariable().getDebugName());
    }

    @Test
    public void testRecursiveProgramRoundTrip() {
        XslCompiler compiler = new XslCompiler();
        IrProgram program = IrGraphs.recursiveProgram();
        IrProgram decoded = roundTrip(compiler, program).to(IrProgram.class);
        Assert.assertEquals(dumpWithoutIds(compiler, program), dumpWithoutIds(compiler, decoded));

        IrFunction f = decoded.getFunctions().getRequiredChild(0).to(IrFunction.class);
        Assert.assertSame(f, f.getDefinition().getRequiredChild(2).to(IrInvoke.class).getFunction());
        Assert.assertSame(f, decoded.getRoot().to(IrInvoke.class).getFunction());
        IrParameter p = decoded.getGlobalParameters().getRequiredChild(0).to(IrParameter.class);
        Assert.assertSame(p, decoded.getRoot().to(IrInvoke.class).getArguments().getRequiredChild(0));
        Assert.assertEquals("p", p.getName().getLocalName());
        Assert.assertNull(f.getArguments().getRequiredChild(0).to(IrParameter.class).getDefaultValue());
    }

    @Test
    public void testForwardReferenceRoundTrip() {
        XslCompiler compiler = new XslCompiler();
        IrProgram decoded = roundTrip(compiler, IrGraphs.mutualRecursion()).to(IrProgram.class);
        IrFunction f = decoded.getFunctions().getRequiredChild(0).to(IrFunction.class);
        IrFunction g = decoded.getFunctions().getRequiredChild(1).to(IrFunction.class);
        Assert.assertSame(g, f.getDefinition().getRequiredChild(1).to(IrInvoke.class).getFunction());
        Assert.assertSame(f, g.getDefinition().getRequiredChild(1).to(IrInvoke.class).getFunction());
    }

    @Test
    public void testSharedSubgraph() {
        XslCompiler compiler = new XslCompiler();
        IrNode shared = IrFactory.literal("shared");
        IrNode root = IrFactory.create(NodeKind.STR_CONCAT, shared, shared);
        String json = ToJsonVisitor.toJson(compiler, root);
        Assert.assertTrue(json.contains("\"node\": " + shared.getId()));
        IrNode decoded = new JsonDecoder().decode(json);
        Assert.assertSame(decoded.getChild(0), decoded.getChild(1));
    }

    @Test
    public void testPayloads() {
        XslCompiler compiler = new XslCompiler();
        IrNode root = IrFactory.list(NodeKind.SEQUENCE,
                IrFactory.literal("say \"hi\"\n"),
                IrFactory.literal(-7),
                IrFactory.literal(Long.MAX_VALUE),
                IrFactory.literal(Double.NaN),
                IrFactory.literal(new BigDecimal("12.500")),
                IrFactory.literal(new IrTypeDescriptor("xs:string?")),
                IrFactory.name("template", "http://www.w3.org/1999/XSL/Transform", "xsl"),
                IrFactory.bool(true),
                null);
        IrNode decoded = roundTrip(compiler, root);
        Assert.assertEquals(9, decoded.getChildCount());
        Assert.assertEquals("say \"hi\"\n", decoded.getRequiredChild(0).to(IrLiteral.class).getString());
        Assert.assertEquals(-7, decoded.getRequiredChild(1).to(IrLiteral.class).getInt32());
        Assert.assertEquals(Long.MAX_VALUE, decoded.getRequiredChild(2).to(IrLiteral.class).getInt64());
        Assert.assertTrue(Double.isNaN(decoded.getRequiredChild(3).to(IrLiteral.class).getDouble()));
        Assert.assertEquals(new BigDecimal("12.500"), decoded.getRequiredChild(4).to(IrLiteral.class).getDecimal());
        Assert.assertEquals(new IrTypeDescriptor("xs:string?"),
                decoded.getRequiredChild(5).to(IrLiteral.class).getTypeDescriptor());
        IrName name = decoded.getRequiredChild(6).to(IrName.class);
        Assert.assertEquals("xsl:template", name.getQualifiedName());
        Assert.assertEquals("http://www.w3.org/1999/XSL/Transform", name.getNamespaceUri());
        Assert.assertEquals(NodeKind.TRUE, decoded.getRequiredChild(7).getKind());
        Assert.assertNull(decoded.getChild(8));
    }

    @Test(expected = UnimplementedException.class)
    public void testObjectLiteral() {
        XslCompiler compiler = new XslCompiler();
        ToJsonVisitor.toJson(compiler, IrFactory.literalObject(new Object()));
    }

    @Test(expected = CompilationError.class)
    public void testMalformedJson() {
        new JsonDecoder().decode("{\"kind\": ");
    }

    @Test(expected = CompilationError.class)
    public void testUnknownKind() {
        new JsonDecoder().decode("{\"kind\": \"TEMPLATE\", \"id\": 1, \"children\": []}");
    }

    @Test(expected = CompilationError.class)
    public void testFractionalInt32() {
        new JsonDecoder().decode("{\"kind\": \"LITERAL_INT32\", \"id\": 1, \"value\": 3.7, \"children\": []}");
    }

    @Test(expected = CompilationError.class)
    public void testQuotedInt32() {
        new JsonDecoder().decode("{\"kind\": \"LITERAL_INT32\", \"id\": 1, \"value\": \"3\", \"children\": []}");
    }

    @Test(expected = CompilationError.class)
    public void testFractionalInt64() {
        new JsonDecoder().decode("{\"kind\": \"LITERAL_INT64\", \"id\": 1, \"value\": 1.5, \"children\": []}");
    }

    @Test(expected = CompilationError.class)
    public void testInt32OutOfRange() {
        new JsonDecoder().decode("{\"kind\": \"LITERAL_INT32\", \"id\": 1, \"value\": 4294967296, \"children\": []}");
    }

    @Test
    public void testIntegralLiterals() {
        IrNode int32 = new JsonDecoder().decode("{\"kind\": \"LITERAL_INT32\", \"id\": 1, \"value\": -7, \"children\": []}");
        Assert.assertEquals(-7, int32.to(IrLiteral.class).getInt32());
        IrNode int64 = new JsonDecoder().decode(
                "{\"kind\": \"LITERAL_INT64\", \"id\": 1, \"value\": 4294967296, \"children\": []}");
        Assert.assertEquals(4294967296L, int64.to(IrLiteral.class).getInt64());
    }

    @Test(expected = CompilationError.class)
    public void testWrongArity() {
        new JsonDecoder().decode("{\"kind\": \"NOT\", \"id\": 1, \"children\": []}");
    }

    @Test(expected = CompilationError.class)
    public void testDanglingReference() {
        new JsonDecoder().decode("{\"kind\": \"NOT\", \"id\": 1, \"children\": [{\"ref\": 5}]}");
    }

    @Test(expected = CompilationError.class)
    public void testMissingProperty() {
        new JsonDecoder().decode("{\"kind\": \"LITERAL_INT32\", \"id\": 1, \"children\": []}");
    }

    @Test
    public void testWriter() {
        XslCompiler compiler = new XslCompiler();
        IrLoop loop = IrGraphs.sumLoop();
        IrNode x = loop.getVariable();
        IrNode sequence = loop.getVariable().getBinding();
        IrNode add = loop.getBody();
        String expected = "LOOP#" + loop.getId() + "\n" +
                "    FOR#" + x.getId() + " $x\n" +
                "        SEQUENCE#" + sequence.getId() + "\n" +
                "            LITERAL_INT32#" + sequence.getRequiredChild(0).getId() + " 1\n" +
                "            LITERAL_INT32#" + sequence.getRequiredChild(1).getId() + " 2\n" +
                "            LITERAL_INT32#" + sequence.getRequiredChild(2).getId() + " 3\n" +
                "    ADD#" + add.getId() + "\n" +
                "        -> FOR#" + x.getId() + " $x\n" +
                "        LITERAL_INT32#" + add.getRequiredChild(1).getId() + " 1\n";
        Assert.assertEquals(expected, IrWriter.toString(compiler, loop));
    }

    @Test
    public void testWriterNullChild() {
        XslCompiler compiler = new XslCompiler();
        IrParameter p = IrFactory.parameter(null, null);
        String expected = "PARAMETER#" + p.getId() + "\n" +
                "    <null>\n" +
                "    <null>\n";
        Assert.assertEquals(expected, IrWriter.toString(compiler, p));
    }
}
