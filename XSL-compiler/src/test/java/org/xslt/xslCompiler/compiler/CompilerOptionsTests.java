package org.xslt.xslCompiler.compiler;

import org.xslt.xslCompiler.compiler.errors.CompilationError;
import org.xslt.xslCompiler.compiler.errors.CompilerMessages;
import org.junit.Assert;
import org.junit.Test;

public class CompilerOptionsTests {
    @Test
    public void testDefaults() {
        CompilerOptions options = CompilerOptions.getDefault();
        Assert.assertTrue(options.languageOptions.enforceComplexityLimit);
        Assert.assertEquals(800, options.languageOptions.maxDepth);
        Assert.assertEquals(CompilerOptions.DEFAULT_MAX_DEPTH, options.languageOptions.maxDepth);
        Assert.assertTrue(options.ioOptions.loggingLevel.isEmpty());
        Assert.assertFalse(options.help);
    }

    @Test
    public void testParse() {
        CompilerOptions options = CompilerOptions.fromArguments(
                "--limitComplexity", "false", "--maxDepth", "1000", "-v", "2");
        Assert.assertFalse(options.languageOptions.enforceComplexityLimit);
        Assert.assertEquals(1000, options.languageOptions.maxDepth);
        Assert.assertEquals(2, options.ioOptions.verbosity);
    }

    @Test
    public void testLoggingLevels() {
        CompilerOptions options = CompilerOptions.fromArguments("-TComplexityCheck=2", "-TIrWriter=1");
        Assert.assertEquals("2", options.ioOptions.loggingLevel.get("ComplexityCheck"));
        Assert.assertEquals("1", options.ioOptions.loggingLevel.get("IrWriter"));
    }

    @Test(expected = CompilationError.class)
    public void testBadNumber() {
        CompilerOptions.fromArguments("--maxDepth", "deep");
    }

    @Test(expected = CompilationError.class)
    public void testUnknownOption() {
        CompilerOptions.fromArguments("--optimize");
    }

    @Test
    public void testValidate() {
        CompilerOptions options = CompilerOptions.getDefault();
        options.languageOptions.maxDepth = -3;
        CompilerMessages messages = new CompilerMessages();
        Assert.assertFalse(options.validate(messages));
        Assert.assertEquals(1, messages.errorCount());
        Assert.assertTrue(messages.toString().contains("--maxDepth must be positive"));

        messages.clear();
        Assert.assertTrue(CompilerOptions.getDefault().validate(messages));
        Assert.assertFalse(messages.hasErrors());
    }

    @Test
    public void testDiff() {
        CompilerOptions options = CompilerOptions.getDefault();
        CompilerOptions other = CompilerOptions.fromArguments("--maxDepth", "10");
        Assert.assertTrue(options.same(CompilerOptions.getDefault()));
        Assert.assertEquals("", options.diff(CompilerOptions.getDefault()));
        Assert.assertFalse(options.same(other));
        Assert.assertTrue(options.diff(other).contains("maxDepth=800!=10"));
    }

    @Test
    public void testUsage() {
        String usage = CompilerOptions.getDefault().usage();
        Assert.assertTrue(usage.contains("--maxDepth"));
        Assert.assertTrue(usage.contains("--limitComplexity"));
    }
}
