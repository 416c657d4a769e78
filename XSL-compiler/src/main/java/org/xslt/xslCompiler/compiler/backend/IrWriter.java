package org.xslt.xslCompiler.compiler.backend;

import org.xslt.xslCompiler.compiler.XslCompiler;
import org.xslt.xslCompiler.compiler.visitors.IrVisitor;
import org.xslt.xslCompiler.ir.IrNode;
import org.xslt.util.IIndentStream;
import org.xslt.util.IndentStream;

import javax.annotation.Nullable;

/** Prints a graph as indented text, one node per line.
 * Definitions are printed with their children; references are printed as
 * {@code -> KIND#id} and not expanded. */
public class IrWriter extends IrVisitor {
    final IIndentStream builder;

    public IrWriter(XslCompiler compiler, IIndentStream builder) {
        super(compiler);
        this.builder = builder;
    }

    public static String toString(XslCompiler compiler, IrNode root) {
        StringBuilder result = new StringBuilder();
        IrWriter writer = new IrWriter(compiler, new IndentStream(result));
        writer.apply(root);
        return result.toString();
    }

    @Nullable
    @Override
    public IrNode visit(@Nullable IrNode node) {
        if (node == null)
            return this.visitNull();
        node.toString(this.builder);
        if (node.getChildCount() == 0) {
            this.builder.newline();
            return node;
        }
        this.builder.increase();
        super.visit(node);
        this.builder.decrease();
        return node;
    }

    @Nullable
    @Override
    protected IrNode visitNull() {
        this.builder.append("<null>").newline();
        return null;
    }

    @Nullable
    @Override
    protected IrNode visitReference(@Nullable IrNode node) {
        if (node == null)
            return this.visitNull();
        this.builder.append("-> ");
        node.toString(this.builder);
        this.builder.newline();
        return node;
    }
}
