package org.xslt.xslCompiler.compiler.visitors;

import org.xslt.xslCompiler.compiler.XslCompiler;

/** Deep copy of a graph.  Every node is rebuilt; each binder is copied once
 * and all references point to the copy. */
public class CloneVisitor extends IrRewriteVisitor {
    public CloneVisitor(XslCompiler compiler) {
        super(compiler, true);
    }
}
