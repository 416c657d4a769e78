package org.xslt.xslCompiler.compiler.visitors;

import org.xslt.xslCompiler.ir.IrNode;
import org.xslt.xslCompiler.ir.NodeKind;

/** Decides whether a child occurrence of a binder is its definition or a reference.
 *
 * <p>Iteration variables are defined by the first child of LOOP, FILTER and SORT,
 * and by the elements of the global variable, global parameter and formal
 * parameter lists; every other occurrence is a use.  Functions are used only
 * by INVOKE; every other occurrence (normally the function list) is the definition. */
public final class ReferenceClassifier {
    private ReferenceClassifier() {}

    public static boolean isReference(IrNode parent, int index) {
        IrNode child = parent.getChild(index);
        if (child == null)
            return false;
        NodeKind kind = child.getKind();
        if (kind.isVariableBinder()) {
            NodeKind parentKind = parent.getKind();
            if (parentKind.isLoop())
                return index == 1;
            if (parentKind.isDefinitionList())
                return false;
            return true;
        }
        if (kind == NodeKind.FUNCTION)
            return parent.getKind() == NodeKind.INVOKE;
        return false;
    }
}
