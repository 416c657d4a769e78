package org.xslt.xslCompiler.ir;

import javax.annotation.Nullable;
import java.util.Arrays;
import java.util.List;

/** Root of a compiled stylesheet or query.
 * Children: global parameter list, global variable list, function list, and the root expression. */
public class IrProgram extends IrNode {
    public IrProgram(@Nullable IrNode globalParameters, @Nullable IrNode globalVariables,
                     @Nullable IrNode functions, @Nullable IrNode root) {
        super(NodeKind.PROGRAM, Arrays.asList(globalParameters, globalVariables, functions, root));
    }

    public IrList getGlobalParameters() {
        return this.getRequiredChild(0).to(IrList.class);
    }

    public IrList getGlobalVariables() {
        return this.getRequiredChild(1).to(IrList.class);
    }

    public IrList getFunctions() {
        return this.getRequiredChild(2).to(IrList.class);
    }

    public IrNode getRoot() {
        return this.getRequiredChild(3);
    }

    @Override
    public IrNode withChildren(List<IrNode> children) {
        return new IrProgram(children.get(0), children.get(1), children.get(2), children.get(3));
    }
}
