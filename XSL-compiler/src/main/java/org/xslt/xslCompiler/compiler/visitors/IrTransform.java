package org.xslt.xslCompiler.compiler.visitors;

import org.xslt.xslCompiler.ir.IrNode;
import org.xslt.util.ICastable;

import java.util.function.Function;

/** A pass which maps an IR graph to another IR graph. */
public interface IrTransform extends Function<IrNode, IrNode>, ICastable {
}
