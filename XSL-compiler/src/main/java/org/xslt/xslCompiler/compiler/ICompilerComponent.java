package org.xslt.xslCompiler.compiler;

/** Interface implemented by all classes which are part of a compilation. */
public interface ICompilerComponent {
    XslCompiler compiler();
}
