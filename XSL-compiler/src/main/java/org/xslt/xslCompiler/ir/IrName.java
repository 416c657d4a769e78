package org.xslt.xslCompiler.ir;

import org.xslt.util.IIndentStream;
import org.xslt.util.Utilities;

import java.util.List;

/** A qualified name literal. */
public class IrName extends IrNode {
    public final String localName;
    public final String namespaceUri;
    public final String prefix;

    public IrName(String localName, String namespaceUri, String prefix) {
        super(NodeKind.LITERAL_QNAME);
        this.localName = localName;
        this.namespaceUri = namespaceUri;
        this.prefix = prefix;
    }

    /** A name in no namespace. */
    public IrName(String localName) {
        this(localName, "", "");
    }

    public String getLocalName() {
        return this.localName;
    }

    public String getNamespaceUri() {
        return this.namespaceUri;
    }

    public String getPrefix() {
        return this.prefix;
    }

    /** The name as written in a document, e.g., "xsl:template". */
    public String getQualifiedName() {
        if (this.prefix.isEmpty())
            return this.localName;
        return this.prefix + ":" + this.localName;
    }

    @Override
    public IrNode withChildren(List<IrNode> children) {
        Utilities.enforce(children.isEmpty());
        return new IrName(this.localName, this.namespaceUri, this.prefix);
    }

    @Override
    protected IIndentStream appendPayload(IIndentStream builder) {
        builder.append(" ").append(this.getQualifiedName());
        if (!this.namespaceUri.isEmpty())
            builder.append(" {").append(this.namespaceUri).append("}");
        return builder;
    }
}
