package org.xslt.xslCompiler.ir;

import java.util.Objects;

/** Opaque description of an XML query type, carried by type literals and type operators.
 * The core does not interpret the code; type checking is done elsewhere. */
public final class IrTypeDescriptor {
    /** Textual code of the type, e.g., "node*" or "xs:string?". */
    public final String code;

    public IrTypeDescriptor(String code) {
        this.code = code;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        IrTypeDescriptor that = (IrTypeDescriptor) o;
        return this.code.equals(that.code);
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.code);
    }

    @Override
    public String toString() {
        return this.code;
    }
}
