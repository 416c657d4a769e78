package org.xslt.xslCompiler.ir;

import org.xslt.xslCompiler.compiler.errors.InternalCompilerError;
import org.xslt.util.IIndentStream;
import org.xslt.util.Utilities;

import javax.annotation.Nullable;
import java.math.BigDecimal;
import java.util.List;

/** A literal which carries a scalar payload instead of children.
 * Booleans are not literals of this class; they are the nullary
 * {@link NodeKind#TRUE} and {@link NodeKind#FALSE} nodes.  Qualified names
 * are {@link IrName}. */
public class IrLiteral extends IrNode {
    protected final Object value;

    public IrLiteral(NodeKind kind, @Nullable Object value) {
        super(kind);
        Class<?> expected = payloadClass(kind);
        if (!expected.isInstance(value))
            throw new InternalCompilerError("Literal of kind " + kind + " cannot hold a value of type " +
                    (value == null ? "null" : value.getClass().getSimpleName()));
        this.value = value;
    }

    /** The Java class of the payload that a literal kind holds. */
    public static Class<?> payloadClass(NodeKind kind) {
        switch (kind) {
            case LITERAL_STRING:
                return String.class;
            case LITERAL_INT32:
                return Integer.class;
            case LITERAL_INT64:
                return Long.class;
            case LITERAL_DOUBLE:
                return Double.class;
            case LITERAL_DECIMAL:
                return BigDecimal.class;
            case LITERAL_TYPE:
                return IrTypeDescriptor.class;
            case LITERAL_OBJECT:
                return Object.class;
            default:
                throw new InternalCompilerError("Kind " + kind + " is not a payload literal");
        }
    }

    void checkPayloadKind(NodeKind expected) {
        if (this.kind != expected)
            throw new InternalCompilerError("Literal " + this + " does not hold a " + expected + " value", this);
    }

    public Object getValue() {
        return this.value;
    }

    public String getString() {
        this.checkPayloadKind(NodeKind.LITERAL_STRING);
        return (String) this.value;
    }

    public int getInt32() {
        this.checkPayloadKind(NodeKind.LITERAL_INT32);
        return (Integer) this.value;
    }

    public long getInt64() {
        this.checkPayloadKind(NodeKind.LITERAL_INT64);
        return (Long) this.value;
    }

    public double getDouble() {
        this.checkPayloadKind(NodeKind.LITERAL_DOUBLE);
        return (Double) this.value;
    }

    public BigDecimal getDecimal() {
        this.checkPayloadKind(NodeKind.LITERAL_DECIMAL);
        return (BigDecimal) this.value;
    }

    public IrTypeDescriptor getTypeDescriptor() {
        this.checkPayloadKind(NodeKind.LITERAL_TYPE);
        return (IrTypeDescriptor) this.value;
    }

    public Object getObject() {
        this.checkPayloadKind(NodeKind.LITERAL_OBJECT);
        return this.value;
    }

    @Override
    public IrNode withChildren(List<IrNode> children) {
        Utilities.enforce(children.isEmpty());
        return new IrLiteral(this.kind, this.value);
    }

    @Override
    protected IIndentStream appendPayload(IIndentStream builder) {
        builder.append(" ");
        if (this.kind == NodeKind.LITERAL_STRING)
            return builder.append(Utilities.singleQuote(this.getString()));
        return builder.append(this.value.toString());
    }
}
