/*
 * Copyright 2022 VMware, Inc.
 * SPDX-License-Identifier: MIT
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all
 * copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 */

package org.xslt.xslCompiler.ir;

/** The closed set of IR node kinds.
 * Each kind belongs to a family and has a fixed shape; the shape determines
 * how many children a node of this kind has. */
public enum NodeKind {
    // meta
    PROGRAM(Family.META, Shape.QUATERNARY),
    FUNCTION_LIST(Family.META, Shape.LIST),
    GLOBAL_VARIABLE_LIST(Family.META, Shape.LIST),
    GLOBAL_PARAMETER_LIST(Family.META, Shape.LIST),
    ACTUAL_PARAMETER_LIST(Family.META, Shape.LIST),
    FORMAL_PARAMETER_LIST(Family.META, Shape.LIST),
    SORT_KEY_LIST(Family.META, Shape.LIST),
    BRANCH_LIST(Family.META, Shape.LIST),
    OPTIMIZE_BARRIER(Family.META, Shape.UNARY),
    UNKNOWN(Family.META, Shape.LIST),

    // specials
    DATA_SOURCE(Family.SPECIAL, Shape.BINARY),
    NOP(Family.SPECIAL, Shape.UNARY),
    ERROR(Family.SPECIAL, Shape.UNARY),
    WARNING(Family.SPECIAL, Shape.UNARY),

    // variables
    FOR(Family.VARIABLE, Shape.UNARY),
    LET(Family.VARIABLE, Shape.UNARY),
    PARAMETER(Family.VARIABLE, Shape.BINARY),
    POSITION_OF(Family.VARIABLE, Shape.UNARY),

    // literals
    TRUE(Family.LITERAL, Shape.NULLARY),
    FALSE(Family.LITERAL, Shape.NULLARY),
    LITERAL_STRING(Family.LITERAL, Shape.NULLARY),
    LITERAL_INT32(Family.LITERAL, Shape.NULLARY),
    LITERAL_INT64(Family.LITERAL, Shape.NULLARY),
    LITERAL_DOUBLE(Family.LITERAL, Shape.NULLARY),
    LITERAL_DECIMAL(Family.LITERAL, Shape.NULLARY),
    LITERAL_QNAME(Family.LITERAL, Shape.NULLARY),
    LITERAL_TYPE(Family.LITERAL, Shape.NULLARY),
    LITERAL_OBJECT(Family.LITERAL, Shape.NULLARY),

    // boolean operators
    AND(Family.BOOLEAN, Shape.BINARY),
    OR(Family.BOOLEAN, Shape.BINARY),
    NOT(Family.BOOLEAN, Shape.UNARY),

    // choice
    CONDITIONAL(Family.CHOICE, Shape.TERNARY),
    CHOICE(Family.CHOICE, Shape.BINARY),

    // collection operators
    LENGTH(Family.COLLECTION, Shape.UNARY),
    SEQUENCE(Family.COLLECTION, Shape.LIST),
    UNION(Family.COLLECTION, Shape.BINARY),
    INTERSECTION(Family.COLLECTION, Shape.BINARY),
    DIFFERENCE(Family.COLLECTION, Shape.BINARY),
    AVERAGE(Family.COLLECTION, Shape.UNARY),
    SUM(Family.COLLECTION, Shape.UNARY),
    MINIMUM(Family.COLLECTION, Shape.UNARY),
    MAXIMUM(Family.COLLECTION, Shape.UNARY),

    // arithmetic operators
    NEGATE(Family.ARITHMETIC, Shape.UNARY),
    ADD(Family.ARITHMETIC, Shape.BINARY),
    SUBTRACT(Family.ARITHMETIC, Shape.BINARY),
    MULTIPLY(Family.ARITHMETIC, Shape.BINARY),
    DIVIDE(Family.ARITHMETIC, Shape.BINARY),
    MODULO(Family.ARITHMETIC, Shape.BINARY),

    // string operators
    STR_LENGTH(Family.STRING, Shape.UNARY),
    STR_CONCAT(Family.STRING, Shape.BINARY),
    STR_PARSE_QNAME(Family.STRING, Shape.BINARY),

    // value comparison operators
    NE(Family.VALUE_COMPARISON, Shape.BINARY),
    EQ(Family.VALUE_COMPARISON, Shape.BINARY),
    GT(Family.VALUE_COMPARISON, Shape.BINARY),
    GE(Family.VALUE_COMPARISON, Shape.BINARY),
    LT(Family.VALUE_COMPARISON, Shape.BINARY),
    LE(Family.VALUE_COMPARISON, Shape.BINARY),

    // node comparison operators
    IS(Family.NODE_COMPARISON, Shape.BINARY),
    AFTER(Family.NODE_COMPARISON, Shape.BINARY),
    BEFORE(Family.NODE_COMPARISON, Shape.BINARY),

    // loops
    LOOP(Family.LOOP, Shape.BINARY),
    FILTER(Family.LOOP, Shape.BINARY),

    // sorting
    SORT(Family.SORTING, Shape.BINARY),
    SORT_KEY(Family.SORTING, Shape.BINARY),
    DOC_ORDER_DISTINCT(Family.SORTING, Shape.UNARY),

    // function definition and invocation
    FUNCTION(Family.FUNCTION, Shape.TERNARY),
    INVOKE(Family.FUNCTION, Shape.BINARY),

    // XML navigation
    CONTENT(Family.XML_NAVIGATION, Shape.UNARY),
    ATTRIBUTE(Family.XML_NAVIGATION, Shape.BINARY),
    PARENT(Family.XML_NAVIGATION, Shape.UNARY),
    ROOT(Family.XML_NAVIGATION, Shape.UNARY),
    XML_CONTEXT(Family.XML_NAVIGATION, Shape.NULLARY),
    DESCENDANT(Family.XML_NAVIGATION, Shape.UNARY),
    DESCENDANT_OR_SELF(Family.XML_NAVIGATION, Shape.UNARY),
    ANCESTOR(Family.XML_NAVIGATION, Shape.UNARY),
    ANCESTOR_OR_SELF(Family.XML_NAVIGATION, Shape.UNARY),
    PRECEDING(Family.XML_NAVIGATION, Shape.UNARY),
    FOLLOWING_SIBLING(Family.XML_NAVIGATION, Shape.UNARY),
    PRECEDING_SIBLING(Family.XML_NAVIGATION, Shape.UNARY),
    NODE_RANGE(Family.XML_NAVIGATION, Shape.BINARY),
    DEREF(Family.XML_NAVIGATION, Shape.BINARY),

    // XML construction
    ELEMENT_CTOR(Family.XML_CONSTRUCTION, Shape.BINARY),
    ATTRIBUTE_CTOR(Family.XML_CONSTRUCTION, Shape.BINARY),
    COMMENT_CTOR(Family.XML_CONSTRUCTION, Shape.UNARY),
    PI_CTOR(Family.XML_CONSTRUCTION, Shape.BINARY),
    TEXT_CTOR(Family.XML_CONSTRUCTION, Shape.UNARY),
    RAW_TEXT_CTOR(Family.XML_CONSTRUCTION, Shape.UNARY),
    DOCUMENT_CTOR(Family.XML_CONSTRUCTION, Shape.UNARY),
    NAMESPACE_DECL(Family.XML_CONSTRUCTION, Shape.BINARY),
    RTF_CTOR(Family.XML_CONSTRUCTION, Shape.BINARY),

    // node properties
    NAME_OF(Family.NODE_PROPERTY, Shape.UNARY),
    LOCAL_NAME_OF(Family.NODE_PROPERTY, Shape.UNARY),
    NAMESPACE_URI_OF(Family.NODE_PROPERTY, Shape.UNARY),
    PREFIX_OF(Family.NODE_PROPERTY, Shape.UNARY),

    // type operators
    TYPE_ASSERT(Family.TYPE_OPERATOR, Shape.BINARY),
    IS_TYPE(Family.TYPE_OPERATOR, Shape.BINARY),
    IS_EMPTY(Family.TYPE_OPERATOR, Shape.UNARY),

    // XPath operators
    XPATH_NODE_VALUE(Family.XPATH, Shape.UNARY),
    XPATH_FOLLOWING(Family.XPATH, Shape.UNARY),
    XPATH_PRECEDING(Family.XPATH, Shape.UNARY),
    XPATH_NAMESPACE(Family.XPATH, Shape.UNARY),

    // XSLT
    XSLT_GENERATE_ID(Family.XSLT, Shape.UNARY),
    XSLT_INVOKE_LATE_BOUND(Family.XSLT, Shape.BINARY),
    XSLT_INVOKE_EARLY_BOUND(Family.XSLT, Shape.TERNARY),
    XSLT_COPY(Family.XSLT, Shape.BINARY),
    XSLT_COPY_OF(Family.XSLT, Shape.UNARY),
    XSLT_CONVERT(Family.XSLT, Shape.BINARY);

    public enum Family {
        META,
        SPECIAL,
        VARIABLE,
        LITERAL,
        BOOLEAN,
        CHOICE,
        COLLECTION,
        ARITHMETIC,
        STRING,
        VALUE_COMPARISON,
        NODE_COMPARISON,
        LOOP,
        SORTING,
        FUNCTION,
        XML_NAVIGATION,
        XML_CONSTRUCTION,
        NODE_PROPERTY,
        TYPE_OPERATOR,
        XPATH,
        XSLT
    }

    public enum Shape {
        NULLARY(0),
        UNARY(1),
        BINARY(2),
        TERNARY(3),
        QUATERNARY(4),
        /** Ordered list with any number of children. */
        LIST(-1);

        /** Number of children; negative for lists. */
        public final int arity;

        Shape(int arity) {
            this.arity = arity;
        }

        public boolean isFixed() {
            return this.arity >= 0;
        }
    }

    private final Family family;
    private final Shape shape;

    NodeKind(Family family, Shape shape) {
        this.family = family;
        this.shape = shape;
    }

    public Family getFamily() {
        return this.family;
    }

    public Shape getShape() {
        return this.shape;
    }

    /** Number of children of nodes of this kind, or -1 for lists. */
    public int getArity() {
        return this.shape.arity;
    }

    /** True for kinds built by a node class of their own, which visitors rely on,
     * and not by the generic class for their shape. */
    public boolean hasDedicatedClass() {
        switch (this) {
            case PROGRAM:
            case FOR:
            case LET:
            case PARAMETER:
            case FUNCTION:
            case LOOP:
            case FILTER:
            case SORT:
            case INVOKE:
            case SORT_KEY:
            case TYPE_ASSERT:
            case IS_TYPE:
            case XSLT_CONVERT:
            case DATA_SOURCE:
            case CHOICE:
            case STR_CONCAT:
            case XSLT_INVOKE_LATE_BOUND:
            case XSLT_INVOKE_EARLY_BOUND:
                return true;
            default:
                return this.family == Family.LITERAL;
        }
    }

    /** True for kinds which introduce a name binding.
     * A node of such a kind is allocated once and linked from every use. */
    public boolean isBinder() {
        return this.isVariableBinder() || this == FUNCTION;
    }

    /** Binders that stand for a value: iteration variables, let bindings and parameters. */
    public boolean isVariableBinder() {
        return this == FOR || this == LET || this == PARAMETER;
    }

    /** Lists whose elements are all binder definitions. */
    public boolean isDefinitionList() {
        return this == GLOBAL_VARIABLE_LIST || this == GLOBAL_PARAMETER_LIST || this == FORMAL_PARAMETER_LIST;
    }

    /** Constructs which bind their first child and use it from their second child. */
    public boolean isLoop() {
        return this == LOOP || this == FILTER || this == SORT;
    }
}
