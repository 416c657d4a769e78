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

package org.xslt.xslCompiler.compiler.visitors;

import org.xslt.xslCompiler.compiler.ICompilerComponent;
import org.xslt.xslCompiler.compiler.XslCompiler;
import org.xslt.xslCompiler.compiler.errors.InternalCompilerError;
import org.xslt.xslCompiler.ir.IrBinary;
import org.xslt.xslCompiler.ir.IrChoice;
import org.xslt.xslCompiler.ir.IrDataSource;
import org.xslt.xslCompiler.ir.IrFunction;
import org.xslt.xslCompiler.ir.IrInvoke;
import org.xslt.xslCompiler.ir.IrInvokeEarlyBound;
import org.xslt.xslCompiler.ir.IrInvokeLateBound;
import org.xslt.xslCompiler.ir.IrIterator;
import org.xslt.xslCompiler.ir.IrList;
import org.xslt.xslCompiler.ir.IrLiteral;
import org.xslt.xslCompiler.ir.IrLoop;
import org.xslt.xslCompiler.ir.IrName;
import org.xslt.xslCompiler.ir.IrNode;
import org.xslt.xslCompiler.ir.IrNullary;
import org.xslt.xslCompiler.ir.IrParameter;
import org.xslt.xslCompiler.ir.IrProgram;
import org.xslt.xslCompiler.ir.IrSortKey;
import org.xslt.xslCompiler.ir.IrStrConcat;
import org.xslt.xslCompiler.ir.IrTargetType;
import org.xslt.xslCompiler.ir.IrTernary;
import org.xslt.xslCompiler.ir.IrUnary;
import org.xslt.xslCompiler.ir.NodeKind;
import org.xslt.util.IHasId;
import org.xslt.util.IWritesLogs;
import org.xslt.util.Logger;
import org.xslt.util.Utilities;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/** Depth-first traversal of an IR graph.
 *
 * <p>{@link #visit} dispatches on the kind of a node and calls exactly one
 * handler; override individual handlers to change the behavior for some kinds,
 * override {@link #visit} to change it for all kinds, or override
 * {@link #visitChildren} to change the order in which children are visited.
 *
 * <p>The graph shares binder nodes (FOR, LET, PARAMETER, FUNCTION) between their
 * definition and all their uses.  Each child occurrence is classified with
 * {@link #isReference}; references are dispatched to the {@code visit*Reference}
 * handlers, which by default do not descend.  This visits every definition
 * once and terminates on recursive functions.
 *
 * <p>Handlers return a node; passes which only inspect the graph return their
 * argument. */
@SuppressWarnings({"SameReturnValue", "unused"})
public abstract class IrVisitor implements IrTransform, IWritesLogs, IHasId, ICompilerComponent {
    final long id;
    static final AtomicLong nextId = new AtomicLong();
    public final XslCompiler compiler;
    protected final List<IrNode> context;

    protected IrVisitor(XslCompiler compiler) {
        this.id = nextId.getAndIncrement();
        this.compiler = compiler;
        this.context = new ArrayList<>();
    }

    @Override
    public XslCompiler compiler() {
        return this.compiler;
    }

    @Override
    public long getId() {
        return this.id;
    }

    public void push(IrNode node) {
        this.context.add(node);
    }

    public void pop(IrNode node) {
        IrNode last = Utilities.removeLast(this.context);
        if (node != last)
            throw new InternalCompilerError("Corrupted visitor context: popping " + node
                    + " instead of " + last, node);
    }

    /** The node whose children are being visited; null at the root. */
    @Nullable
    public IrNode getParent() {
        if (this.context.isEmpty())
            return null;
        return Utilities.last(this.context);
    }

    /** Override to initialize before visiting any node. */
    public void startVisit(IrNode node) {
        Logger.INSTANCE.belowLevel(this, 4)
                .append("Starting ")
                .appendSupplier(this::toString)
                .append(" at ")
                .append(node)
                .newline();
    }

    /** Override to finish after visiting all nodes. */
    public void endVisit() {}

    /** Visit a graph starting at the root, which is a definition. */
    @Override
    public IrNode apply(IrNode node) {
        this.startVisit(node);
        IrNode result = this.visit(node);
        Utilities.enforce(this.context.isEmpty(), "Visitor context not empty after traversal");
        this.endVisit();
        return result;
    }

    /** True if the child at the specified index of the parent is a reference to a binder
     * defined elsewhere, and not the definition of the binder. */
    protected boolean isReference(IrNode parent, int index) {
        return ReferenceClassifier.isReference(parent, index);
    }

    /** Visit all children of the parent in order; references are visited with
     * {@link #visitReference}, all other children with {@link #visit}. */
    protected IrNode visitChildren(IrNode parent) {
        this.push(parent);
        for (int i = 0; i < parent.getChildCount(); i++) {
            IrNode child = parent.getChild(i);
            if (this.isReference(parent, i))
                this.visitReference(child);
            else
                this.visit(child);
        }
        this.pop(parent);
        return parent;
    }

    /** Visit a node which may be the definition or a reference.
     * Binders are assumed to be references; anything else is a definition. */
    protected IrNode visitAssumeReference(IrNode node) {
        if (node.isBinder())
            return this.visitReference(node);
        return this.visit(node);
    }

    /** Visit a node reached through a definition edge. */
    @Nullable
    public IrNode visit(@Nullable IrNode node) {
        if (node == null)
            return this.visitNull();
        switch (node.getKind()) {
            case PROGRAM:
                return this.visitProgram(node.to(IrProgram.class));
            case FUNCTION_LIST:
                return this.visitFunctionList(node.to(IrList.class));
            case GLOBAL_VARIABLE_LIST:
                return this.visitGlobalVariableList(node.to(IrList.class));
            case GLOBAL_PARAMETER_LIST:
                return this.visitGlobalParameterList(node.to(IrList.class));
            case ACTUAL_PARAMETER_LIST:
                return this.visitActualParameterList(node.to(IrList.class));
            case FORMAL_PARAMETER_LIST:
                return this.visitFormalParameterList(node.to(IrList.class));
            case SORT_KEY_LIST:
                return this.visitSortKeyList(node.to(IrList.class));
            case BRANCH_LIST:
                return this.visitBranchList(node.to(IrList.class));
            case OPTIMIZE_BARRIER:
                return this.visitOptimizeBarrier(node.to(IrUnary.class));
            case UNKNOWN:
                return this.visitUnknown(node);
            case DATA_SOURCE:
                return this.visitDataSource(node.to(IrDataSource.class));
            case NOP:
                return this.visitNop(node.to(IrUnary.class));
            case ERROR:
                return this.visitError(node.to(IrUnary.class));
            case WARNING:
                return this.visitWarning(node.to(IrUnary.class));
            case FOR:
                return this.visitFor(node.to(IrIterator.class));
            case LET:
                return this.visitLet(node.to(IrIterator.class));
            case PARAMETER:
                return this.visitParameter(node.to(IrParameter.class));
            case POSITION_OF:
                return this.visitPositionOf(node.to(IrUnary.class));
            case TRUE:
                return this.visitTrue(node.to(IrNullary.class));
            case FALSE:
                return this.visitFalse(node.to(IrNullary.class));
            case LITERAL_STRING:
                return this.visitLiteralString(node.to(IrLiteral.class));
            case LITERAL_INT32:
                return this.visitLiteralInt32(node.to(IrLiteral.class));
            case LITERAL_INT64:
                return this.visitLiteralInt64(node.to(IrLiteral.class));
            case LITERAL_DOUBLE:
                return this.visitLiteralDouble(node.to(IrLiteral.class));
            case LITERAL_DECIMAL:
                return this.visitLiteralDecimal(node.to(IrLiteral.class));
            case LITERAL_QNAME:
                return this.visitLiteralQname(node.to(IrName.class));
            case LITERAL_TYPE:
                return this.visitLiteralType(node.to(IrLiteral.class));
            case LITERAL_OBJECT:
                return this.visitLiteralObject(node.to(IrLiteral.class));
            case AND:
                return this.visitAnd(node.to(IrBinary.class));
            case OR:
                return this.visitOr(node.to(IrBinary.class));
            case NOT:
                return this.visitNot(node.to(IrUnary.class));
            case CONDITIONAL:
                return this.visitConditional(node.to(IrTernary.class));
            case CHOICE:
                return this.visitChoice(node.to(IrChoice.class));
            case LENGTH:
                return this.visitLength(node.to(IrUnary.class));
            case SEQUENCE:
                return this.visitSequence(node.to(IrList.class));
            case UNION:
                return this.visitUnion(node.to(IrBinary.class));
            case INTERSECTION:
                return this.visitIntersection(node.to(IrBinary.class));
            case DIFFERENCE:
                return this.visitDifference(node.to(IrBinary.class));
            case AVERAGE:
                return this.visitAverage(node.to(IrUnary.class));
            case SUM:
                return this.visitSum(node.to(IrUnary.class));
            case MINIMUM:
                return this.visitMinimum(node.to(IrUnary.class));
            case MAXIMUM:
                return this.visitMaximum(node.to(IrUnary.class));
            case NEGATE:
                return this.visitNegate(node.to(IrUnary.class));
            case ADD:
                return this.visitAdd(node.to(IrBinary.class));
            case SUBTRACT:
                return this.visitSubtract(node.to(IrBinary.class));
            case MULTIPLY:
                return this.visitMultiply(node.to(IrBinary.class));
            case DIVIDE:
                return this.visitDivide(node.to(IrBinary.class));
            case MODULO:
                return this.visitModulo(node.to(IrBinary.class));
            case STR_LENGTH:
                return this.visitStrLength(node.to(IrUnary.class));
            case STR_CONCAT:
                return this.visitStrConcat(node.to(IrStrConcat.class));
            case STR_PARSE_QNAME:
                return this.visitStrParseQname(node.to(IrBinary.class));
            case NE:
                return this.visitNe(node.to(IrBinary.class));
            case EQ:
                return this.visitEq(node.to(IrBinary.class));
            case GT:
                return this.visitGt(node.to(IrBinary.class));
            case GE:
                return this.visitGe(node.to(IrBinary.class));
            case LT:
                return this.visitLt(node.to(IrBinary.class));
            case LE:
                return this.visitLe(node.to(IrBinary.class));
            case IS:
                return this.visitIs(node.to(IrBinary.class));
            case AFTER:
                return this.visitAfter(node.to(IrBinary.class));
            case BEFORE:
                return this.visitBefore(node.to(IrBinary.class));
            case LOOP:
                return this.visitLoop(node.to(IrLoop.class));
            case FILTER:
                return this.visitFilter(node.to(IrLoop.class));
            case SORT:
                return this.visitSort(node.to(IrLoop.class));
            case SORT_KEY:
                return this.visitSortKey(node.to(IrSortKey.class));
            case DOC_ORDER_DISTINCT:
                return this.visitDocOrderDistinct(node.to(IrUnary.class));
            case FUNCTION:
                return this.visitFunction(node.to(IrFunction.class));
            case INVOKE:
                return this.visitInvoke(node.to(IrInvoke.class));
            case CONTENT:
                return this.visitContent(node.to(IrUnary.class));
            case ATTRIBUTE:
                return this.visitAttribute(node.to(IrBinary.class));
            case PARENT:
                return this.visitParent(node.to(IrUnary.class));
            case ROOT:
                return this.visitRoot(node.to(IrUnary.class));
            case XML_CONTEXT:
                return this.visitXmlContext(node.to(IrNullary.class));
            case DESCENDANT:
                return this.visitDescendant(node.to(IrUnary.class));
            case DESCENDANT_OR_SELF:
                return this.visitDescendantOrSelf(node.to(IrUnary.class));
            case ANCESTOR:
                return this.visitAncestor(node.to(IrUnary.class));
            case ANCESTOR_OR_SELF:
                return this.visitAncestorOrSelf(node.to(IrUnary.class));
            case PRECEDING:
                return this.visitPreceding(node.to(IrUnary.class));
            case FOLLOWING_SIBLING:
                return this.visitFollowingSibling(node.to(IrUnary.class));
            case PRECEDING_SIBLING:
                return this.visitPrecedingSibling(node.to(IrUnary.class));
            case NODE_RANGE:
                return this.visitNodeRange(node.to(IrBinary.class));
            case DEREF:
                return this.visitDeref(node.to(IrBinary.class));
            case ELEMENT_CTOR:
                return this.visitElementCtor(node.to(IrBinary.class));
            case ATTRIBUTE_CTOR:
                return this.visitAttributeCtor(node.to(IrBinary.class));
            case COMMENT_CTOR:
                return this.visitCommentCtor(node.to(IrUnary.class));
            case PI_CTOR:
                return this.visitPiCtor(node.to(IrBinary.class));
            case TEXT_CTOR:
                return this.visitTextCtor(node.to(IrUnary.class));
            case RAW_TEXT_CTOR:
                return this.visitRawTextCtor(node.to(IrUnary.class));
            case DOCUMENT_CTOR:
                return this.visitDocumentCtor(node.to(IrUnary.class));
            case NAMESPACE_DECL:
                return this.visitNamespaceDecl(node.to(IrBinary.class));
            case RTF_CTOR:
                return this.visitRtfCtor(node.to(IrBinary.class));
            case NAME_OF:
                return this.visitNameOf(node.to(IrUnary.class));
            case LOCAL_NAME_OF:
                return this.visitLocalNameOf(node.to(IrUnary.class));
            case NAMESPACE_URI_OF:
                return this.visitNamespaceUriOf(node.to(IrUnary.class));
            case PREFIX_OF:
                return this.visitPrefixOf(node.to(IrUnary.class));
            case TYPE_ASSERT:
                return this.visitTypeAssert(node.to(IrTargetType.class));
            case IS_TYPE:
                return this.visitIsType(node.to(IrTargetType.class));
            case IS_EMPTY:
                return this.visitIsEmpty(node.to(IrUnary.class));
            case XPATH_NODE_VALUE:
                return this.visitXpathNodeValue(node.to(IrUnary.class));
            case XPATH_FOLLOWING:
                return this.visitXpathFollowing(node.to(IrUnary.class));
            case XPATH_PRECEDING:
                return this.visitXpathPreceding(node.to(IrUnary.class));
            case XPATH_NAMESPACE:
                return this.visitXpathNamespace(node.to(IrUnary.class));
            case XSLT_GENERATE_ID:
                return this.visitXsltGenerateId(node.to(IrUnary.class));
            case XSLT_INVOKE_LATE_BOUND:
                return this.visitXsltInvokeLateBound(node.to(IrInvokeLateBound.class));
            case XSLT_INVOKE_EARLY_BOUND:
                return this.visitXsltInvokeEarlyBound(node.to(IrInvokeEarlyBound.class));
            case XSLT_COPY:
                return this.visitXsltCopy(node.to(IrBinary.class));
            case XSLT_COPY_OF:
                return this.visitXsltCopyOf(node.to(IrUnary.class));
            case XSLT_CONVERT:
                return this.visitXsltConvert(node.to(IrTargetType.class));
            default:
                return this.visitUnknown(node);
        }
    }

    /** Visit a node which was reached through a reference edge. */
    @Nullable
    protected IrNode visitReference(@Nullable IrNode node) {
        if (node == null)
            return this.visitNull();
        switch (node.getKind()) {
            case FOR:
                return this.visitForReference(node.to(IrIterator.class));
            case LET:
                return this.visitLetReference(node.to(IrIterator.class));
            case PARAMETER:
                return this.visitParameterReference(node.to(IrParameter.class));
            case FUNCTION:
                return this.visitFunctionReference(node.to(IrFunction.class));
            default:
                return this.visitUnknown(node);
        }
    }

    @Nullable
    protected IrNode visitNull() {
        return null;
    }

    /** Called for nodes of kind {@link NodeKind#UNKNOWN}, and for references
     * to nodes that are not binders. */
    protected IrNode visitUnknown(IrNode node) {
        return this.visitChildren(node);
    }

    // references

    protected IrNode visitForReference(IrIterator node) {
        return node;
    }

    protected IrNode visitLetReference(IrIterator node) {
        return node;
    }

    protected IrNode visitParameterReference(IrParameter node) {
        return node;
    }

    protected IrNode visitFunctionReference(IrFunction node) {
        return node;
    }

    // meta

    public IrNode visitProgram(IrProgram node) {
        return this.visitChildren(node);
    }

    public IrNode visitFunctionList(IrList node) {
        return this.visitChildren(node);
    }

    public IrNode visitGlobalVariableList(IrList node) {
        return this.visitChildren(node);
    }

    public IrNode visitGlobalParameterList(IrList node) {
        return this.visitChildren(node);
    }

    public IrNode visitActualParameterList(IrList node) {
        return this.visitChildren(node);
    }

    public IrNode visitFormalParameterList(IrList node) {
        return this.visitChildren(node);
    }

    public IrNode visitSortKeyList(IrList node) {
        return this.visitChildren(node);
    }

    public IrNode visitBranchList(IrList node) {
        return this.visitChildren(node);
    }

    public IrNode visitOptimizeBarrier(IrUnary node) {
        return this.visitChildren(node);
    }

    // specials

    public IrNode visitDataSource(IrDataSource node) {
        return this.visitChildren(node);
    }

    public IrNode visitNop(IrUnary node) {
        return this.visitChildren(node);
    }

    public IrNode visitError(IrUnary node) {
        return this.visitChildren(node);
    }

    public IrNode visitWarning(IrUnary node) {
        return this.visitChildren(node);
    }

    // variables

    public IrNode visitFor(IrIterator node) {
        return this.visitChildren(node);
    }

    public IrNode visitLet(IrIterator node) {
        return this.visitChildren(node);
    }

    public IrNode visitParameter(IrParameter node) {
        return this.visitChildren(node);
    }

    public IrNode visitPositionOf(IrUnary node) {
        return this.visitChildren(node);
    }

    // literals

    public IrNode visitTrue(IrNullary node) {
        return this.visitChildren(node);
    }

    public IrNode visitFalse(IrNullary node) {
        return this.visitChildren(node);
    }

    public IrNode visitLiteralString(IrLiteral node) {
        return this.visitChildren(node);
    }

    public IrNode visitLiteralInt32(IrLiteral node) {
        return this.visitChildren(node);
    }

    public IrNode visitLiteralInt64(IrLiteral node) {
        return this.visitChildren(node);
    }

    public IrNode visitLiteralDouble(IrLiteral node) {
        return this.visitChildren(node);
    }

    public IrNode visitLiteralDecimal(IrLiteral node) {
        return this.visitChildren(node);
    }

    public IrNode visitLiteralQname(IrName node) {
        return this.visitChildren(node);
    }

    public IrNode visitLiteralType(IrLiteral node) {
        return this.visitChildren(node);
    }

    public IrNode visitLiteralObject(IrLiteral node) {
        return this.visitChildren(node);
    }

    // boolean operators

    public IrNode visitAnd(IrBinary node) {
        return this.visitChildren(node);
    }

    public IrNode visitOr(IrBinary node) {
        return this.visitChildren(node);
    }

    public IrNode visitNot(IrUnary node) {
        return this.visitChildren(node);
    }

    // choice

    public IrNode visitConditional(IrTernary node) {
        return this.visitChildren(node);
    }

    public IrNode visitChoice(IrChoice node) {
        return this.visitChildren(node);
    }

    // collection operators

    public IrNode visitLength(IrUnary node) {
        return this.visitChildren(node);
    }

    public IrNode visitSequence(IrList node) {
        return this.visitChildren(node);
    }

    public IrNode visitUnion(IrBinary node) {
        return this.visitChildren(node);
    }

    public IrNode visitIntersection(IrBinary node) {
        return this.visitChildren(node);
    }

    public IrNode visitDifference(IrBinary node) {
        return this.visitChildren(node);
    }

    public IrNode visitAverage(IrUnary node) {
        return this.visitChildren(node);
    }

    public IrNode visitSum(IrUnary node) {
        return this.visitChildren(node);
    }

    public IrNode visitMinimum(IrUnary node) {
        return this.visitChildren(node);
    }

    public IrNode visitMaximum(IrUnary node) {
        return this.visitChildren(node);
    }

    // arithmetic operators

    public IrNode visitNegate(IrUnary node) {
        return this.visitChildren(node);
    }

    public IrNode visitAdd(IrBinary node) {
        return this.visitChildren(node);
    }

    public IrNode visitSubtract(IrBinary node) {
        return this.visitChildren(node);
    }

    public IrNode visitMultiply(IrBinary node) {
        return this.visitChildren(node);
    }

    public IrNode visitDivide(IrBinary node) {
        return this.visitChildren(node);
    }

    public IrNode visitModulo(IrBinary node) {
        return this.visitChildren(node);
    }

    // string operators

    public IrNode visitStrLength(IrUnary node) {
        return this.visitChildren(node);
    }

    public IrNode visitStrConcat(IrStrConcat node) {
        return this.visitChildren(node);
    }

    public IrNode visitStrParseQname(IrBinary node) {
        return this.visitChildren(node);
    }

    // value comparison operators

    public IrNode visitNe(IrBinary node) {
        return this.visitChildren(node);
    }

    public IrNode visitEq(IrBinary node) {
        return this.visitChildren(node);
    }

    public IrNode visitGt(IrBinary node) {
        return this.visitChildren(node);
    }

    public IrNode visitGe(IrBinary node) {
        return this.visitChildren(node);
    }

    public IrNode visitLt(IrBinary node) {
        return this.visitChildren(node);
    }

    public IrNode visitLe(IrBinary node) {
        return this.visitChildren(node);
    }

    // node comparison operators

    public IrNode visitIs(IrBinary node) {
        return this.visitChildren(node);
    }

    public IrNode visitAfter(IrBinary node) {
        return this.visitChildren(node);
    }

    public IrNode visitBefore(IrBinary node) {
        return this.visitChildren(node);
    }

    // loops

    public IrNode visitLoop(IrLoop node) {
        return this.visitChildren(node);
    }

    public IrNode visitFilter(IrLoop node) {
        return this.visitChildren(node);
    }

    // sorting

    public IrNode visitSort(IrLoop node) {
        return this.visitChildren(node);
    }

    public IrNode visitSortKey(IrSortKey node) {
        return this.visitChildren(node);
    }

    public IrNode visitDocOrderDistinct(IrUnary node) {
        return this.visitChildren(node);
    }

    // function definition and invocation

    public IrNode visitFunction(IrFunction node) {
        return this.visitChildren(node);
    }

    public IrNode visitInvoke(IrInvoke node) {
        return this.visitChildren(node);
    }

    // XML navigation

    public IrNode visitContent(IrUnary node) {
        return this.visitChildren(node);
    }

    public IrNode visitAttribute(IrBinary node) {
        return this.visitChildren(node);
    }

    public IrNode visitParent(IrUnary node) {
        return this.visitChildren(node);
    }

    public IrNode visitRoot(IrUnary node) {
        return this.visitChildren(node);
    }

    public IrNode visitXmlContext(IrNullary node) {
        return this.visitChildren(node);
    }

    public IrNode visitDescendant(IrUnary node) {
        return this.visitChildren(node);
    }

    public IrNode visitDescendantOrSelf(IrUnary node) {
        return this.visitChildren(node);
    }

    public IrNode visitAncestor(IrUnary node) {
        return this.visitChildren(node);
    }

    public IrNode visitAncestorOrSelf(IrUnary node) {
        return this.visitChildren(node);
    }

    public IrNode visitPreceding(IrUnary node) {
        return this.visitChildren(node);
    }

    public IrNode visitFollowingSibling(IrUnary node) {
        return this.visitChildren(node);
    }

    public IrNode visitPrecedingSibling(IrUnary node) {
        return this.visitChildren(node);
    }

    public IrNode visitNodeRange(IrBinary node) {
        return this.visitChildren(node);
    }

    public IrNode visitDeref(IrBinary node) {
        return this.visitChildren(node);
    }

    // XML construction

    public IrNode visitElementCtor(IrBinary node) {
        return this.visitChildren(node);
    }

    public IrNode visitAttributeCtor(IrBinary node) {
        return this.visitChildren(node);
    }

    public IrNode visitCommentCtor(IrUnary node) {
        return this.visitChildren(node);
    }

    public IrNode visitPiCtor(IrBinary node) {
        return this.visitChildren(node);
    }

    public IrNode visitTextCtor(IrUnary node) {
        return this.visitChildren(node);
    }

    public IrNode visitRawTextCtor(IrUnary node) {
        return this.visitChildren(node);
    }

    public IrNode visitDocumentCtor(IrUnary node) {
        return this.visitChildren(node);
    }

    public IrNode visitNamespaceDecl(IrBinary node) {
        return this.visitChildren(node);
    }

    public IrNode visitRtfCtor(IrBinary node) {
        return this.visitChildren(node);
    }

    // node properties

    public IrNode visitNameOf(IrUnary node) {
        return this.visitChildren(node);
    }

    public IrNode visitLocalNameOf(IrUnary node) {
        return this.visitChildren(node);
    }

    public IrNode visitNamespaceUriOf(IrUnary node) {
        return this.visitChildren(node);
    }

    public IrNode visitPrefixOf(IrUnary node) {
        return this.visitChildren(node);
    }

    // type operators

    public IrNode visitTypeAssert(IrTargetType node) {
        return this.visitChildren(node);
    }

    public IrNode visitIsType(IrTargetType node) {
        return this.visitChildren(node);
    }

    public IrNode visitIsEmpty(IrUnary node) {
        return this.visitChildren(node);
    }

    // XPath operators

    public IrNode visitXpathNodeValue(IrUnary node) {
        return this.visitChildren(node);
    }

    public IrNode visitXpathFollowing(IrUnary node) {
        return this.visitChildren(node);
    }

    public IrNode visitXpathPreceding(IrUnary node) {
        return this.visitChildren(node);
    }

    public IrNode visitXpathNamespace(IrUnary node) {
        return this.visitChildren(node);
    }

    // XSLT

    public IrNode visitXsltGenerateId(IrUnary node) {
        return this.visitChildren(node);
    }

    public IrNode visitXsltInvokeLateBound(IrInvokeLateBound node) {
        return this.visitChildren(node);
    }

    public IrNode visitXsltInvokeEarlyBound(IrInvokeEarlyBound node) {
        return this.visitChildren(node);
    }

    public IrNode visitXsltCopy(IrBinary node) {
        return this.visitChildren(node);
    }

    public IrNode visitXsltCopyOf(IrUnary node) {
        return this.visitChildren(node);
    }

    public IrNode visitXsltConvert(IrTargetType node) {
        return this.visitChildren(node);
    }

    @Override
    public String toString() {
        return this.getClass().getSimpleName() + "#" + this.id;
    }
}
