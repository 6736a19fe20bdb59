package com.contract.extractor.visitor;

import com.contract.extractor.model.ExpressionNode;

/**
 * Read-only, depth-first, pre-order traversal over an expression tree.
 *
 * Subclasses keep their own accumulator state and override {@link #visitNode} (for behavior
 * common to every kind) or a per-kind method. Every per-kind method visits the node's children
 * in positional order by default. The tree is never modified.
 */
public abstract class ExpressionInspector {

    /**
     * Visits a node and its subtree. An absent node is a no-op.
     *
     * @throws MalformedTreeException if the subtree holds a node kind with no traversal rule
     */
    public void visit(ExpressionNode node) {
        if (node == null) {
            return;
        }
        visitNode(node);
    }

    /**
     * Dispatches on the node's kind. Overrides should call {@code super.visitNode(node)} to keep
     * descending.
     */
    protected void visitNode(ExpressionNode node) {
        switch (node.getKind()) {
            case LITERAL:
                visitLiteral(node);
                break;
            case VARIABLE_REF:
                visitVariableRef(node);
                break;
            case BINARY_OP:
                visitBinaryOp(node);
                break;
            case UNARY_OP:
                visitUnaryOp(node);
                break;
            case CALL:
                visitCall(node);
                break;
            case NEW_OBJECT:
                visitNewObject(node);
                break;
            case STACK_DUPLICATE:
                visitStackDuplicate(node);
                break;
            case BLOCK:
                visitBlock(node);
                break;
            case CONDITIONAL:
                visitConditional(node);
                break;
            case THROW:
                visitThrow(node);
                break;
            case RETURN:
                visitReturn(node);
                break;
            case ASSIGN:
                visitAssign(node);
                break;
            default:
                throw new MalformedTreeException(node);
        }
    }

    protected void visitChildren(ExpressionNode node) {
        for (ExpressionNode child : node.getChildren()) {
            visit(child);
        }
    }

    protected void visitLiteral(ExpressionNode node) {
        visitChildren(node);
    }

    protected void visitVariableRef(ExpressionNode node) {
        visitChildren(node);
    }

    protected void visitBinaryOp(ExpressionNode node) {
        visitChildren(node);
    }

    protected void visitUnaryOp(ExpressionNode node) {
        visitChildren(node);
    }

    protected void visitCall(ExpressionNode node) {
        visitChildren(node);
    }

    protected void visitNewObject(ExpressionNode node) {
        visitChildren(node);
    }

    protected void visitStackDuplicate(ExpressionNode node) {
        visitChildren(node);
    }

    protected void visitBlock(ExpressionNode node) {
        visitChildren(node);
    }

    protected void visitConditional(ExpressionNode node) {
        visitChildren(node);
    }

    protected void visitThrow(ExpressionNode node) {
        visitChildren(node);
    }

    protected void visitReturn(ExpressionNode node) {
        visitChildren(node);
    }

    protected void visitAssign(ExpressionNode node) {
        visitChildren(node);
    }
}
