package com.contract.extractor.visitor;

import com.contract.extractor.model.ExpressionNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Structure-preserving rewrite that builds a new tree instead of mutating the old one.
 *
 * By default every per-kind method rewrites the children and rebuilds the node only when a
 * child changed, so unchanged subtrees are shared with the input tree.
 */
public abstract class ExpressionRewriter {

    /**
     * Rewrites a node. An absent node stays absent.
     *
     * @throws MalformedTreeException if the subtree holds a node kind with no traversal rule
     */
    public ExpressionNode rewrite(ExpressionNode node) {
        if (node == null) {
            return null;
        }
        switch (node.getKind()) {
            case LITERAL:
                return rewriteLiteral(node);
            case VARIABLE_REF:
                return rewriteVariableRef(node);
            case BINARY_OP:
                return rewriteBinaryOp(node);
            case UNARY_OP:
                return rewriteUnaryOp(node);
            case CALL:
                return rewriteCall(node);
            case NEW_OBJECT:
                return rewriteNewObject(node);
            case STACK_DUPLICATE:
                return rewriteStackDuplicate(node);
            case BLOCK:
                return rewriteBlock(node);
            case CONDITIONAL:
                return rewriteConditional(node);
            case THROW:
                return rewriteThrow(node);
            case RETURN:
                return rewriteReturn(node);
            case ASSIGN:
                return rewriteAssign(node);
            default:
                throw new MalformedTreeException(node);
        }
    }

    protected ExpressionNode rewriteChildren(ExpressionNode node) {
        List<ExpressionNode> rewritten = new ArrayList<>(node.getChildCount());
        for (ExpressionNode child : node.getChildren()) {
            rewritten.add(rewrite(child));
        }
        return node.withChildren(rewritten);
    }

    protected ExpressionNode rewriteLiteral(ExpressionNode node) {
        return rewriteChildren(node);
    }

    protected ExpressionNode rewriteVariableRef(ExpressionNode node) {
        return rewriteChildren(node);
    }

    protected ExpressionNode rewriteBinaryOp(ExpressionNode node) {
        return rewriteChildren(node);
    }

    protected ExpressionNode rewriteUnaryOp(ExpressionNode node) {
        return rewriteChildren(node);
    }

    protected ExpressionNode rewriteCall(ExpressionNode node) {
        return rewriteChildren(node);
    }

    protected ExpressionNode rewriteNewObject(ExpressionNode node) {
        return rewriteChildren(node);
    }

    protected ExpressionNode rewriteStackDuplicate(ExpressionNode node) {
        return rewriteChildren(node);
    }

    protected ExpressionNode rewriteBlock(ExpressionNode node) {
        return rewriteChildren(node);
    }

    protected ExpressionNode rewriteConditional(ExpressionNode node) {
        return rewriteChildren(node);
    }

    protected ExpressionNode rewriteThrow(ExpressionNode node) {
        return rewriteChildren(node);
    }

    protected ExpressionNode rewriteReturn(ExpressionNode node) {
        return rewriteChildren(node);
    }

    protected ExpressionNode rewriteAssign(ExpressionNode node) {
        return rewriteChildren(node);
    }
}
