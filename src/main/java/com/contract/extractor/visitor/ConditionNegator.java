package com.contract.extractor.visitor;

import com.contract.extractor.model.ExpressionNode;

import java.util.Map;

/**
 * Builds the logical negation of a condition as a new tree.
 *
 * Double negations are removed, comparisons are flipped, {@code &&} and {@code ||} are
 * negated by De Morgan, and anything else is wrapped in {@code !}. The input tree is shared,
 * never modified.
 */
public class ConditionNegator extends ExpressionRewriter {

    private static final Map<String, String> INVERTED_COMPARISONS = Map.of(
            "==", "!=",
            "!=", "==",
            "<", ">=",
            ">=", "<",
            ">", "<=",
            "<=", ">"
    );

    /**
     * Negates a condition.
     *
     * @param condition the condition to negate
     * @return the negated condition
     * @throws MalformedTreeException if the condition holds a node kind with no traversal rule
     */
    public static ExpressionNode negate(ExpressionNode condition) {
        return new ConditionNegator().rewrite(condition);
    }

    @Override
    public ExpressionNode rewrite(ExpressionNode node) {
        if (node == null) {
            return null;
        }
        switch (node.getKind()) {
            case LITERAL:
            case UNARY_OP:
            case BINARY_OP:
            case UNRECOGNIZED:
                return super.rewrite(node);
            default:
                return ExpressionNode.not(node);
        }
    }

    @Override
    protected ExpressionNode rewriteLiteral(ExpressionNode node) {
        if ("true".equals(node.getPayload())) {
            return ExpressionNode.literal("false");
        }
        if ("false".equals(node.getPayload())) {
            return ExpressionNode.literal("true");
        }
        return ExpressionNode.not(node);
    }

    @Override
    protected ExpressionNode rewriteUnaryOp(ExpressionNode node) {
        if ("!".equals(node.getPayload())) {
            return node.getChild(0);
        }
        return ExpressionNode.not(node);
    }

    @Override
    protected ExpressionNode rewriteBinaryOp(ExpressionNode node) {
        String operator = node.getPayload();
        ExpressionNode left = node.getChild(0);
        ExpressionNode right = node.getChild(1);

        String inverted = INVERTED_COMPARISONS.get(operator);
        if (inverted != null) {
            return ExpressionNode.binary(inverted, left, right);
        }

        switch (operator) {
            case "&&":
                return ExpressionNode.binary("||", rewrite(left), rewrite(right));
            case "||":
                return ExpressionNode.binary("&&", rewrite(left), rewrite(right));
            default:
                return ExpressionNode.not(node);
        }
    }
}
