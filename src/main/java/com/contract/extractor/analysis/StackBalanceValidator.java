package com.contract.extractor.analysis;

import com.contract.extractor.model.ExpressionNode;
import com.contract.extractor.visitor.ExpressionInspector;

/**
 * Counts stack-duplicate markers in a subtree.
 *
 * An isolated clause condition is only re-evaluable on its own when it holds no marker: a
 * marker means the condition consumed a value duplicated earlier on the evaluation stack.
 */
public final class StackBalanceValidator extends ExpressionInspector {

    private int stackMarkers;

    @Override
    protected void visitStackDuplicate(ExpressionNode node) {
        stackMarkers++;
        super.visitStackDuplicate(node);
    }

    public int getStackMarkers() {
        return stackMarkers;
    }

    /**
     * Counts every {@code STACK_DUPLICATE} node in the subtree, at any depth.
     *
     * @throws com.contract.extractor.visitor.MalformedTreeException on a kind with no traversal rule
     */
    public static int countStackMarkers(ExpressionNode root) {
        StackBalanceValidator counter = new StackBalanceValidator();
        counter.visit(root);
        return counter.getStackMarkers();
    }

    public static boolean isBalanced(ExpressionNode root) {
        return countStackMarkers(root) == 0;
    }
}
