package com.contract.extractor.analysis;

import com.contract.extractor.model.ExpressionNode;
import com.contract.extractor.visitor.MalformedTreeException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class StackBalanceValidatorTest {

    @Test
    void conditionWithoutMarkersIsBalanced() {
        ExpressionNode condition = ExpressionNode.binary("&&",
                ExpressionNode.binary(">", ExpressionNode.variable("x"), ExpressionNode.literal("0")),
                ExpressionNode.not(ExpressionNode.call("isEmpty", ExpressionNode.variable("items"))));

        assertEquals(0, StackBalanceValidator.countStackMarkers(condition));
        assertTrue(StackBalanceValidator.isBalanced(condition));
    }

    @Test
    void countsMarkersAtAnyDepth() {
        ExpressionNode condition = ExpressionNode.binary("&&",
                ExpressionNode.binary(">", ExpressionNode.stackDuplicate(), ExpressionNode.literal("0")),
                ExpressionNode.call("check",
                        ExpressionNode.block(
                                ExpressionNode.assign(ExpressionNode.variable("y"), ExpressionNode.variable("x")),
                                ExpressionNode.stackDuplicate())));

        assertEquals(2, StackBalanceValidator.countStackMarkers(condition));
        assertFalse(StackBalanceValidator.isBalanced(condition));
    }

    @Test
    void skipsAbsentChildren() {
        ExpressionNode conditional = ExpressionNode.conditional(ExpressionNode.variable("b"),
                ExpressionNode.returning(null), null);
        assertTrue(StackBalanceValidator.isBalanced(conditional));
    }

    @Test
    void unrecognizedNodeIsMalformed() {
        ExpressionNode condition = ExpressionNode.binary("||",
                ExpressionNode.variable("a"), ExpressionNode.unrecognized("LambdaExpr"));
        assertThrows(MalformedTreeException.class, () -> StackBalanceValidator.countStackMarkers(condition));
    }

    @Test
    void counterAccumulatesAcrossVisits() {
        StackBalanceValidator validator = new StackBalanceValidator();
        validator.visit(ExpressionNode.stackDuplicate());
        validator.visit(ExpressionNode.unary("-", ExpressionNode.stackDuplicate()));
        assertEquals(2, validator.getStackMarkers());
    }
}
