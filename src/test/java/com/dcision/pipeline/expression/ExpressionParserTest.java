package com.dcision.pipeline.expression;

import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ExpressionParserTest {

    @Test
    void objectiveReducesToCoefficients() {
        LinearForm form = ExpressionParser.parseExpression("45*x1 + 50*x2 + 55*x3").toLinear();

        assertEquals(45.0, form.coefficient("x1"));
        assertEquals(50.0, form.coefficient("x2"));
        assertEquals(55.0, form.coefficient("x3"));
        assertEquals(0.0, form.getConstant());
    }

    @Test
    void numberFollowedByIdentifierIsAProduct() {
        LinearForm form = ExpressionParser.parseExpression("45x1 - 2(x2 + 3)").toLinear();

        assertEquals(45.0, form.coefficient("x1"));
        assertEquals(-2.0, form.coefficient("x2"));
        assertEquals(-6.0, form.getConstant());
    }

    @Test
    void relationMovesEverythingToTheLeft() {
        Relation relation = ExpressionParser.parseRelation("x1 + x2 + x3 >= 800");

        assertEquals(RelationOperator.GREATER_OR_EQUAL, relation.getOperator());
        assertEquals(Set.of("x1", "x2", "x3"), relation.identifiers());
        LinearForm form = relation.toLinear();
        assertEquals(1.0, form.coefficient("x3"));
        assertEquals(-800.0, form.getConstant());
    }

    @Test
    void unicodeOperatorsAreNormalized() {
        assertEquals(RelationOperator.LESS_OR_EQUAL, ExpressionParser.parseRelation("2×x1 − x2 ≤ 10").getOperator());
        assertEquals(RelationOperator.GREATER_OR_EQUAL, ExpressionParser.parseRelation("x1 ≥ 0").getOperator());
        assertEquals(RelationOperator.EQUAL, ExpressionParser.parseRelation("x1 == x2").getOperator());
    }

    @Test
    void divisionByConstantIsLinear() {
        LinearForm form = ExpressionParser.parseExpression("x1 / 4 + 1.5e1").toLinear();

        assertEquals(0.25, form.coefficient("x1"));
        assertEquals(15.0, form.getConstant());
    }

    @Test
    void cancellingTermsDisappear() {
        LinearForm form = ExpressionParser.parseExpression("x1 + x2 - x1").toLinear();

        assertFalse(form.getCoefficients().containsKey("x1"));
        assertEquals(1.0, form.coefficient("x2"));
    }

    @Test
    void productOfVariablesIsNotLinear() {
        Expression expression = ExpressionParser.parseExpression("x1 * x2");

        ExpressionException e = assertThrows(ExpressionException.class, expression::toLinear);
        assertTrue(e.getMessage().contains("non-linear"));
    }

    @Test
    void divisionByVariableIsNotLinear() {
        assertThrows(ExpressionException.class, () -> ExpressionParser.parseExpression("10 / x1").toLinear());
    }

    @Test
    void malformedInputIsRejected() {
        assertThrows(ExpressionException.class, () -> ExpressionParser.parseExpression("x1 +"));
        assertThrows(ExpressionException.class, () -> ExpressionParser.parseExpression("(x1 + x2"));
        assertThrows(ExpressionException.class, () -> ExpressionParser.parseExpression("x1 $ x2"));
        assertThrows(ExpressionException.class, () -> ExpressionParser.parseExpression(" "));
        assertThrows(ExpressionException.class, () -> ExpressionParser.parseRelation("x1 + x2"));
        assertThrows(ExpressionException.class, () -> ExpressionParser.parseRelation("x1 <= 5 <= 6"));
    }

    @Test
    void numbersBeyondDoubleRangeAreRejected() {
        ExpressionException e = assertThrows(ExpressionException.class,
                () -> ExpressionParser.parseRelation("1e400*x1 <= 5"));
        assertTrue(e.getMessage().contains("out of range"));

        Expression overflow = ExpressionParser.parseExpression("1e200 * 1e200 * x1");
        assertThrows(ExpressionException.class, overflow::toLinear);
    }

    @Test
    void objectiveMustNotBeARelation() {
        assertThrows(ExpressionException.class, () -> ExpressionParser.parseExpression("x1 <= 5"));
    }
}
