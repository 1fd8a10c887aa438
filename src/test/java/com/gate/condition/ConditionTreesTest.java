package com.gate.condition;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ConditionTrees.
 */
class ConditionTreesTest {

    @Test
    @DisplayName("Collects expression leaves through logical nodes in order")
    void collectsExpressionLeaves() {
        ConditionNode tree = new OrNode(
                new AndNode(
                        new ExpressionNode("a"),
                        new ComparisonNode(new ExpressionNode("hidden"), ComparisonOperator.EQUALS,
                                new StringLiteralNode("x"))),
                new DisjunctionNode(List.of(
                        new ExpressionNode("b"),
                        new NotNode(new ParenthesesNode(new ExpressionNode("c"))))));

        List<String> expressions = ConditionTrees.collectExpressions(tree).stream()
                .map(ExpressionNode::expression)
                .toList();

        assertEquals(List.of("a", "b", "c"), expressions);
    }

    @Test
    @DisplayName("Null tree visits nothing")
    void nullTreeVisitsNothing() {
        assertTrue(ConditionTrees.collectExpressions(null).isEmpty());
    }

    @Test
    @DisplayName("Visitor exception stops the walk")
    void visitorExceptionPropagates() {
        ConditionNode tree = new AndNode(new ExpressionNode("bad"), new ExpressionNode("never"));

        IllegalStateException e = assertThrows(IllegalStateException.class,
                () -> ConditionTrees.visitExpressions(tree, node -> {
                    throw new IllegalStateException(node.expression());
                }));
        assertEquals("bad", e.getMessage());
    }
}
