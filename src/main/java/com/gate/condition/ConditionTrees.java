package com.gate.condition;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * Tree walking helpers.
 */
public final class ConditionTrees {

    private ConditionTrees() {
    }

    /**
     * Call the visitor for every {@link ExpressionNode} reachable through the logical
     * nodes (AND, OR, NOT, parentheses, disjunction). Other node kinds are complete
     * expressions on their own and are not descended into.
     * <p>
     * An exception thrown by the visitor stops the walk and propagates.
     */
    public static void visitExpressions(ConditionNode node, Consumer<ExpressionNode> visitor) {
        if (node == null) {
            return;
        }
        switch (node.getType()) {
            case EXPRESSION -> visitor.accept((ExpressionNode) node);
            case AND -> {
                AndNode and = (AndNode) node;
                visitExpressions(and.left(), visitor);
                visitExpressions(and.right(), visitor);
            }
            case OR -> {
                OrNode or = (OrNode) node;
                visitExpressions(or.left(), visitor);
                visitExpressions(or.right(), visitor);
            }
            case NOT -> visitExpressions(((NotNode) node).child(), visitor);
            case PARENTHESES -> visitExpressions(((ParenthesesNode) node).child(), visitor);
            case DISJUNCTION -> {
                for (ConditionNode term : ((DisjunctionNode) node).terms()) {
                    visitExpressions(term, visitor);
                }
            }
            case FUNCTION_CALL, PROPERTY_ACCESS, CONTAINS, STRING_LITERAL, BOOLEAN_LITERAL,
                    NUMBER_LITERAL, COMPARISON, TERNARY -> {
                // leaves for the purpose of this walk
            }
        }
    }

    /**
     * Collect the {@link ExpressionNode} leaves in visiting order.
     */
    public static List<ExpressionNode> collectExpressions(ConditionNode node) {
        List<ExpressionNode> expressions = new ArrayList<>();
        visitExpressions(node, expressions::add);
        return expressions;
    }
}
