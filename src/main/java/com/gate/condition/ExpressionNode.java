package com.gate.condition;

import java.util.Objects;

/**
 * Opaque sub-expression rendered verbatim.
 *
 * @param expression  Raw expression text
 * @param description Optional comment emitted before the term in multiline disjunctions
 */
public record ExpressionNode(String expression, String description) implements ConditionNode {

    public ExpressionNode {
        Objects.requireNonNull(expression, "expression");
        description = description == null ? "" : description;
    }

    public ExpressionNode(String expression) {
        this(expression, "");
    }

    public boolean hasDescription() {
        return !description.isEmpty();
    }

    @Override
    public NodeType getType() {
        return NodeType.EXPRESSION;
    }
}
