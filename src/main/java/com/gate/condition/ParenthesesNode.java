package com.gate.condition;

import java.util.Objects;

/**
 * Explicit grouping. Always rendered inside parentheses, whatever the child is.
 */
public record ParenthesesNode(ConditionNode child) implements ConditionNode {

    public ParenthesesNode {
        Objects.requireNonNull(child, "child");
    }

    @Override
    public NodeType getType() {
        return NodeType.PARENTHESES;
    }
}
