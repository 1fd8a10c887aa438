package com.gate.condition;

import java.util.Objects;

/**
 * Array membership check, rendered as a {@code contains(array, value)} call.
 */
public record ContainsNode(ConditionNode array, ConditionNode value) implements ConditionNode {

    public ContainsNode {
        Objects.requireNonNull(array, "array");
        Objects.requireNonNull(value, "value");
    }

    @Override
    public NodeType getType() {
        return NodeType.CONTAINS;
    }
}
