package com.gate.condition;

import java.util.Objects;

/**
 * Binary logical OR of two conditions.
 */
public record OrNode(ConditionNode left, ConditionNode right) implements ConditionNode {

    public OrNode {
        Objects.requireNonNull(left, "left");
        Objects.requireNonNull(right, "right");
    }

    @Override
    public NodeType getType() {
        return NodeType.OR;
    }
}
