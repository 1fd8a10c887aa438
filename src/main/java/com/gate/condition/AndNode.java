package com.gate.condition;

import java.util.Objects;

/**
 * Binary logical AND of two conditions.
 */
public record AndNode(ConditionNode left, ConditionNode right) implements ConditionNode {

    public AndNode {
        Objects.requireNonNull(left, "left");
        Objects.requireNonNull(right, "right");
    }

    @Override
    public NodeType getType() {
        return NodeType.AND;
    }
}
