package com.gate.condition;

import java.util.Objects;

/**
 * Logical negation of a condition.
 */
public record NotNode(ConditionNode child) implements ConditionNode {

    public NotNode {
        Objects.requireNonNull(child, "child");
    }

    @Override
    public NodeType getType() {
        return NodeType.NOT;
    }
}
