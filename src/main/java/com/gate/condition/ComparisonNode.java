package com.gate.condition;

import java.util.Objects;

/**
 * Binary comparison, e.g. {@code github.event_name == 'issues'}.
 */
public record ComparisonNode(ConditionNode left, ComparisonOperator operator, ConditionNode right)
        implements ConditionNode {

    public ComparisonNode {
        Objects.requireNonNull(left, "left");
        Objects.requireNonNull(operator, "operator");
        Objects.requireNonNull(right, "right");
    }

    @Override
    public NodeType getType() {
        return NodeType.COMPARISON;
    }
}
