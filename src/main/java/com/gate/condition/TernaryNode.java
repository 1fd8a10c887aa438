package com.gate.condition;

import java.util.Objects;

/**
 * Conditional expression {@code condition ? trueValue : falseValue}.
 */
public record TernaryNode(ConditionNode condition, ConditionNode trueValue, ConditionNode falseValue)
        implements ConditionNode {

    public TernaryNode {
        Objects.requireNonNull(condition, "condition");
        Objects.requireNonNull(trueValue, "trueValue");
        Objects.requireNonNull(falseValue, "falseValue");
    }

    @Override
    public NodeType getType() {
        return NodeType.TERNARY;
    }
}
