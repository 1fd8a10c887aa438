package com.gate.condition;

import java.util.Objects;

/**
 * Reference into the evaluation context, e.g. {@code github.event.action}.
 */
public record PropertyAccessNode(String propertyPath) implements ConditionNode {

    public PropertyAccessNode {
        Objects.requireNonNull(propertyPath, "propertyPath");
    }

    @Override
    public NodeType getType() {
        return NodeType.PROPERTY_ACCESS;
    }
}
