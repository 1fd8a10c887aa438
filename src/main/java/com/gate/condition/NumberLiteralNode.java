package com.gate.condition;

import java.util.Objects;

/**
 * Numeric literal kept as its raw text so it renders exactly as written.
 */
public record NumberLiteralNode(String value) implements ConditionNode {

    public NumberLiteralNode {
        Objects.requireNonNull(value, "value");
    }

    @Override
    public NodeType getType() {
        return NodeType.NUMBER_LITERAL;
    }
}
