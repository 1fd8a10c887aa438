package com.gate.condition;

import java.util.Objects;

public record StringLiteralNode(String value) implements ConditionNode {

    public StringLiteralNode {
        Objects.requireNonNull(value, "value");
    }

    @Override
    public NodeType getType() {
        return NodeType.STRING_LITERAL;
    }
}
