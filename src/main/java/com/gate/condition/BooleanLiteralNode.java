package com.gate.condition;

public record BooleanLiteralNode(boolean value) implements ConditionNode {

    @Override
    public NodeType getType() {
        return NodeType.BOOLEAN_LITERAL;
    }
}
