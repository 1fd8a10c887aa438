package com.gate.condition;

import java.util.List;
import java.util.Objects;

/**
 * Function call such as {@code startsWith(github.ref, 'refs/tags/')}.
 */
public record FunctionCallNode(String functionName, List<ConditionNode> arguments) implements ConditionNode {

    public FunctionCallNode {
        Objects.requireNonNull(functionName, "functionName");
        arguments = arguments == null ? List.of() : List.copyOf(arguments);
    }

    @Override
    public NodeType getType() {
        return NodeType.FUNCTION_CALL;
    }
}
