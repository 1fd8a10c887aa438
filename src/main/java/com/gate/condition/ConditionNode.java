package com.gate.condition;

import com.gate.render.ConditionRenderer;

/**
 * A node in a condition expression tree.
 * <p>
 * Nodes are immutable and own their children exclusively, so every tree is finite
 * and acyclic. The set of node kinds is closed; each permitted type reports a
 * distinct {@link NodeType}.
 */
public sealed interface ConditionNode permits
        ExpressionNode,
        AndNode,
        OrNode,
        NotNode,
        ParenthesesNode,
        DisjunctionNode,
        FunctionCallNode,
        PropertyAccessNode,
        ContainsNode,
        StringLiteralNode,
        BooleanLiteralNode,
        NumberLiteralNode,
        ComparisonNode,
        TernaryNode {

    /**
     * Get the node type.
     */
    NodeType getType();

    /**
     * Render this tree in the target expression syntax.
     */
    default String render() {
        return ConditionRenderer.render(this);
    }
}
