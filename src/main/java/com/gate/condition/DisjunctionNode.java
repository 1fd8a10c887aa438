package com.gate.condition;

import java.util.List;

/**
 * N-ary OR. Avoids the deep nesting a chain of {@link OrNode}s would produce.
 *
 * @param terms     Ordered alternatives
 * @param multiline Render one term per line, with description comments
 */
public record DisjunctionNode(List<ConditionNode> terms, boolean multiline) implements ConditionNode {

    public DisjunctionNode {
        terms = terms == null ? List.of() : List.copyOf(terms);
    }

    public DisjunctionNode(List<ConditionNode> terms) {
        this(terms, false);
    }

    @Override
    public NodeType getType() {
        return NodeType.DISJUNCTION;
    }
}
