package com.gate.render;

import com.gate.condition.AndNode;
import com.gate.condition.BooleanLiteralNode;
import com.gate.condition.ComparisonNode;
import com.gate.condition.ConditionNode;
import com.gate.condition.ContainsNode;
import com.gate.condition.DisjunctionNode;
import com.gate.condition.ExpressionNode;
import com.gate.condition.FunctionCallNode;
import com.gate.condition.NodeType;
import com.gate.condition.NotNode;
import com.gate.condition.NumberLiteralNode;
import com.gate.condition.OrNode;
import com.gate.condition.ParenthesesNode;
import com.gate.condition.PropertyAccessNode;
import com.gate.condition.StringLiteralNode;
import com.gate.condition.TernaryNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Serializes condition trees to the target expression syntax.
 * <p>
 * Rendering is a pure function of the tree. Binary AND/OR always parenthesize both
 * operands; generated pipelines depend on that exact shape.
 */
public final class ConditionRenderer {

    private ConditionRenderer() {
    }

    /**
     * Render a tree.
     *
     * @param node Root node
     * @return Expression text, empty for a disjunction without terms
     */
    public static String render(ConditionNode node) {
        Objects.requireNonNull(node, "node");

        return switch (node.getType()) {
            case EXPRESSION -> ((ExpressionNode) node).expression();
            case AND -> renderAnd((AndNode) node);
            case OR -> renderOr((OrNode) node);
            case NOT -> renderNot((NotNode) node);
            case PARENTHESES -> "(" + render(((ParenthesesNode) node).child()) + ")";
            case DISJUNCTION -> renderDisjunction((DisjunctionNode) node);
            case FUNCTION_CALL -> renderFunctionCall((FunctionCallNode) node);
            case PROPERTY_ACCESS -> ((PropertyAccessNode) node).propertyPath();
            case CONTAINS -> renderContains((ContainsNode) node);
            case STRING_LITERAL -> "'" + ((StringLiteralNode) node).value() + "'";
            case BOOLEAN_LITERAL -> ((BooleanLiteralNode) node).value() ? "true" : "false";
            case NUMBER_LITERAL -> ((NumberLiteralNode) node).value();
            case COMPARISON -> renderComparison((ComparisonNode) node);
            case TERNARY -> renderTernary((TernaryNode) node);
        };
    }

    /**
     * Render a disjunction one term per line, preceding described expression terms
     * with a {@code # description} comment line. Every term but the last ends in {@code ||}.
     */
    public static String renderMultiline(DisjunctionNode disjunction) {
        List<ConditionNode> terms = disjunction.terms();
        if (terms.isEmpty()) {
            return "";
        }
        if (terms.size() == 1) {
            return render(terms.get(0));
        }

        List<String> lines = new ArrayList<>();
        for (int i = 0; i < terms.size(); i++) {
            ConditionNode term = terms.get(i);
            StringBuilder line = new StringBuilder();

            if (term instanceof ExpressionNode expression && expression.hasDescription()) {
                line.append("# ").append(expression.description()).append('\n');
            }

            line.append(render(term));
            if (i < terms.size() - 1) {
                line.append(" ||");
            }
            lines.add(line.toString());
        }
        return String.join("\n", lines);
    }

    private static String renderAnd(AndNode node) {
        return "(" + render(node.left()) + ") && (" + render(node.right()) + ")";
    }

    private static String renderOr(OrNode node) {
        return "(" + render(node.left()) + ") || (" + render(node.right()) + ")";
    }

    private static String renderNot(NotNode node) {
        // !(fn()) is read as an object literal by the platform evaluator
        if (node.child().getType() == NodeType.FUNCTION_CALL) {
            return "!" + render(node.child());
        }
        return "!(" + render(node.child()) + ")";
    }

    private static String renderDisjunction(DisjunctionNode node) {
        List<ConditionNode> terms = node.terms();
        if (terms.isEmpty()) {
            return "";
        }
        if (terms.size() == 1) {
            return render(terms.get(0));
        }
        if (node.multiline()) {
            return renderMultiline(node);
        }
        return terms.stream()
                .map(ConditionRenderer::render)
                .collect(Collectors.joining(" || "));
    }

    private static String renderFunctionCall(FunctionCallNode node) {
        return node.functionName() + "(" + renderArguments(node.arguments()) + ")";
    }

    private static String renderContains(ContainsNode node) {
        return "contains(" + render(node.array()) + ", " + render(node.value()) + ")";
    }

    private static String renderComparison(ComparisonNode node) {
        return render(node.left()) + " " + node.operator().symbol() + " " + render(node.right());
    }

    private static String renderTernary(TernaryNode node) {
        return render(node.condition()) + " ? " + render(node.trueValue()) + " : " + render(node.falseValue());
    }

    private static String renderArguments(List<ConditionNode> arguments) {
        return arguments.stream()
                .map(ConditionRenderer::render)
                .collect(Collectors.joining(", "));
    }
}
