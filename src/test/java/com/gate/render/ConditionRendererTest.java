package com.gate.render;

import com.gate.condition.AndNode;
import com.gate.condition.BooleanLiteralNode;
import com.gate.condition.ComparisonNode;
import com.gate.condition.ComparisonOperator;
import com.gate.condition.ConditionNode;
import com.gate.condition.ContainsNode;
import com.gate.condition.DisjunctionNode;
import com.gate.condition.ExpressionNode;
import com.gate.condition.FunctionCallNode;
import com.gate.condition.NotNode;
import com.gate.condition.NumberLiteralNode;
import com.gate.condition.OrNode;
import com.gate.condition.ParenthesesNode;
import com.gate.condition.PropertyAccessNode;
import com.gate.condition.StringLiteralNode;
import com.gate.condition.TernaryNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ConditionRenderer.
 */
class ConditionRendererTest {

    private static final ExpressionNode A = new ExpressionNode("a");
    private static final ExpressionNode B = new ExpressionNode("b");
    private static final ExpressionNode C = new ExpressionNode("c");

    @Test
    @DisplayName("Expression renders verbatim")
    void expressionRendersVerbatim() {
        assertEquals("x == 1", ConditionRenderer.render(new ExpressionNode("x == 1")));
    }

    @Test
    @DisplayName("AND and OR parenthesize both operands")
    void binaryOperatorsParenthesizeOperands() {
        assertEquals("(a) && (b)", ConditionRenderer.render(new AndNode(A, B)));
        assertEquals("(a) || (b)", ConditionRenderer.render(new OrNode(A, B)));
    }

    @Test
    @DisplayName("OR nested in AND stays inside its parentheses")
    void orDoesNotLeakOutOfAnd() {
        OrNode or = new OrNode(A, B);

        String rendered = ConditionRenderer.render(new AndNode(or, C));

        assertEquals("((a) || (b)) && (c)", rendered);
        assertTrue(rendered.contains("(" + ConditionRenderer.render(or) + ")"));
    }

    @Test
    @DisplayName("NOT of a function call has no extra parentheses")
    void notOfFunctionCall() {
        assertEquals("!cancelled()",
                ConditionRenderer.render(new NotNode(new FunctionCallNode("cancelled", List.of()))));
    }

    @Test
    @DisplayName("NOT of anything else is parenthesized")
    void notOfExpression() {
        assertEquals("!(x == 1)", ConditionRenderer.render(new NotNode(new ExpressionNode("x == 1"))));
        assertEquals("!((a) && (b))", ConditionRenderer.render(new NotNode(new AndNode(A, B))));
    }

    @Test
    @DisplayName("Parentheses always wrap the child")
    void parenthesesAlwaysWrap() {
        assertEquals("(a)", ConditionRenderer.render(new ParenthesesNode(A)));
        assertEquals("((a) && (b))", ConditionRenderer.render(new ParenthesesNode(new AndNode(A, B))));
    }

    @Test
    @DisplayName("Disjunction degenerates for zero and one term")
    void disjunctionDegeneracy() {
        assertEquals("", ConditionRenderer.render(new DisjunctionNode(List.of())));
        assertEquals("", ConditionRenderer.render(new DisjunctionNode(List.of(), true)));
        assertEquals(ConditionRenderer.render(A), ConditionRenderer.render(new DisjunctionNode(List.of(A))));
        assertEquals("a", ConditionRenderer.render(new DisjunctionNode(List.of(A), true)));
    }

    @Test
    @DisplayName("Disjunction joins terms with ||")
    void disjunctionJoinsTerms() {
        assertEquals("a || b", ConditionRenderer.render(new DisjunctionNode(List.of(A, B))));
        assertEquals("a || (b) && (c)",
                ConditionRenderer.render(new DisjunctionNode(List.of(A, new AndNode(B, C)))));
    }

    @Test
    @DisplayName("Multiline disjunction puts one term per line with description comments")
    void multilineDisjunction() {
        DisjunctionNode disjunction = new DisjunctionNode(List.of(
                new ExpressionNode("a", "First"),
                B,
                new ExpressionNode("c", "Third")), true);

        assertEquals("# First\na ||\nb ||\n# Third\nc", ConditionRenderer.render(disjunction));
    }

    @Test
    @DisplayName("Function calls separate arguments with comma and space")
    void functionCall() {
        assertEquals("always()", ConditionRenderer.render(new FunctionCallNode("always", List.of())));
        assertEquals("startsWith(github.ref, 'refs/tags/')", ConditionRenderer.render(
                new FunctionCallNode("startsWith", List.of(
                        new PropertyAccessNode("github.ref"),
                        new StringLiteralNode("refs/tags/")))));
    }

    @ParameterizedTest
    @DisplayName("Comparison renders every operator verbatim")
    @CsvSource({
            "EQUALS, ==",
            "NOT_EQUALS, !=",
            "LESS_THAN, <",
            "GREATER_THAN, >",
            "LESS_THAN_OR_EQUALS, <=",
            "GREATER_THAN_OR_EQUALS, >="
    })
    void comparison(ComparisonOperator operator, String symbol) {
        ComparisonNode node = new ComparisonNode(
                new PropertyAccessNode("github.run_attempt"), operator, new NumberLiteralNode("2"));

        assertEquals("github.run_attempt " + symbol + " 2", ConditionRenderer.render(node));
    }

    @Test
    @DisplayName("Ternary and contains render their surface forms")
    void ternaryAndContains() {
        TernaryNode ternary = new TernaryNode(
                new PropertyAccessNode("inputs.debug"),
                new StringLiteralNode("verbose"),
                new StringLiteralNode("quiet"));
        ContainsNode contains = new ContainsNode(
                new PropertyAccessNode("github.event.issue.labels.*.name"),
                new StringLiteralNode("bug"));

        assertEquals("inputs.debug ? 'verbose' : 'quiet'", ConditionRenderer.render(ternary));
        assertEquals("contains(github.event.issue.labels.*.name, 'bug')", ConditionRenderer.render(contains));
    }

    @Test
    @DisplayName("Literals render their surface forms")
    void literals() {
        assertEquals("'main'", ConditionRenderer.render(new StringLiteralNode("main")));
        assertEquals("true", ConditionRenderer.render(new BooleanLiteralNode(true)));
        assertEquals("false", ConditionRenderer.render(new BooleanLiteralNode(false)));
        assertEquals("3.14", ConditionRenderer.render(new NumberLiteralNode("3.14")));
        assertEquals("github.event.action", ConditionRenderer.render(new PropertyAccessNode("github.event.action")));
    }

    @Test
    @DisplayName("Identical trees render identically")
    void renderingIsDeterministic() {
        ConditionNode first = new AndNode(new NotNode(new FunctionCallNode("cancelled", List.of())), A);
        ConditionNode second = new AndNode(new NotNode(new FunctionCallNode("cancelled", List.of())), A);

        assertEquals(first, second);
        assertEquals(first.render(), second.render());
    }
}
