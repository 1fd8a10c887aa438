package com.gate.expression;

import com.gate.condition.ConditionNode;
import com.gate.exception.ExpressionParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Facade for parsing raw condition strings into condition trees.
 * <p>
 * Supports:
 * <ul>
 *   <li>Logical operators: &amp;&amp;, ||, !</li>
 *   <li>Parentheses for grouping</li>
 *   <li>Any other text as an opaque literal, including function calls and quoted strings</li>
 * </ul>
 * <p>
 * Precedence: ! &gt; &amp;&amp; &gt; || (parentheses override)
 */
public final class ConditionExpressionParser {

    private static final Logger log = LoggerFactory.getLogger(ConditionExpressionParser.class);

    private ConditionExpressionParser() {
    }

    /**
     * Parse a condition expression into a tree.
     *
     * @param expression Expression string
     * @return Parsed tree
     * @throws ExpressionParseException if the expression is empty or malformed
     */
    public static ConditionNode parse(String expression) {
        log.debug("Parsing expression: {}", expression);

        if (expression == null || expression.isBlank()) {
            throw ExpressionParseException.emptyExpression(expression);
        }

        try {
            List<Token> tokens = new ExpressionTokenizer(expression).tokenize();
            ConditionNode result = new ExpressionParser(expression, tokens).parse();
            log.debug("Parsed expression with {} tokens", tokens.size());
            return result;
        } catch (ExpressionParseException e) {
            log.debug("Failed to parse expression '{}': {}", expression, e.getMessage());
            throw e;
        }
    }
}
