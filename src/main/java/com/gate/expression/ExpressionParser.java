package com.gate.expression;

import com.gate.condition.AndNode;
import com.gate.condition.ConditionNode;
import com.gate.condition.ExpressionNode;
import com.gate.condition.NotNode;
import com.gate.condition.OrNode;
import com.gate.exception.ExpressionParseException;

import java.util.List;

/**
 * Parser for condition expressions.
 * Converts tokens into a condition tree using recursive descent parsing.
 * <p>
 * Grammar (precedence: NOT > AND > OR):
 * <pre>
 * or      := and ('||' and)*
 * and     := unary ('&amp;&amp;' unary)*
 * unary   := '!' unary | primary
 * primary := '(' or ')' | literal
 * </pre>
 * Binary operators associate to the left. Literal tokens become {@link ExpressionNode}s.
 */
public final class ExpressionParser {

    private final String input;
    private final List<Token> tokens;
    private int index;

    public ExpressionParser(String input, List<Token> tokens) {
        this.input = input;
        this.tokens = tokens;
        this.index = 0;
    }

    /**
     * Parse the token stream into a condition tree.
     *
     * @return Root node
     * @throws ExpressionParseException if the tokens do not form a complete expression
     */
    public ConditionNode parse() {
        ConditionNode result = parseOr();
        if (!check(TokenType.EOF)) {
            throw unexpected();
        }
        return result;
    }

    private ConditionNode parseOr() {
        ConditionNode left = parseAnd();
        while (match(TokenType.OR)) {
            left = new OrNode(left, parseAnd());
        }
        return left;
    }

    private ConditionNode parseAnd() {
        ConditionNode left = parseUnary();
        while (match(TokenType.AND)) {
            left = new AndNode(left, parseUnary());
        }
        return left;
    }

    private ConditionNode parseUnary() {
        if (match(TokenType.NOT)) {
            return new NotNode(parseUnary());
        }
        return parsePrimary();
    }

    private ConditionNode parsePrimary() {
        if (match(TokenType.LPAREN)) {
            ConditionNode expr = parseOr();
            if (!check(TokenType.RPAREN)) {
                throw ExpressionParseException.missingClosingParen(peek().text(), peek().position(), input);
            }
            advance();
            return expr;
        }

        if (match(TokenType.LITERAL)) {
            return new ExpressionNode(previous().text());
        }

        throw unexpected();
    }

    private boolean match(TokenType type) {
        if (check(type)) {
            advance();
            return true;
        }
        return false;
    }

    private boolean check(TokenType type) {
        return peek().type() == type;
    }

    private Token advance() {
        if (!isAtEnd()) {
            index++;
        }
        return previous();
    }

    private boolean isAtEnd() {
        return peek().type() == TokenType.EOF;
    }

    private Token peek() {
        return tokens.get(index);
    }

    private Token previous() {
        return tokens.get(index - 1);
    }

    private ExpressionParseException unexpected() {
        Token token = peek();
        return ExpressionParseException.unexpectedToken(token.text(), token.position(), input);
    }
}
