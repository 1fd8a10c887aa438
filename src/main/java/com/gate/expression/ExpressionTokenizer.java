package com.gate.expression;

import com.gate.exception.ExpressionParseException;

import java.util.ArrayList;
import java.util.List;

import static com.gate.expression.ExpressionSyntax.*;

/**
 * Tokenizer for condition expressions.
 * <p>
 * Only the logical structure is tokenized: {@code &&}, {@code ||}, {@code !} and grouping
 * parentheses. Everything else becomes a literal token, which may itself contain
 * balanced parentheses (function calls) and quoted strings. Inside quotes no operator or
 * parenthesis is recognized until the matching unescaped closing quote.
 */
public final class ExpressionTokenizer {

    private final String input;
    private final int length;
    private int pos;

    public ExpressionTokenizer(String input) {
        this.input = input;
        this.length = input.length();
        this.pos = 0;
    }

    /**
     * Tokenize the input string.
     *
     * @return List of tokens, terminated by an EOF token
     * @throws ExpressionParseException if a literal turns out to be empty
     */
    public List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();

        while (!isAtEnd()) {
            char c = peek();

            if (Character.isWhitespace(c)) {
                advance();
                continue;
            }

            int start = pos;

            if (input.startsWith(AND, pos)) {
                pos += 2;
                tokens.add(new Token(TokenType.AND, AND, start));
            } else if (input.startsWith(OR, pos)) {
                pos += 2;
                tokens.add(new Token(TokenType.OR, OR, start));
            } else if (isNotAt(input, pos)) {
                advance();
                tokens.add(new Token(TokenType.NOT, "!", start));
            } else if (c == Operators.LEFT_PAREN) {
                advance();
                tokens.add(new Token(TokenType.LPAREN, "(", start));
            } else if (c == Operators.RIGHT_PAREN) {
                advance();
                tokens.add(new Token(TokenType.RPAREN, ")", start));
            } else {
                tokens.add(readLiteral());
            }
        }

        tokens.add(new Token(TokenType.EOF, "", pos));
        return tokens;
    }

    private Token readLiteral() {
        int start = pos;
        int depth = 0;

        while (!isAtEnd()) {
            char c = peek();

            if (isQuote(c)) {
                skipQuoted(c);
                continue;
            }

            if (c == Operators.LEFT_PAREN) {
                depth++;
                advance();
                continue;
            }
            if (c == Operators.RIGHT_PAREN) {
                if (depth == 0) {
                    // closes an enclosing group
                    break;
                }
                depth--;
                advance();
                continue;
            }

            if (depth == 0 && (isLogicalOperatorAt(input, pos) || isNotAt(input, pos))) {
                break;
            }

            advance();
        }

        String literal = input.substring(start, pos).trim();
        if (literal.isEmpty()) {
            throw ExpressionParseException.emptyLiteral(start, input);
        }
        return new Token(TokenType.LITERAL, literal, start);
    }

    private void skipQuoted(char quote) {
        advance(); // opening quote
        while (!isAtEnd()) {
            char c = advance();
            if (c == quote) {
                return;
            }
            if (c == Operators.BACKSLASH && !isAtEnd()) {
                advance();
            }
        }
    }

    private char advance() {
        return input.charAt(pos++);
    }

    private char peek() {
        return input.charAt(pos);
    }

    private boolean isAtEnd() {
        return pos >= length;
    }
}
