package com.gate.expression;

/**
 * Represents a token in a condition expression.
 *
 * @param type     Token type
 * @param text     Token text; literals are trimmed
 * @param position Offset of the token in the input string
 */
public record Token(TokenType type, String text, int position) {

    @Override
    public String toString() {
        return type + "(" + text + ")@" + position;
    }
}
