package com.gate.expression;

/**
 * Token types for condition expression parsing.
 */
public enum TokenType {
    // Opaque sub-expression
    LITERAL,

    // Logical operators
    AND,
    OR,
    NOT,

    // Delimiters
    LPAREN,
    RPAREN,

    // Special
    EOF
}
