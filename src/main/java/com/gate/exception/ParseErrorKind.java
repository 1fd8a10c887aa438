package com.gate.exception;

/**
 * Categories of condition expression parse failures.
 */
public enum ParseErrorKind {
    /** Input is empty or whitespace only. */
    EMPTY_EXPRESSION,

    /** A token appears where the grammar does not allow it, including trailing tokens. */
    UNEXPECTED_TOKEN,

    /** A group opened with '(' is never closed. */
    MISSING_CLOSING_PAREN,

    /** The tokenizer produced a zero-length literal. */
    EMPTY_LITERAL
}
