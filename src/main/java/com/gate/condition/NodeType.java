package com.gate.condition;

/**
 * Tags for every kind of node in a condition expression tree.
 */
public enum NodeType {
    // Opaque text
    EXPRESSION,

    // Logical
    AND,
    OR,
    NOT,
    PARENTHESES,
    DISJUNCTION,

    // Calls and references
    FUNCTION_CALL,
    PROPERTY_ACCESS,
    CONTAINS,

    // Literals
    STRING_LITERAL,
    BOOLEAN_LITERAL,
    NUMBER_LITERAL,

    // Operators
    COMPARISON,
    TERNARY
}
