package com.gate.expression;

/**
 * Lexical elements of the target expression language.
 */
public final class ExpressionSyntax {

    private ExpressionSyntax() {
    }

    public static final String AND = "&&";
    public static final String OR = "||";

    /**
     * Operator symbols.
     */
    public static final class Operators {
        public static final char NOT = '!';
        public static final char EQUALS = '=';
        public static final char LEFT_PAREN = '(';
        public static final char RIGHT_PAREN = ')';
        public static final char QUOTE_DOUBLE = '"';
        public static final char QUOTE_SINGLE = '\'';
        public static final char BACKSLASH = '\\';

        private Operators() {
        }
    }

    /**
     * Opening and closing delimiters of an embedded expression.
     */
    public static final String WRAPPER_OPEN = "${{";
    public static final String WRAPPER_CLOSE = "}}";

    public static boolean isQuote(char c) {
        return c == Operators.QUOTE_SINGLE || c == Operators.QUOTE_DOUBLE;
    }

    /**
     * True if a logical operator ({@code &&} or {@code ||}) starts at the given offset.
     */
    public static boolean isLogicalOperatorAt(String input, int index) {
        return input.startsWith(AND, index) || input.startsWith(OR, index);
    }

    /**
     * True if the character at the given offset is a NOT rather than the start of {@code !=}.
     */
    public static boolean isNotAt(String input, int index) {
        return input.charAt(index) == Operators.NOT
                && (index + 1 >= input.length() || input.charAt(index + 1) != Operators.EQUALS);
    }
}
