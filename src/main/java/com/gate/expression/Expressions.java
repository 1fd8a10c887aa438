package com.gate.expression;

import static com.gate.expression.ExpressionSyntax.WRAPPER_CLOSE;
import static com.gate.expression.ExpressionSyntax.WRAPPER_OPEN;

/**
 * String helpers for raw condition expressions.
 */
public final class Expressions {

    private Expressions() {
    }

    /**
     * Remove a surrounding {@code ${{ ... }}} wrapper, trimming inside and outside.
     * Expressions without the wrapper are only trimmed.
     */
    public static String stripExpressionWrapper(String expression) {
        String expr = expression.trim();
        if (expr.startsWith(WRAPPER_OPEN) && expr.endsWith(WRAPPER_CLOSE)
                && expr.length() >= WRAPPER_OPEN.length() + WRAPPER_CLOSE.length()) {
            return expr.substring(WRAPPER_OPEN.length(), expr.length() - WRAPPER_CLOSE.length()).trim();
        }
        return expr;
    }

    /**
     * Collapse newlines, tabs and runs of spaces into single spaces so multiline and
     * single-line renderings of the same expression compare equal.
     */
    public static String normalizeForComparison(String expression) {
        String normalized = expression.replace('\n', ' ').replace('\t', ' ');
        while (normalized.contains("  ")) {
            normalized = normalized.replace("  ", " ");
        }
        return normalized.trim();
    }
}
