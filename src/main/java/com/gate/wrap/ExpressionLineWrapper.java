package com.gate.wrap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

import static com.gate.expression.ExpressionSyntax.Operators;
import static com.gate.expression.ExpressionSyntax.isLogicalOperatorAt;
import static com.gate.expression.ExpressionSyntax.isQuote;

/**
 * Reflows a long rendered expression over several lines.
 * <p>
 * The first pass ends a line after a {@code &&} or {@code ||} once the line is longer
 * than the break threshold. Lines still over the maximum are then split after a closing
 * parenthesis that returns to depth zero and is followed by a logical operator. Neither
 * pass breaks inside a quoted string; an expression without break points stays on one line.
 * Returned lines are trimmed.
 */
public class ExpressionLineWrapper {

    private static final Logger log = LoggerFactory.getLogger(ExpressionLineWrapper.class);

    private final LineWrapConfig config;

    public ExpressionLineWrapper(LineWrapConfig config) {
        this.config = config;
    }

    public LineWrapConfig getConfig() {
        return config;
    }

    /**
     * Break an expression into lines.
     *
     * @param expression Single-line rendered expression
     * @return The expression itself when it fits, otherwise the wrapped lines
     */
    public List<String> wrap(String expression) {
        if (expression.length() <= config.maxLineLength()) {
            return List.of(expression);
        }

        log.debug("Breaking long expression: length={}", expression.length());

        List<String> lines = new ArrayList<>();
        for (String line : breakAtOperators(expression)) {
            if (line.length() > config.maxLineLength()) {
                lines.addAll(breakAtParentheses(line));
            } else {
                lines.add(line);
            }
        }
        if (lines.isEmpty()) {
            // only blanks
            return List.of(expression.trim());
        }
        return lines;
    }

    /**
     * Indent every wrapped line with the given prefix and join them with newlines.
     */
    public String wrap(String expression, String indent) {
        return String.join("\n", wrap(expression).stream()
                .map(line -> indent + line)
                .toList());
    }

    List<String> breakAtOperators(String expression) {
        List<String> lines = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        int length = expression.length();
        int i = 0;

        while (i < length) {
            char c = expression.charAt(i);

            if (isQuote(c)) {
                i = copyQuoted(expression, i, current);
                continue;
            }

            if (isLogicalOperatorAt(expression, i)) {
                current.append(expression, i, i + 2);
                i += 2;

                if (current.toString().trim().length() > config.breakThreshold()) {
                    lines.add(current.toString().trim());
                    current.setLength(0);
                    i = skipBlanks(expression, i);
                }
                continue;
            }

            current.append(c);
            i++;
        }

        addRemainder(lines, current);
        return lines;
    }

    List<String> breakAtParentheses(String line) {
        if (line.length() <= config.maxLineLength()) {
            return List.of(line);
        }

        List<String> lines = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        int length = line.length();
        int depth = 0;
        int i = 0;

        while (i < length) {
            char c = line.charAt(i);

            if (isQuote(c)) {
                i = copyQuoted(line, i, current);
                continue;
            }

            current.append(c);
            i++;

            if (c == Operators.LEFT_PAREN) {
                depth++;
            } else if (c == Operators.RIGHT_PAREN) {
                depth--;
                if (depth == 0 && current.length() > config.parenBreakLength() && i < length) {
                    int operator = skipBlanks(line, i);
                    if (isLogicalOperatorAt(line, operator)) {
                        current.append(line, i, operator + 2);
                        lines.add(current.toString().trim());
                        current.setLength(0);
                        i = skipBlanks(line, operator + 2);
                    }
                }
            }
        }

        addRemainder(lines, current);
        return lines;
    }

    /**
     * Copy a quoted string starting at {@code start} verbatim, honoring backslash escapes.
     *
     * @return Offset just past the closing quote, or the end of the input if unterminated
     */
    private static int copyQuoted(String input, int start, StringBuilder out) {
        char quote = input.charAt(start);
        out.append(quote);
        int i = start + 1;
        while (i < input.length()) {
            char c = input.charAt(i++);
            out.append(c);
            if (c == quote) {
                break;
            }
            if (c == Operators.BACKSLASH && i < input.length()) {
                out.append(input.charAt(i++));
            }
        }
        return i;
    }

    private static int skipBlanks(String input, int index) {
        while (index < input.length() && (input.charAt(index) == ' ' || input.charAt(index) == '\t')) {
            index++;
        }
        return index;
    }

    private static void addRemainder(List<String> lines, StringBuilder current) {
        String rest = current.toString().trim();
        if (!rest.isEmpty()) {
            lines.add(rest);
        }
    }
}
