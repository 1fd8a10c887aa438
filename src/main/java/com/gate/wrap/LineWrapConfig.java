package com.gate.wrap;

import com.gate.exception.ConfigurationException;

/**
 * Widths used when reflowing long condition expressions.
 *
 * @param maxLineLength    Expressions longer than this are wrapped
 * @param breakThreshold   A line is ended after a logical operator once it is longer than this
 * @param parenBreakLength A line still over the maximum is split after a closing parenthesis
 *                         once it is longer than this
 */
public record LineWrapConfig(int maxLineLength, int breakThreshold, int parenBreakLength) {

    public static final int DEFAULT_MAX_LINE_LENGTH = 120;
    public static final int DEFAULT_BREAK_THRESHOLD = 100;
    public static final int DEFAULT_PAREN_BREAK_LENGTH = 80;

    public LineWrapConfig {
        if (maxLineLength <= 0) {
            throw new ConfigurationException("max-line-length must be positive, got " + maxLineLength);
        }
        if (breakThreshold <= 0) {
            throw new ConfigurationException("break-threshold must be positive, got " + breakThreshold);
        }
        if (parenBreakLength <= 0) {
            throw new ConfigurationException("paren-break-length must be positive, got " + parenBreakLength);
        }
        if (breakThreshold > maxLineLength) {
            throw new ConfigurationException("break-threshold (" + breakThreshold
                    + ") must not exceed max-line-length (" + maxLineLength + ")");
        }
    }

    /**
     * Two-width form; the parenthesis pass uses the break threshold.
     */
    public LineWrapConfig(int maxLineLength, int breakThreshold) {
        this(maxLineLength, breakThreshold, breakThreshold);
    }

    public static LineWrapConfig defaults() {
        return new LineWrapConfig(DEFAULT_MAX_LINE_LENGTH, DEFAULT_BREAK_THRESHOLD, DEFAULT_PAREN_BREAK_LENGTH);
    }
}
