package com.gate.diagnostics;

/**
 * Append-only sink for warnings raised while building conditions.
 * <p>
 * Passed explicitly into compile calls. Writing to a sink never changes what is built.
 */
public interface Diagnostics {

    /**
     * Record a warning.
     */
    void warn(String message);

    /**
     * Sink that forwards warnings to the given logger category.
     */
    static Diagnostics logging(Class<?> category) {
        return new LoggingDiagnostics(category);
    }
}
