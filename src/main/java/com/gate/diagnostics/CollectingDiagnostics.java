package com.gate.diagnostics;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Diagnostics sink that keeps warnings in insertion order.
 */
public class CollectingDiagnostics implements Diagnostics {

    private final List<String> warnings = new CopyOnWriteArrayList<>();

    @Override
    public void warn(String message) {
        warnings.add(message);
    }

    /**
     * Snapshot of the warnings recorded so far.
     */
    public List<String> getWarnings() {
        return List.copyOf(warnings);
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }
}
