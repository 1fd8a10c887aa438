package com.gate.diagnostics;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the diagnostics sinks.
 */
class CollectingDiagnosticsTest {

    @Test
    @DisplayName("Warnings are kept in order")
    void keepsOrder() {
        CollectingDiagnostics diagnostics = new CollectingDiagnostics();

        diagnostics.warn("first");
        diagnostics.warn("second");

        assertTrue(diagnostics.hasWarnings());
        assertEquals(List.of("first", "second"), diagnostics.getWarnings());
    }

    @Test
    @DisplayName("Snapshot does not change with later warnings")
    void snapshot() {
        CollectingDiagnostics diagnostics = new CollectingDiagnostics();
        diagnostics.warn("first");

        List<String> snapshot = diagnostics.getWarnings();
        diagnostics.warn("second");

        assertEquals(1, snapshot.size());
        assertThrows(UnsupportedOperationException.class, () -> snapshot.add("third"));
    }

    @Test
    @DisplayName("Logging sink accepts warnings")
    void loggingSink() {
        Diagnostics diagnostics = Diagnostics.logging(CollectingDiagnosticsTest.class);

        assertInstanceOf(LoggingDiagnostics.class, diagnostics);
        assertDoesNotThrow(() -> diagnostics.warn("logged"));
    }
}
