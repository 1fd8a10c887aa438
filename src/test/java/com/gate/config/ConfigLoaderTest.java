package com.gate.config;

import com.gate.exception.ConfigurationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ConfigLoader.
 */
class ConfigLoaderTest {

    @Test
    @DisplayName("Bundled configuration matches the defaults")
    void bundledConfiguration() {
        GateConfig config = ConfigLoader.load("classpath:gate.yaml");

        assertEquals(GateConfig.defaults(), config);
    }

    @Test
    @DisplayName("Settings may sit at the document root")
    void rootLevelSection() {
        GateConfig config = ConfigLoader.load("classpath:gate-custom.yaml");

        assertEquals("custom-gate", config.name());
        assertEquals("main_agent", config.agentJobName());
        assertEquals(80, config.lineWrap().maxLineLength());
        assertEquals(40, config.lineWrap().breakThreshold());
        assertEquals(60, config.lineWrap().parenBreakLength());
    }

    @Test
    @DisplayName("Missing keys fall back to defaults")
    void missingKeys() {
        GateConfig config = ConfigLoader.load("classpath:gate-minimal.yaml");

        assertEquals("minimal-gate", config.name());
        assertEquals("agent", config.agentJobName());
        assertEquals(120, config.lineWrap().maxLineLength());
    }

    @Test
    @DisplayName("Threshold above the maximum is rejected")
    void invalidWidths() {
        ConfigurationException e = assertThrows(ConfigurationException.class,
                () -> ConfigLoader.load("classpath:gate-invalid.yaml"));

        assertTrue(e.getMessage().contains("break-threshold"));
    }

    @Test
    @DisplayName("Non-numeric width is rejected")
    void nonNumericWidth() {
        ConfigurationException e = assertThrows(ConfigurationException.class,
                () -> ConfigLoader.load("classpath:gate-bad-number.yaml"));

        assertTrue(e.getMessage().contains("max-line-length"));
    }

    @Test
    @DisplayName("Missing file is reported")
    void missingFile() {
        assertThrows(ConfigurationException.class, () -> ConfigLoader.load("classpath:does-not-exist.yaml"));
        assertThrows(ConfigurationException.class, () -> ConfigLoader.load("/nonexistent/gate.yaml"));
    }

    @Test
    @DisplayName("Workflow front matter loads as a mapping")
    void loadDocument() {
        Map<String, Object> document = ConfigLoader.loadDocument("classpath:workflows/sample-workflow.yaml");

        assertEquals("github.actor != 'dependabot[bot]'", document.get("if"));
        assertTrue(document.containsKey("permissions"));
    }

    @Test
    @DisplayName("Document that is not a mapping is rejected")
    void loadDocumentNotMapping() {
        assertThrows(ConfigurationException.class, () -> ConfigLoader.loadDocument("classpath:not-a-mapping.yaml"));
    }
}
