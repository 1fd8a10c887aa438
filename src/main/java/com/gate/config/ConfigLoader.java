package com.gate.config;

import com.gate.builder.GitHubContext;
import com.gate.exception.ConfigurationException;
import com.gate.wrap.LineWrapConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.util.Map;

/**
 * Loads compiler configuration from YAML files.
 */
public class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    /**
     * Load configuration from a path.
     * Supports classpath: prefix for classpath resources.
     *
     * @param path Path to the configuration file
     * @return Loaded configuration
     */
    public static GateConfig load(String path) {
        log.info("Loading gate configuration from: {}", path);

        try {
            Resource resource = getResource(path);
            try (InputStream inputStream = resource.getInputStream()) {
                return parseYaml(inputStream);
            }
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load configuration from: " + path, e);
        }
    }

    /**
     * Load a YAML document (such as a workflow front matter) as a raw map.
     *
     * @param path Path to the YAML file, classpath: prefix supported
     * @return Top-level mapping
     */
    @SuppressWarnings("unchecked")
    public static Map<String, Object> loadDocument(String path) {
        try {
            Resource resource = getResource(path);
            try (InputStream inputStream = resource.getInputStream()) {
                Object document = new Yaml().load(inputStream);
                if (!(document instanceof Map<?, ?>)) {
                    throw new ConfigurationException("Expected a YAML mapping in: " + path);
                }
                return (Map<String, Object>) document;
            }
        } catch (IOException | YAMLException e) {
            throw new ConfigurationException("Failed to load YAML document from: " + path, e);
        }
    }

    private static Resource getResource(String path) {
        if (path.startsWith("classpath:")) {
            String resourcePath = path.substring("classpath:".length());
            return new ClassPathResource(resourcePath);
        }
        return new FileSystemResource(path);
    }

    @SuppressWarnings("unchecked")
    private static GateConfig parseYaml(InputStream inputStream) {
        Map<String, Object> root;
        try {
            root = new Yaml().load(inputStream);
        } catch (YAMLException | ClassCastException e) {
            throw new ConfigurationException("Configuration file is not a valid YAML mapping", e);
        }

        if (root == null) {
            throw new ConfigurationException("Configuration file is empty");
        }

        // Get the gate section (could be at root or under 'gate' key)
        Map<String, Object> gateConfig = root.containsKey("gate")
                ? (Map<String, Object>) root.get("gate")
                : root;

        String name = getString(gateConfig, "name", GateConfig.DEFAULT_NAME);
        String agentJobName = getString(gateConfig, "agent-job-name", GitHubContext.DEFAULT_AGENT_JOB_NAME);
        if (agentJobName.isBlank()) {
            throw new ConfigurationException("agent-job-name must not be blank");
        }

        LineWrapConfig lineWrap = parseLineWrap((Map<String, Object>) gateConfig.get("line-wrap"));

        GateConfig config = new GateConfig(name, agentJobName, lineWrap);
        log.info("Loaded gate configuration: {} (agent job: {}, max line: {}, break threshold: {})",
                name, agentJobName, lineWrap.maxLineLength(), lineWrap.breakThreshold());
        return config;
    }

    private static LineWrapConfig parseLineWrap(Map<String, Object> map) {
        if (map == null) {
            return LineWrapConfig.defaults();
        }
        int maxLineLength = getInt(map, "max-line-length", LineWrapConfig.DEFAULT_MAX_LINE_LENGTH);
        int breakThreshold = getInt(map, "break-threshold", LineWrapConfig.DEFAULT_BREAK_THRESHOLD);
        int parenBreakLength = getInt(map, "paren-break-length", LineWrapConfig.DEFAULT_PAREN_BREAK_LENGTH);

        log.debug("Parsed line-wrap: maxLineLength={}, breakThreshold={}, parenBreakLength={}",
                maxLineLength, breakThreshold, parenBreakLength);
        return new LineWrapConfig(maxLineLength, breakThreshold, parenBreakLength);
    }

    // Helper methods

    private static String getString(Map<String, Object> map, String key, String defaultValue) {
        Object value = map.get(key);
        return value != null ? value.toString() : defaultValue;
    }

    private static int getInt(Map<String, Object> map, String key, int defaultValue) {
        Object value = map.get(key);
        if (value == null) return defaultValue;
        if (value instanceof Number) return ((Number) value).intValue();
        try {
            return Integer.parseInt(value.toString());
        } catch (NumberFormatException e) {
            throw new ConfigurationException("'" + key + "' must be an integer, got '" + value + "'", e);
        }
    }
}
