package com.gate.adapter.spring;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * {@code gate.*} properties. The widths and agent job name live in the YAML file that
 * {@code gate.config-path} points to, not here.
 */
@ConfigurationProperties(prefix = "gate")
public class GateProperties {

    /**
     * Set to false to skip registering the compiler, line wrapper and config beans.
     */
    private boolean enabled = true;

    /**
     * YAML file read by {@link com.gate.config.ConfigLoader}; a {@code classpath:} prefix
     * reads from the classpath, anything else from the file system.
     */
    private String configPath = "classpath:gate.yaml";

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getConfigPath() {
        return configPath;
    }

    public void setConfigPath(String configPath) {
        this.configPath = configPath;
    }
}
