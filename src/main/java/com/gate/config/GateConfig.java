package com.gate.config;

import com.gate.builder.GitHubContext;
import com.gate.wrap.LineWrapConfig;

/**
 * Root configuration for the condition compiler.
 *
 * @param name         Configuration name
 * @param agentJobName Job whose result gates safe-output jobs
 * @param lineWrap     Line-wrapping widths
 */
public record GateConfig(
        String name,
        String agentJobName,
        LineWrapConfig lineWrap
) {
    public static final String DEFAULT_NAME = "default-gate";

    /**
     * Create a configuration with all defaults.
     */
    public static GateConfig defaults() {
        return new GateConfig(DEFAULT_NAME, GitHubContext.DEFAULT_AGENT_JOB_NAME, LineWrapConfig.defaults());
    }
}
