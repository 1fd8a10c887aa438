package com.gate.adapter.spring;

import com.gate.compiler.ConditionCompiler;
import com.gate.config.ConfigLoader;
import com.gate.config.GateConfig;
import com.gate.wrap.ExpressionLineWrapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Spring Boot auto-configuration for the condition compiler.
 */
@Configuration
@ConditionalOnProperty(prefix = "gate", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(GateProperties.class)
public class GateAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(GateAutoConfiguration.class);

    @Bean
    @ConditionalOnMissingBean
    public GateConfig gateConfig(GateProperties properties) {
        return ConfigLoader.load(properties.getConfigPath());
    }

    @Bean
    @ConditionalOnMissingBean
    public ExpressionLineWrapper expressionLineWrapper(GateConfig config) {
        return new ExpressionLineWrapper(config.lineWrap());
    }

    @Bean
    @ConditionalOnMissingBean
    public ConditionCompiler conditionCompiler(GateConfig config, ExpressionLineWrapper lineWrapper) {
        log.info("Creating ConditionCompiler: {}", config.name());
        return new ConditionCompiler(config, lineWrapper);
    }
}
