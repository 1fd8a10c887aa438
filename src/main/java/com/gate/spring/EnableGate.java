package com.gate.spring;

import com.gate.adapter.spring.GateAutoConfiguration;
import org.springframework.context.annotation.Import;

import java.lang.annotation.*;

/**
 * Registers a {@link com.gate.compiler.ConditionCompiler} bean for applications that do
 * not rely on auto-configuration, e.g. a plain {@code @Configuration} class in a
 * pipeline generator:
 * <pre>
 * &#64;Configuration
 * &#64;EnableGate
 * class WorkflowCompilerConfig {
 * }
 * </pre>
 * The compiler still honors {@code gate.enabled} and {@code gate.config-path}.
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
@Import(GateAutoConfiguration.class)
public @interface EnableGate {
}
