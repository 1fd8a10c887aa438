package com.gate;

import com.gate.builder.Conditions;
import com.gate.compiler.ConditionCompiler;
import com.gate.condition.ConditionNode;
import com.gate.config.ConfigLoader;
import com.gate.diagnostics.CollectingDiagnostics;
import com.gate.spring.EnableGate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Example Spring Boot application compiling the job conditions of a sample workflow.
 */
@SpringBootApplication
@EnableGate
public class GateApplication {

    private static final Logger log = LoggerFactory.getLogger(GateApplication.class);

    private static final String SAMPLE_WORKFLOW = "classpath:workflows/sample-workflow.yaml";

    public static void main(String[] args) {
        SpringApplication.run(GateApplication.class, args);
    }

    @Bean
    public CommandLineRunner demo(ConditionCompiler compiler) {
        return args -> {
            log.info("=== Gate Demo Started ===");

            Map<String, Object> frontmatter = ConfigLoader.loadDocument(SAMPLE_WORKFLOW);
            CollectingDiagnostics diagnostics = new CollectingDiagnostics();

            String existingIf = frontmatter.get("if") == null ? "" : frontmatter.get("if").toString();

            Map<String, ConditionNode> jobs = new LinkedHashMap<>();
            String agentCondition = compiler.applyTriggerFilters(existingIf, frontmatter, diagnostics);
            if (!agentCondition.isEmpty()) {
                jobs.put("agent", Conditions.expression(agentCondition));
            }
            jobs.put("add_reaction", Conditions.reactionCondition());
            jobs.put("create_issue", compiler.safeOutputCondition("create_issue", 0));
            jobs.put("add_comment", compiler.combineWithExisting(existingIf,
                    compiler.safeOutputCondition("add_comment", 1), diagnostics));

            StringBuilder yaml = new StringBuilder("jobs:\n");
            jobs.forEach((name, condition) -> {
                yaml.append("  ").append(name).append(":\n");
                compiler.writeJobIf(yaml, condition, "    ", "      ");
            });

            log.info("Generated job conditions:\n{}", yaml);
            diagnostics.getWarnings().forEach(warning -> log.warn("Diagnostic: {}", warning));

            log.info("=== Gate Demo Completed ===");
        };
    }
}
