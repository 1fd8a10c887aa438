package com.gate.compiler;

import com.gate.builder.Conditions;
import com.gate.builder.TriggerFilters;
import com.gate.condition.ConditionNode;
import com.gate.condition.ConditionTrees;
import com.gate.condition.ExpressionNode;
import com.gate.config.GateConfig;
import com.gate.diagnostics.Diagnostics;
import com.gate.exception.ExpressionParseException;
import com.gate.expression.ConditionExpressionParser;
import com.gate.expression.Expressions;
import com.gate.render.JobConditionWriter;
import com.gate.wrap.ExpressionLineWrapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * Entry point used by the pipeline compiler to produce job conditions.
 * <p>
 * Stateless apart from its configuration; safe to share between threads.
 */
public class ConditionCompiler {

    private static final Logger log = LoggerFactory.getLogger(ConditionCompiler.class);

    private static final String ON_KEY = "on";

    private final GateConfig config;
    private final ExpressionLineWrapper lineWrapper;
    private final JobConditionWriter jobConditionWriter;

    public ConditionCompiler(GateConfig config) {
        this(config, new ExpressionLineWrapper(config.lineWrap()));
    }

    public ConditionCompiler(GateConfig config, ExpressionLineWrapper lineWrapper) {
        this.config = config;
        this.lineWrapper = lineWrapper;
        this.jobConditionWriter = new JobConditionWriter(lineWrapper);
    }

    public GateConfig getConfig() {
        return config;
    }

    public String render(ConditionNode condition) {
        return condition.render();
    }

    /**
     * Wrap a rendered condition to the configured line width.
     */
    public List<String> wrap(String rendered) {
        return lineWrapper.wrap(rendered);
    }

    /**
     * Safe-output gate using the configured agent job.
     */
    public ConditionNode safeOutputCondition(String outputType, int min) {
        return Conditions.safeOutputType(outputType, min, config.agentJobName());
    }

    /**
     * AND a new condition onto a job's existing raw condition.
     * <p>
     * The existing condition is kept verbatim as the left operand; re-rendering a parsed
     * copy would turn {@code !fn()} into {@code !(fn())}. It is still parsed, and a
     * warning is recorded when it is malformed.
     *
     * @param existingCondition Existing raw condition, optionally wrapped in {@code ${{ }}}
     * @param condition         Condition to add
     * @param diagnostics       Sink for warnings
     * @return The condition alone when there is no existing condition, otherwise the AND of both
     */
    public ConditionNode combineWithExisting(String existingCondition, ConditionNode condition, Diagnostics diagnostics) {
        if (existingCondition == null || existingCondition.isBlank()) {
            return condition;
        }

        String unwrapped = Expressions.stripExpressionWrapper(existingCondition);
        try {
            ConditionExpressionParser.parse(unwrapped);
        } catch (ExpressionParseException e) {
            diagnostics.warn("Could not parse existing condition, keeping it verbatim: " + e.getMessage());
        }
        return Conditions.and(new ExpressionNode(unwrapped), condition);
    }

    public ConditionNode combineWithExisting(String existingCondition, ConditionNode condition) {
        return combineWithExisting(existingCondition, condition, Diagnostics.logging(ConditionCompiler.class));
    }

    /**
     * Apply the draft, fork and label filters declared under {@code on:} to a job's
     * condition, in that order.
     *
     * @param existingCondition Current raw condition, may be empty
     * @param frontmatter       Workflow front matter
     * @param diagnostics       Sink for warnings
     * @return Rendered condition; the existing condition when no filter applies
     */
    public String applyTriggerFilters(String existingCondition, Map<String, Object> frontmatter, Diagnostics diagnostics) {
        String current = existingCondition == null ? "" : existingCondition;
        Object on = triggerSection(frontmatter);
        if (on == null) {
            return current;
        }

        TriggerFilters filters = new TriggerFilters(diagnostics);
        List<Function<Object, Optional<ConditionNode>>> steps = List.of(
                filters::draftFilter,
                filters::forkFilter,
                filters::labelFilter);

        for (Function<Object, Optional<ConditionNode>> step : steps) {
            Optional<ConditionNode> filter = step.apply(on);
            if (filter.isPresent()) {
                current = combineWithExisting(current, filter.get(), diagnostics).render();
            }
        }

        log.debug("Trigger filters produced condition: {}", current);
        return current;
    }

    private static Object triggerSection(Map<String, Object> frontmatter) {
        if (frontmatter == null) {
            return null;
        }
        if (frontmatter.containsKey(ON_KEY)) {
            return frontmatter.get(ON_KEY);
        }
        // YAML 1.1 loads a bare on: key as boolean true
        return frontmatter.get(Boolean.TRUE);
    }

    /**
     * List the opaque sub-expressions of a raw condition. An expression that does not
     * parse is returned whole.
     */
    public List<String> literalExpressions(String expression) {
        String unwrapped = Expressions.stripExpressionWrapper(expression);
        List<String> literals = new ArrayList<>();
        try {
            ConditionTrees.visitExpressions(ConditionExpressionParser.parse(unwrapped),
                    node -> literals.add(node.expression()));
        } catch (ExpressionParseException e) {
            log.debug("Treating unparseable expression as a single literal: {}", e.getMessage());
            return List.of(unwrapped);
        }
        return literals;
    }

    /**
     * Write the {@code if:} key for a job.
     *
     * @param yaml      Output buffer
     * @param condition Condition to write
     * @param keyIndent Indentation of the key
     * @param indent    Indentation of continuation lines
     */
    public void writeJobIf(StringBuilder yaml, ConditionNode condition, String keyIndent, String indent) {
        jobConditionWriter.write(yaml, condition, keyIndent, indent);
    }

    public void writeJobIf(StringBuilder yaml, String condition, String keyIndent, String indent) {
        jobConditionWriter.write(yaml, condition, keyIndent, indent);
    }
}
