package com.gate.render;

import com.gate.condition.ConditionNode;
import com.gate.wrap.ExpressionLineWrapper;

import java.util.List;

/**
 * Writes a job's {@code if:} key into generated pipeline YAML.
 */
public class JobConditionWriter {

    private static final String IF_KEY = "if:";

    private final ExpressionLineWrapper lineWrapper;

    public JobConditionWriter(ExpressionLineWrapper lineWrapper) {
        this.lineWrapper = lineWrapper;
    }

    /**
     * Write the condition as a literal block ({@code if: |}), one rendered line per
     * output line, each prefixed with {@code indent}.
     *
     * @param yaml      Output buffer
     * @param condition Condition to render
     * @param keyIndent Indentation of the {@code if:} key
     * @param indent    Indentation of the condition lines
     */
    public void writeLiteralBlock(StringBuilder yaml, ConditionNode condition, String keyIndent, String indent) {
        yaml.append(keyIndent).append(IF_KEY).append(" |\n");
        for (String line : condition.render().split("\n", -1)) {
            yaml.append(indent).append(line).append('\n');
        }
    }

    /**
     * Write a rendered condition. Short single-line conditions are written inline;
     * multiline or overlong ones use the folded style ({@code if: >}), where existing
     * lines are kept and a long single line is wrapped.
     *
     * @param yaml      Output buffer
     * @param condition Rendered condition, ignored when blank
     * @param keyIndent Indentation of the {@code if:} key
     * @param indent    Indentation of the continuation lines
     */
    public void write(StringBuilder yaml, String condition, String keyIndent, String indent) {
        if (condition == null || condition.isBlank()) {
            return;
        }

        boolean multiline = condition.contains("\n");
        if (!multiline && condition.length() <= lineWrapper.getConfig().maxLineLength()) {
            yaml.append(keyIndent).append(IF_KEY).append(' ').append(condition).append('\n');
            return;
        }

        yaml.append(keyIndent).append(IF_KEY).append(" >\n");
        List<String> lines = multiline ? List.of(condition.split("\n")) : lineWrapper.wrap(condition);
        for (String line : lines) {
            if (!line.isBlank()) {
                yaml.append(indent).append(line.trim()).append('\n');
            }
        }
    }

    public void write(StringBuilder yaml, ConditionNode condition, String keyIndent, String indent) {
        write(yaml, condition.render(), keyIndent, indent);
    }
}
