package com.gate.builder;

import com.gate.builder.GitHubContext.Events;
import com.gate.condition.AndNode;
import com.gate.condition.BooleanLiteralNode;
import com.gate.condition.ComparisonNode;
import com.gate.condition.ComparisonOperator;
import com.gate.condition.ConditionNode;
import com.gate.condition.ContainsNode;
import com.gate.condition.DisjunctionNode;
import com.gate.condition.ExpressionNode;
import com.gate.condition.FunctionCallNode;
import com.gate.condition.NotNode;
import com.gate.condition.NumberLiteralNode;
import com.gate.condition.OrNode;
import com.gate.condition.ParenthesesNode;
import com.gate.condition.PropertyAccessNode;
import com.gate.condition.StringLiteralNode;
import com.gate.condition.TernaryNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Factory methods for condition trees.
 * <p>
 * The primitive constructors build single nodes; the domain builders assemble the
 * recurring job-activation rules (event checks, fork safety, safe-output gating).
 * Builders never render or parse, and every result is a valid child for further
 * composition.
 */
public final class Conditions {

    private static final String FUNCTION_CANCELLED = "cancelled";
    private static final String FUNCTION_CONTAINS = "contains";
    private static final String FUNCTION_STARTS_WITH = "startsWith";
    private static final String SKIPPED = "skipped";
    private static final String OUTPUT_TYPES = "output_types";
    private static final String GLOB_SUFFIX = "/*";

    private Conditions() {
    }

    // Primitives

    public static PropertyAccessNode propertyAccess(String path) {
        return new PropertyAccessNode(path);
    }

    public static StringLiteralNode stringLiteral(String value) {
        return new StringLiteralNode(value);
    }

    public static BooleanLiteralNode booleanLiteral(boolean value) {
        return new BooleanLiteralNode(value);
    }

    public static NumberLiteralNode numberLiteral(String value) {
        return new NumberLiteralNode(value);
    }

    public static ExpressionNode nullLiteral() {
        return new ExpressionNode("null");
    }

    public static ExpressionNode expression(String expression) {
        return new ExpressionNode(expression);
    }

    /**
     * Create an expression carrying a description, emitted as a comment line when the
     * expression is a term of a multiline disjunction.
     */
    public static ExpressionNode expression(String expression, String description) {
        return new ExpressionNode(expression, description);
    }

    public static ComparisonNode comparison(ConditionNode left, ComparisonOperator operator, ConditionNode right) {
        return new ComparisonNode(left, operator, right);
    }

    public static ComparisonNode equals(ConditionNode left, ConditionNode right) {
        return comparison(left, ComparisonOperator.EQUALS, right);
    }

    public static ComparisonNode notEquals(ConditionNode left, ConditionNode right) {
        return comparison(left, ComparisonOperator.NOT_EQUALS, right);
    }

    public static ContainsNode contains(ConditionNode array, ConditionNode value) {
        return new ContainsNode(array, value);
    }

    public static FunctionCallNode functionCall(String functionName, ConditionNode... arguments) {
        return new FunctionCallNode(functionName, List.of(arguments));
    }

    public static TernaryNode ternary(ConditionNode condition, ConditionNode trueValue, ConditionNode falseValue) {
        return new TernaryNode(condition, trueValue, falseValue);
    }

    public static AndNode and(ConditionNode left, ConditionNode right) {
        return new AndNode(left, right);
    }

    public static OrNode or(ConditionNode left, ConditionNode right) {
        return new OrNode(left, right);
    }

    public static NotNode not(ConditionNode child) {
        return new NotNode(child);
    }

    public static ParenthesesNode parentheses(ConditionNode child) {
        return new ParenthesesNode(child);
    }

    /**
     * Create a disjunction of any number of terms, including zero or one.
     */
    public static DisjunctionNode disjunction(boolean multiline, ConditionNode... terms) {
        return new DisjunctionNode(List.of(terms), multiline);
    }

    public static DisjunctionNode disjunction(List<ConditionNode> terms) {
        return new DisjunctionNode(terms, false);
    }

    /**
     * Combine an existing raw condition with a rendered draft condition.
     * Both sides are kept as opaque text.
     *
     * @param existingCondition Existing condition, may be empty
     * @param draftCondition    Rendered condition to add
     */
    public static ConditionNode conditionTree(String existingCondition, String draftCondition) {
        ExpressionNode draft = new ExpressionNode(draftCondition);
        if (existingCondition == null || existingCondition.isEmpty()) {
            return draft;
        }
        return new AndNode(new ExpressionNode(existingCondition), draft);
    }

    // Domain rules

    /**
     * {@code github.event_name == '<eventType>'}
     */
    public static ComparisonNode eventTypeEquals(String eventType) {
        return equals(propertyAccess(GitHubContext.EVENT_NAME), stringLiteral(eventType));
    }

    /**
     * {@code github.event.action == '<action>'}
     */
    public static ComparisonNode actionEquals(String action) {
        return equals(propertyAccess(GitHubContext.EVENT_ACTION), stringLiteral(action));
    }

    /**
     * {@code startsWith(github.ref, '<prefix>')}
     */
    public static FunctionCallNode refStartsWith(String prefix) {
        return functionCall(FUNCTION_STARTS_WITH, propertyAccess(GitHubContext.REF), stringLiteral(prefix));
    }

    /**
     * Check that the issue or pull request carries the given label.
     */
    public static ContainsNode labelContains(String labelName) {
        return contains(propertyAccess(GitHubContext.ISSUE_LABEL_NAMES), stringLiteral(labelName));
    }

    /**
     * Check that a pull request comes from the base repository rather than a fork.
     * Forked pull requests run without write permissions.
     */
    public static ComparisonNode notFromFork() {
        return equals(propertyAccess(GitHubContext.PR_HEAD_REPO_FULL_NAME), propertyAccess(GitHubContext.REPOSITORY));
    }

    /**
     * Check that a pull request comes from the base repository or from one of the
     * allowed forks. Patterns ending in {@code /*} match every repository of that
     * owner; other patterns match a full repository name exactly.
     *
     * @param allowedForks Fork patterns, e.g. {@code org/*} or {@code org/repo}
     * @return {@link #notFromFork()} when no patterns are given, otherwise a disjunction
     */
    public static ConditionNode fromAllowedForks(List<String> allowedForks) {
        if (allowedForks == null || allowedForks.isEmpty()) {
            return notFromFork();
        }

        List<ConditionNode> conditions = new ArrayList<>();
        conditions.add(notFromFork());

        for (String pattern : allowedForks) {
            if (pattern.endsWith(GLOB_SUFFIX)) {
                String prefix = pattern.substring(0, pattern.length() - 1);
                conditions.add(functionCall(FUNCTION_STARTS_WITH,
                        propertyAccess(GitHubContext.PR_HEAD_REPO_FULL_NAME),
                        stringLiteral(prefix)));
            } else {
                conditions.add(equals(propertyAccess(GitHubContext.PR_HEAD_REPO_FULL_NAME), stringLiteral(pattern)));
            }
        }

        return disjunction(conditions);
    }

    /**
     * Gate a safe-output job on the default agent job.
     *
     * @see #safeOutputType(String, int, String)
     */
    public static ConditionNode safeOutputType(String outputType, int min) {
        return safeOutputType(outputType, min, GitHubContext.DEFAULT_AGENT_JOB_NAME);
    }

    /**
     * Gate a safe-output job: run unless the workflow was cancelled or the agent job
     * was skipped. {@code !cancelled()} keeps the job running after a failed agent so
     * errors can be reported.
     * <p>
     * With a minimum count the base check is returned alone, in parentheses, so the job
     * still runs with zero outputs and the minimum check can fire. Otherwise the job
     * also requires the output type in the agent's declared outputs.
     *
     * @param outputType   Safe-output type, e.g. {@code create_issue}
     * @param min          Minimum number of outputs required, 0 for none
     * @param agentJobName Name of the agent job
     */
    public static ConditionNode safeOutputType(String outputType, int min, String agentJobName) {
        NotNode notCancelled = not(functionCall(FUNCTION_CANCELLED));
        ComparisonNode agentNotSkipped = notEquals(
                propertyAccess(GitHubContext.jobResult(agentJobName)),
                stringLiteral(SKIPPED));
        AndNode baseCondition = and(notCancelled, agentNotSkipped);

        if (min > 0) {
            return parentheses(baseCondition);
        }

        FunctionCallNode hasOutputType = functionCall(FUNCTION_CONTAINS,
                propertyAccess(GitHubContext.jobOutput(agentJobName, OUTPUT_TYPES)),
                stringLiteral(outputType));
        return and(baseCondition, hasOutputType);
    }

    /**
     * Match comments on pull requests: an issue comment whose issue is a pull request,
     * a review comment, or a review.
     */
    public static DisjunctionNode prCommentCondition() {
        ConditionNode issueCommentOnPullRequest = and(
                eventTypeEquals(Events.ISSUE_COMMENT),
                notEquals(propertyAccess(GitHubContext.ISSUE_PULL_REQUEST), nullLiteral()));

        return disjunction(List.of(
                issueCommentOnPullRequest,
                eventTypeEquals(Events.PULL_REQUEST_REVIEW_COMMENT),
                eventTypeEquals(Events.PULL_REQUEST_REVIEW)));
    }

    /**
     * Match the events a job may react to. Pull requests must not come from a fork,
     * since a fork's token cannot add reactions.
     */
    public static DisjunctionNode reactionCondition() {
        List<ConditionNode> terms = new ArrayList<>();
        terms.add(eventTypeEquals(Events.ISSUES));
        terms.add(eventTypeEquals(Events.ISSUE_COMMENT));
        terms.add(eventTypeEquals(Events.PULL_REQUEST_REVIEW_COMMENT));
        terms.add(eventTypeEquals(Events.DISCUSSION));
        terms.add(eventTypeEquals(Events.DISCUSSION_COMMENT));
        terms.add(and(eventTypeEquals(Events.PULL_REQUEST), notFromFork()));
        return disjunction(terms);
    }
}
