package com.gate.builder;

import com.gate.builder.GitHubContext.Events;
import com.gate.condition.ConditionNode;
import com.gate.diagnostics.Diagnostics;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Builds job conditions from the filters declared in a workflow's {@code on:} section.
 * <p>
 * Each filter reads the raw YAML structure and returns an empty result when the
 * trigger does not declare it. Every condition lets other event types through and
 * only restricts the event it filters.
 */
public class TriggerFilters {

    private static final String DRAFT = "draft";
    private static final String FORKS = "forks";
    private static final String TYPES = "types";
    private static final String NAMES = "names";
    private static final String LABELED = "labeled";
    private static final String UNLABELED = "unlabeled";
    private static final String ANY_FORK = "*";

    private final Diagnostics diagnostics;

    public TriggerFilters(Diagnostics diagnostics) {
        this.diagnostics = diagnostics;
    }

    /**
     * Restrict pull requests by draft state ({@code pull_request.draft: true|false}).
     *
     * @param on Value of the {@code on:} key
     */
    public Optional<ConditionNode> draftFilter(Object on) {
        Optional<Map<String, Object>> pullRequest = section(on, Events.PULL_REQUEST);
        if (pullRequest.isEmpty() || !pullRequest.get().containsKey(DRAFT)) {
            return Optional.empty();
        }

        Object draftValue = pullRequest.get().get(DRAFT);
        if (!(draftValue instanceof Boolean draft)) {
            diagnostics.warn("Ignoring pull_request.draft filter: expected a boolean but found '" + draftValue + "'");
            return Optional.empty();
        }

        return Optional.of(Conditions.or(
                notEvent(Events.PULL_REQUEST),
                Conditions.equals(Conditions.propertyAccess(GitHubContext.PR_DRAFT), Conditions.booleanLiteral(draft))));
    }

    /**
     * Restrict pull requests to the base repository and the allowed forks
     * ({@code pull_request.forks: "org/*"} or a list of patterns). A {@code *}
     * pattern allows every fork and disables the filter.
     *
     * @param on Value of the {@code on:} key
     */
    public Optional<ConditionNode> forkFilter(Object on) {
        Optional<Map<String, Object>> pullRequest = section(on, Events.PULL_REQUEST);
        if (pullRequest.isEmpty() || !pullRequest.get().containsKey(FORKS)) {
            return Optional.empty();
        }

        Optional<List<String>> allowedForks = stringList(pullRequest.get().get(FORKS));
        if (allowedForks.isEmpty()) {
            diagnostics.warn("Ignoring pull_request.forks filter: expected a string or a list of strings");
            return Optional.empty();
        }

        if (allowedForks.get().contains(ANY_FORK)) {
            diagnostics.warn("pull_request.forks contains '*': pull requests from any fork are allowed");
            return Optional.empty();
        }

        return Optional.of(Conditions.or(
                notEvent(Events.PULL_REQUEST),
                Conditions.fromAllowedForks(allowedForks.get())));
    }

    /**
     * Restrict {@code labeled}/{@code unlabeled} activity on issues and pull requests to
     * the label names listed under {@code names}. Conditions of both sections are ANDed.
     *
     * @param on Value of the {@code on:} key
     */
    public Optional<ConditionNode> labelFilter(Object on) {
        List<ConditionNode> sectionConditions = new ArrayList<>();
        for (String event : List.of(Events.ISSUES, Events.PULL_REQUEST)) {
            section(on, event)
                    .flatMap(map -> labelSectionCondition(event, map))
                    .ifPresent(sectionConditions::add);
        }

        if (sectionConditions.isEmpty()) {
            return Optional.empty();
        }

        ConditionNode result = sectionConditions.get(0);
        for (int i = 1; i < sectionConditions.size(); i++) {
            result = Conditions.and(result, sectionConditions.get(i));
        }
        return Optional.of(result);
    }

    private Optional<ConditionNode> labelSectionCondition(String event, Map<String, Object> sectionMap) {
        List<String> types = stringList(sectionMap.get(TYPES)).orElse(List.of());
        boolean labeled = types.contains(LABELED);
        boolean unlabeled = types.contains(UNLABELED);
        if (!labeled && !unlabeled) {
            return Optional.empty();
        }

        if (!sectionMap.containsKey(NAMES)) {
            return Optional.empty();
        }
        Optional<List<String>> names = stringList(sectionMap.get(NAMES));
        if (names.isEmpty()) {
            diagnostics.warn("Ignoring " + event + ".names filter: expected a string or a list of strings");
            return Optional.empty();
        }
        if (names.get().isEmpty()) {
            return Optional.empty();
        }

        List<ConditionNode> nameMatches = new ArrayList<>();
        for (String name : names.get()) {
            nameMatches.add(Conditions.equals(
                    Conditions.propertyAccess(GitHubContext.LABEL_NAME),
                    Conditions.stringLiteral(name)));
        }
        ConditionNode nameMatch = nameMatches.size() == 1 ? nameMatches.get(0) : Conditions.disjunction(nameMatches);

        ConditionNode otherAction;
        if (labeled && unlabeled) {
            otherAction = Conditions.and(notAction(LABELED), notAction(UNLABELED));
        } else if (labeled) {
            otherAction = notAction(LABELED);
        } else {
            otherAction = notAction(UNLABELED);
        }

        return Optional.of(Conditions.or(notEvent(event), Conditions.or(otherAction, nameMatch)));
    }

    private static ConditionNode notEvent(String event) {
        return Conditions.notEquals(Conditions.propertyAccess(GitHubContext.EVENT_NAME), Conditions.stringLiteral(event));
    }

    private static ConditionNode notAction(String action) {
        return Conditions.notEquals(Conditions.propertyAccess(GitHubContext.EVENT_ACTION), Conditions.stringLiteral(action));
    }

    @SuppressWarnings("unchecked")
    private static Optional<Map<String, Object>> section(Object on, String event) {
        if (!(on instanceof Map<?, ?> onMap)) {
            return Optional.empty();
        }
        Object value = onMap.get(event);
        if (value instanceof Map<?, ?> sectionMap) {
            return Optional.of((Map<String, Object>) sectionMap);
        }
        return Optional.empty();
    }

    /**
     * Accept a single string or a list; non-string list entries are dropped.
     */
    private static Optional<List<String>> stringList(Object value) {
        if (value instanceof String single) {
            return Optional.of(List.of(single));
        }
        if (value instanceof List<?> list) {
            List<String> strings = new ArrayList<>();
            for (Object item : list) {
                if (item instanceof String s) {
                    strings.add(s);
                }
            }
            return Optional.of(strings);
        }
        return Optional.empty();
    }
}
