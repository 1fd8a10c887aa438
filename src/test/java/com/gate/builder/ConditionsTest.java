package com.gate.builder;

import com.gate.condition.ComparisonOperator;
import com.gate.condition.ConditionNode;
import com.gate.condition.DisjunctionNode;
import com.gate.condition.NodeType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the Conditions builders.
 */
class ConditionsTest {

    private static final String NOT_FROM_FORK =
            "github.event.pull_request.head.repo.full_name == github.repository";

    @Nested
    @DisplayName("Event and repository checks")
    class EventChecks {

        @Test
        @DisplayName("Event type comparison")
        void eventTypeEquals() {
            assertEquals("github.event_name == 'issues'", Conditions.eventTypeEquals("issues").render());
        }

        @Test
        @DisplayName("Action comparison")
        void actionEquals() {
            assertEquals("github.event.action == 'opened'", Conditions.actionEquals("opened").render());
        }

        @Test
        @DisplayName("Ref prefix check")
        void refStartsWith() {
            assertEquals("startsWith(github.ref, 'refs/tags/')", Conditions.refStartsWith("refs/tags/").render());
        }

        @Test
        @DisplayName("Label membership check")
        void labelContains() {
            assertEquals("contains(github.event.issue.labels.*.name, 'bug')",
                    Conditions.labelContains("bug").render());
        }

        @Test
        @DisplayName("Pull request from the base repository")
        void notFromFork() {
            assertEquals(NOT_FROM_FORK, Conditions.notFromFork().render());
        }
    }

    @Nested
    @DisplayName("Allowed forks")
    class AllowedForks {

        @Test
        @DisplayName("No patterns falls back to the base repository check")
        void emptyPatterns() {
            assertEquals(Conditions.notFromFork(), Conditions.fromAllowedForks(List.of()));
            assertEquals(Conditions.notFromFork(), Conditions.fromAllowedForks(null));
        }

        @Test
        @DisplayName("Owner glob becomes a prefix check")
        void ownerGlob() {
            ConditionNode condition = Conditions.fromAllowedForks(List.of("org/*"));

            assertEquals(NodeType.DISJUNCTION, condition.getType());
            assertEquals(NOT_FROM_FORK
                            + " || startsWith(github.event.pull_request.head.repo.full_name, 'org/')",
                    condition.render());
        }

        @Test
        @DisplayName("Exact name becomes an equality check")
        void exactName() {
            ConditionNode condition = Conditions.fromAllowedForks(List.of("org/repo", "other/*"));

            assertEquals(3, ((DisjunctionNode) condition).terms().size());
            assertEquals(NOT_FROM_FORK
                            + " || github.event.pull_request.head.repo.full_name == 'org/repo'"
                            + " || startsWith(github.event.pull_request.head.repo.full_name, 'other/')",
                    condition.render());
        }
    }

    @Nested
    @DisplayName("Safe-output gates")
    class SafeOutputs {

        @Test
        @DisplayName("Without a minimum the output type must be declared")
        void requiresOutputType() {
            assertEquals("((!cancelled()) && (needs.agent.result != 'skipped'))"
                            + " && (contains(needs.agent.outputs.output_types, 'create_issue'))",
                    Conditions.safeOutputType("create_issue", 0).render());
        }

        @Test
        @DisplayName("With a minimum only the base check remains")
        void minimumDropsTypeCheck() {
            String rendered = Conditions.safeOutputType("add_comment", 1).render();

            assertEquals("((!cancelled()) && (needs.agent.result != 'skipped'))", rendered);
            assertFalse(rendered.contains("contains("));
        }

        @Test
        @DisplayName("Custom agent job name is used in needs references")
        void customAgentJob() {
            String rendered = Conditions.safeOutputType("create_issue", 0, "main_agent").render();

            assertTrue(rendered.contains("needs.main_agent.result != 'skipped'"));
            assertTrue(rendered.contains("needs.main_agent.outputs.output_types"));
        }
    }

    @Test
    @DisplayName("Pull request comment condition has three alternatives")
    void prCommentCondition() {
        DisjunctionNode condition = Conditions.prCommentCondition();

        assertEquals(3, condition.terms().size());
        assertEquals("(github.event_name == 'issue_comment') && (github.event.issue.pull_request != null)"
                        + " || github.event_name == 'pull_request_review_comment'"
                        + " || github.event_name == 'pull_request_review'",
                condition.render());
    }

    @Test
    @DisplayName("Reaction condition covers six event alternatives")
    void reactionCondition() {
        DisjunctionNode condition = Conditions.reactionCondition();

        assertEquals(6, condition.terms().size());
        assertEquals("github.event_name == 'issues'"
                        + " || github.event_name == 'issue_comment'"
                        + " || github.event_name == 'pull_request_review_comment'"
                        + " || github.event_name == 'discussion'"
                        + " || github.event_name == 'discussion_comment'"
                        + " || (github.event_name == 'pull_request') && (" + NOT_FROM_FORK + ")",
                condition.render());
    }

    @Test
    @DisplayName("Built conditions compose with the primitive builders")
    void composition() {
        ConditionNode negated = Conditions.not(Conditions.reactionCondition());

        assertEquals("!(" + Conditions.reactionCondition().render() + ")", negated.render());
    }

    @Test
    @DisplayName("Primitive builders render their surface forms")
    void primitives() {
        assertEquals("github.run_attempt > 1", Conditions.comparison(
                Conditions.propertyAccess("github.run_attempt"),
                ComparisonOperator.GREATER_THAN,
                Conditions.numberLiteral("1")).render());
        assertEquals("inputs.fast ? 'quick' : 'full'", Conditions.ternary(
                Conditions.propertyAccess("inputs.fast"),
                Conditions.stringLiteral("quick"),
                Conditions.stringLiteral("full")).render());
        assertEquals("# Issues\na ||\nb", Conditions.disjunction(true,
                Conditions.expression("a", "Issues"), Conditions.expression("b")).render());
        assertEquals("null", Conditions.nullLiteral().render());
    }

    @Test
    @DisplayName("Condition tree keeps both sides opaque")
    void conditionTree() {
        assertEquals("a", Conditions.conditionTree("", "a").render());
        assertEquals("a", Conditions.conditionTree(null, "a").render());
        assertEquals("(x || y) && (a)", Conditions.conditionTree("x || y", "a").render());
    }
}
