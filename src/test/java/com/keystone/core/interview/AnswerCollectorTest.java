package com.keystone.core.interview;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class AnswerCollectorTest {

    private final AnswerCollector collector = new AnswerCollector();

    /** Interactive source replaying canned responses; {@code null} means a blank line. */
    private static class ScriptedSource implements AnswerSource {

        private final Deque<Optional<Object>> responses = new ArrayDeque<>();
        final List<String> asked = new ArrayList<>();
        final List<String> rejections = new ArrayList<>();

        ScriptedSource(Object... responses) {
            for (Object r : responses) {
                this.responses.add(Optional.ofNullable(r));
            }
        }

        @Override
        public Optional<Object> solicit(Question question, AnswerSet answersSoFar) {
            asked.add(question.id());
            return responses.isEmpty() ? Optional.empty() : responses.poll();
        }

        @Override
        public boolean isInteractive() {
            return true;
        }

        @Override
        public void reject(Question question, String reason) {
            rejections.add(question.id() + ": " + reason);
        }
    }

    private static Question question(String id, QuestionKind kind, Object def, String rule,
                                     VisibilityPredicate when, String... choices) {
        return new Question(id, kind, id, def,
                List.of(choices).stream().map(Choice::of).toList(),
                rule == null ? null : AnswerRule.parse(rule), when);
    }

    private static QuestionGraph databaseGraph() {
        return QuestionGraph.of(List.of(
                question("name", QuestionKind.TEXT, null, "required", null),
                question("database_enabled", QuestionKind.CONFIRM, false, null, null),
                question("database_type", QuestionKind.SELECT, "postgresql", null,
                        VisibilityPredicate.equalTo("database_enabled", true), "postgresql", "mysql"),
                question("extras", QuestionKind.MULTISELECT, List.of(), null, null, "cors", "rate-limiting"),
                question("rpm", QuestionKind.NUMBER, 60, "numeric",
                        VisibilityPredicate.contains("extras", "rate-limiting"))));
    }

    // ── Visibility ───────────────────────────────────────────────────

    @Nested
    @DisplayName("Visibility")
    class Visibility {

        @Test
        @DisplayName("hidden questions are never asked and get no entry")
        void skipsHiddenQuestions() {
            var source = new ScriptedSource("billing", "no", "cors");
            AnswerSet answers = collector.collect(databaseGraph(), source);

            assertEquals(List.of("name", "database_enabled", "extras"), source.asked);
            assertFalse(answers.contains("database_type"));
            assertFalse(answers.contains("rpm"));
            assertEquals(List.of("name", "database_enabled", "extras"), List.copyOf(answers.ids()));
        }

        @Test
        @DisplayName("predicates see answers given earlier in the same run")
        void revealsDependentQuestions() {
            var source = new ScriptedSource("billing", "yes", "mysql", "cors,rate-limiting", "120");
            AnswerSet answers = collector.collect(databaseGraph(), source);

            assertEquals("mysql", answers.text("database_type").orElseThrow());
            assertEquals(0, new BigDecimal("120").compareTo(answers.number("rpm").orElseThrow()));
            assertEquals(List.of("cors", "rate-limiting"), answers.list("extras"));
        }

        @Test
        @DisplayName("visible question list is stable for the same answers")
        void visibleQuestionsDeterministic() {
            var answers = AnswerSet.of(Map.of("name", "x", "database_enabled", true));
            var first = collector.visibleQuestions(databaseGraph(), answers);
            var second = collector.visibleQuestions(databaseGraph(), answers);

            assertEquals(List.of("name", "database_enabled", "database_type", "extras"), first);
            assertEquals(first, second);
        }
    }

    // ── Defaults and validation ─────────────────────────────────────

    @Nested
    @DisplayName("Defaults and validation")
    class Validation {

        @Test
        @DisplayName("a blank answer takes the default")
        void blankTakesDefault() {
            var source = new ScriptedSource("billing", null, null);
            AnswerSet answers = collector.collect(databaseGraph(), source);

            assertEquals(Boolean.FALSE, answers.get("database_enabled").orElseThrow());
            assertEquals(List.of(), answers.list("extras"));
        }

        @Test
        @DisplayName("interactive sources are re-asked after a rejected answer")
        void reasksAfterRejection() {
            var source = new ScriptedSource("billing", "maybe", "yes", "oracle", "postgresql", null);
            AnswerSet answers = collector.collect(databaseGraph(), source);

            assertTrue(answers.flag("database_enabled"));
            assertEquals("postgresql", answers.text("database_type").orElseThrow());
            assertEquals(2, source.rejections.size());
            assertTrue(source.rejections.get(0).startsWith("database_enabled"));
            assertTrue(source.rejections.get(1).contains("'oracle' is not one of"));
        }

        @Test
        @DisplayName("an empty answer to a required question is rejected and asked again")
        void emptyRequiredIsReasked() {
            var source = new ScriptedSource("", "billing");
            AnswerSet answers = collector.collect(databaseGraph(), source);

            assertEquals("billing", answers.text("name").orElseThrow());
            assertEquals(List.of("name: This field is required"), source.rejections);
            assertEquals(List.of("name", "name"), source.asked.subList(0, 2));
        }

        @Test
        @DisplayName("a required question without an answer or default is incomplete")
        void requiredWithoutDefault() {
            var ex = assertThrows(IncompleteAnswerException.class,
                    () -> collector.collect(databaseGraph(), new ScriptedSource()));
            assertEquals("name", ex.questionId());
        }
    }

    // ── Non-interactive ──────────────────────────────────────────────

    @Nested
    @DisplayName("Non-interactive")
    class NonInteractive {

        @Test
        @DisplayName("supplied answers are coerced to their kind")
        void coercesSuppliedAnswers() {
            var source = new SuppliedAnswerSource(Map.of(
                    "name", "billing",
                    "database_enabled", "true",
                    "extras", "rate-limiting",
                    "rpm", "90"));
            AnswerSet answers = collector.collect(databaseGraph(), source);

            assertEquals(Boolean.TRUE, answers.get("database_enabled").orElseThrow());
            assertEquals("postgresql", answers.text("database_type").orElseThrow());
            assertEquals(List.of("rate-limiting"), answers.list("extras"));
            assertEquals(90, answers.number("rpm").orElseThrow().intValue());
        }

        @Test
        @DisplayName("an invalid supplied answer fails immediately")
        void invalidAnswerFails() {
            var source = new SuppliedAnswerSource(Map.of(
                    "name", "billing",
                    "extras", List.of("rate-limiting"),
                    "rpm", "fast"));

            var ex = assertThrows(InvalidAnswerException.class, () -> collector.collect(databaseGraph(), source));
            assertEquals("rpm", ex.questionId());
            assertEquals("type:number", ex.rule());
        }

        @Test
        @DisplayName("a missing required answer fails even with a default")
        void requiredNeedsExplicitAnswer() {
            var graph = QuestionGraph.of(List.of(
                    question("name", QuestionKind.TEXT, "my-api", "required", null)));

            var ex = assertThrows(IncompleteAnswerException.class,
                    () -> collector.collect(graph, new SuppliedAnswerSource(Map.of())));
            assertEquals("name", ex.questionId());
        }

        @Test
        @DisplayName("answers for hidden questions are ignored")
        void ignoresHiddenAnswers() {
            var source = new SuppliedAnswerSource(Map.of(
                    "name", "billing",
                    "database_enabled", false,
                    "database_type", "mysql"));
            AnswerSet answers = collector.collect(databaseGraph(), source);

            assertFalse(answers.contains("database_type"));
        }
    }
}
