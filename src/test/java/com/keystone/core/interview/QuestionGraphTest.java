package com.keystone.core.interview;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class QuestionGraphTest {

    private static Question text(String id) {
        return new Question(id, QuestionKind.TEXT, id, null, List.of(), null, null);
    }

    private static Question confirm(String id) {
        return new Question(id, QuestionKind.CONFIRM, id, false, List.of(), null, null);
    }

    private static Question select(String id, Object defaultValue, String... values) {
        var choices = Arrays.stream(values).map(Choice::of).toList();
        return new Question(id, QuestionKind.SELECT, id, defaultValue, choices, null, null);
    }

    private static Question when(Question q, VisibilityPredicate predicate) {
        return new Question(q.id(), q.kind(), q.message(), q.defaultValue(), q.choices(), q.rule(), predicate);
    }

    @Test
    @DisplayName("accepts predicates that reference earlier questions")
    void acceptsBackwardReferences() {
        var graph = QuestionGraph.of(List.of(
                confirm("database_enabled"),
                when(select("database_type", "postgresql", "postgresql", "mysql"),
                        VisibilityPredicate.equalTo("database_enabled", true))));

        assertEquals(2, graph.size());
        assertEquals(1, graph.positionOf("database_type"));
        assertEquals(-1, graph.positionOf("missing"));
        assertTrue(graph.find("database_enabled").isPresent());
    }

    @Test
    @DisplayName("rejects a predicate on a question defined later")
    void rejectsForwardReference() {
        var ex = assertThrows(InvalidQuestionGraphException.class, () -> QuestionGraph.of(List.of(
                when(text("name"), VisibilityPredicate.equalTo("flag", true)),
                confirm("flag"))));

        assertEquals(1, ex.problems().size());
        assertTrue(ex.problems().get(0).contains("defined after it"));
    }

    @Test
    @DisplayName("rejects a predicate on the question itself")
    void rejectsSelfReference() {
        var ex = assertThrows(InvalidQuestionGraphException.class, () -> QuestionGraph.of(List.of(
                when(confirm("flag"), VisibilityPredicate.equalTo("flag", true)))));

        assertTrue(ex.problems().get(0).contains("on itself"));
    }

    @Test
    @DisplayName("rejects a predicate on an unknown question")
    void rejectsUnknownReference() {
        var ex = assertThrows(InvalidQuestionGraphException.class, () -> QuestionGraph.of(List.of(
                when(text("name"), VisibilityPredicate.equalTo("ghost", "x")))));

        assertTrue(ex.problems().get(0).contains("unknown question 'ghost'"));
    }

    @Test
    @DisplayName("reports every problem at once")
    void reportsAllProblems() {
        var ex = assertThrows(InvalidQuestionGraphException.class, () -> QuestionGraph.of(List.of(
                text("dup"),
                text("dup"),
                select("engine", null),
                select("db", "oracle", "postgresql"))));

        assertEquals(3, ex.problems().size());
        assertTrue(ex.getMessage().contains("duplicate question id 'dup'"));
        assertTrue(ex.getMessage().contains("has no choices"));
        assertTrue(ex.getMessage().contains("default 'oracle'"));
    }

    @Test
    @DisplayName("questions keep definition order")
    void keepsOrder() {
        var graph = QuestionGraph.of(List.of(text("c"), text("a"), text("b")));
        assertEquals(List.of("c", "a", "b"), graph.questions().stream().map(Question::id).toList());
    }
}
