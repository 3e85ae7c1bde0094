package com.keystone.core.interview;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class VisibilityPredicateTest {

    @Test
    @DisplayName("equals compares booleans and numbers by value")
    void equalsByValue() {
        var answers = AnswerSet.of(Map.of("enabled", true, "port", 8080));

        assertTrue(VisibilityPredicate.equalTo("enabled", true).test(answers));
        assertTrue(VisibilityPredicate.equalTo("enabled", "true").test(answers));
        assertTrue(VisibilityPredicate.equalTo("port", 8080L).test(answers));
        assertFalse(VisibilityPredicate.equalTo("enabled", false).test(answers));
    }

    @Test
    @DisplayName("an unanswered field equals nothing and differs from everything")
    void unansweredField() {
        var answers = AnswerSet.empty();
        assertFalse(VisibilityPredicate.equalTo("enabled", true).test(answers));
        assertTrue(VisibilityPredicate.notEqualTo("enabled", true).test(answers));
        assertFalse(VisibilityPredicate.contains("extras", "cors").test(answers));
    }

    @Test
    @DisplayName("contains checks list membership")
    void containsMembership() {
        var answers = AnswerSet.of(Map.of("extras", List.of("cors", "rate-limiting")));
        assertTrue(VisibilityPredicate.contains("extras", "rate-limiting").test(answers));
        assertFalse(VisibilityPredicate.contains("extras", "openapi").test(answers));
    }

    @Test
    @DisplayName("parses from pack JSON with exactly one comparison")
    void parsesJson() throws Exception {
        var mapper = new ObjectMapper();
        var predicate = mapper.readValue("{\"field\":\"extras\",\"contains\":\"cors\"}", VisibilityPredicate.class);
        assertEquals(VisibilityPredicate.Comparison.CONTAINS, predicate.comparison());
        assertEquals("cors", predicate.value());

        assertThrows(Exception.class, () -> mapper.readValue(
                "{\"field\":\"a\",\"equals\":1,\"notEquals\":2}", VisibilityPredicate.class));
        assertThrows(Exception.class, () -> mapper.readValue(
                "{\"field\":\"a\"}", VisibilityPredicate.class));
    }
}
