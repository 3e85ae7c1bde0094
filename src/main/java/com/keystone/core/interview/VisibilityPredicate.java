package com.keystone.core.interview;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.util.List;
import java.util.Objects;

/**
 * Condition deciding whether a question is asked, expressed as a comparison against one
 * earlier question's answer: a field, a comparison and a literal.
 * <p>
 * In a pack file it is written as {@code {"field": "database_enabled", "equals": true}},
 * with exactly one of {@code equals}, {@code notEquals} or {@code contains}.
 */
public record VisibilityPredicate(String field, Comparison comparison, Object value) {

    public enum Comparison { EQUALS, NOT_EQUALS, CONTAINS }

    public VisibilityPredicate {
        Objects.requireNonNull(field, "field");
        Objects.requireNonNull(comparison, "comparison");
        value = AnswerSet.normalize(value);
    }

    public static VisibilityPredicate equalTo(String field, Object value) {
        return new VisibilityPredicate(field, Comparison.EQUALS, value);
    }

    public static VisibilityPredicate notEqualTo(String field, Object value) {
        return new VisibilityPredicate(field, Comparison.NOT_EQUALS, value);
    }

    public static VisibilityPredicate contains(String field, String value) {
        return new VisibilityPredicate(field, Comparison.CONTAINS, value);
    }

    @JsonCreator
    public static VisibilityPredicate fromJson(@JsonProperty("field") String field,
                                               @JsonProperty("equals") Object equals,
                                               @JsonProperty("notEquals") Object notEquals,
                                               @JsonProperty("contains") String contains) {
        if (field == null || field.isBlank()) {
            throw new IllegalArgumentException("Visibility condition has no field");
        }
        int set = (equals != null ? 1 : 0) + (notEquals != null ? 1 : 0) + (contains != null ? 1 : 0);
        if (set != 1) {
            throw new IllegalArgumentException("Visibility condition on '" + field
                    + "' must declare exactly one of equals, notEquals, contains");
        }
        if (equals != null) {
            return equalTo(field, equals);
        }
        if (notEquals != null) {
            return notEqualTo(field, notEquals);
        }
        return contains(field, contains);
    }

    public boolean test(AnswerSet answers) {
        Object actual = answers.get(field).orElse(null);
        return switch (comparison) {
            case EQUALS -> sameValue(actual, value);
            case NOT_EQUALS -> !sameValue(actual, value);
            case CONTAINS -> containsValue(actual, value);
        };
    }

    private static boolean sameValue(Object actual, Object expected) {
        if (actual == null || expected == null) {
            return actual == expected;
        }
        if (actual instanceof BigDecimal a && expected instanceof BigDecimal e) {
            return a.compareTo(e) == 0;
        }
        if (actual.getClass() == expected.getClass()) {
            return actual.equals(expected);
        }
        // e.g. a confirm answered as Boolean compared against "true" in the pack file
        return AnswerSet.asText(actual).equalsIgnoreCase(AnswerSet.asText(expected));
    }

    private static boolean containsValue(Object actual, Object expected) {
        String needle = AnswerSet.asText(expected);
        if (actual instanceof List<?> list) {
            return list.contains(needle);
        }
        if (actual instanceof String text) {
            return text.contains(needle);
        }
        return false;
    }
}
