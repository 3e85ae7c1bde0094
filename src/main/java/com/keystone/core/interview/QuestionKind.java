package com.keystone.core.interview;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.math.BigDecimal;
import java.util.List;

/**
 * Input kind of a question. Each kind knows how to coerce a raw response into the
 * canonical {@link AnswerSet} value type.
 */
public enum QuestionKind {
    TEXT("text"),
    SELECT("select"),
    MULTISELECT("multiselect"),
    CONFIRM("confirm"),
    NUMBER("number");

    private final String value;

    QuestionKind(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static QuestionKind fromValue(String value) {
        for (QuestionKind kind : values()) {
            if (kind.value.equalsIgnoreCase(value)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown question type: " + value);
    }

    public boolean hasChoices() {
        return this == SELECT || this == MULTISELECT;
    }

    /**
     * Coerces a raw response to this kind's value type.
     *
     * @throws IllegalArgumentException if the response cannot represent this kind
     */
    public Object coerce(Object raw) {
        Object value = AnswerSet.normalize(raw);
        return switch (this) {
            case TEXT -> AnswerSet.asText(value);
            case SELECT -> AnswerSet.asText(value).trim();
            case MULTISELECT -> value instanceof List<?> list
                    ? list.stream().map(String::valueOf).toList()
                    : AnswerSet.splitList(AnswerSet.asText(value));
            case CONFIRM -> toBoolean(value);
            case NUMBER -> toNumber(value);
        };
    }

    private static Boolean toBoolean(Object value) {
        if (value instanceof Boolean b) {
            return b;
        }
        String text = AnswerSet.asText(value).trim().toLowerCase();
        return switch (text) {
            case "true", "yes", "y", "1" -> Boolean.TRUE;
            case "false", "no", "n", "0" -> Boolean.FALSE;
            default -> throw new IllegalArgumentException("Expected yes or no, got '" + text + "'");
        };
    }

    private static BigDecimal toNumber(Object value) {
        if (value instanceof BigDecimal n) {
            return n;
        }
        String text = AnswerSet.asText(value).trim();
        try {
            return new BigDecimal(text);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Expected a number, got '" + text + "'");
        }
    }
}
