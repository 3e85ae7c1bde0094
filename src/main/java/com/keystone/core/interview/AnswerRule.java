package com.keystone.core.interview;

import java.math.BigDecimal;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * A validation rule attached to a question by its tag.
 * <p>
 * Supported tags:
 * <ul>
 *   <li>{@code required}: the answer is non-empty after trimming whitespace</li>
 *   <li>{@code min-length:N}: the answer has at least {@code N} characters</li>
 *   <li>{@code email}: a single {@code @} with at least one dot after it</li>
 *   <li>{@code numeric}: the answer parses as a base-10 number</li>
 * </ul>
 * Any other tag is rejected by {@link #parse(String)} so that a misspelled rule fails
 * when the pack is loaded instead of silently accepting everything.
 *
 * @param kind      which rule
 * @param minLength the bound for {@link Kind#MIN_LENGTH}, zero otherwise
 */
public record AnswerRule(Kind kind, int minLength) {

    public enum Kind { REQUIRED, MIN_LENGTH, EMAIL, NUMERIC }

    private static final String MIN_LENGTH_PREFIX = "min-length:";

    private static final Pattern EMAIL_PATTERN = Pattern.compile("^[^\\s@]+@[^\\s@]+\\.[^\\s@]+$");

    public static AnswerRule parse(String tag) {
        if (tag == null) {
            throw new IllegalArgumentException("Validation rule tag is null");
        }
        switch (tag) {
            case "required":
                return new AnswerRule(Kind.REQUIRED, 0);
            case "email":
                return new AnswerRule(Kind.EMAIL, 0);
            case "numeric":
                return new AnswerRule(Kind.NUMERIC, 0);
            default:
                break;
        }
        if (tag.startsWith(MIN_LENGTH_PREFIX)) {
            String bound = tag.substring(MIN_LENGTH_PREFIX.length());
            try {
                int n = Integer.parseInt(bound);
                if (n < 0) {
                    throw new IllegalArgumentException("Negative bound in validation rule '" + tag + "'");
                }
                return new AnswerRule(Kind.MIN_LENGTH, n);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid bound in validation rule '" + tag + "'", e);
            }
        }
        throw new IllegalArgumentException("Unknown validation rule '" + tag + "'");
    }

    public String tag() {
        return switch (kind) {
            case REQUIRED -> "required";
            case MIN_LENGTH -> MIN_LENGTH_PREFIX + minLength;
            case EMAIL -> "email";
            case NUMERIC -> "numeric";
        };
    }

    /**
     * Checks a coerced answer value.
     *
     * @return a human-readable reason when the value fails, empty when it passes
     */
    public Optional<String> check(Object value) {
        String text = AnswerSet.asText(value);
        return switch (kind) {
            case REQUIRED -> text.trim().isEmpty()
                    ? Optional.of("This field is required")
                    : Optional.empty();
            case MIN_LENGTH -> text.length() < minLength
                    ? Optional.of("Must be at least " + minLength + " characters")
                    : Optional.empty();
            case EMAIL -> EMAIL_PATTERN.matcher(text).matches()
                    ? Optional.empty()
                    : Optional.of("Must be a valid email address");
            case NUMERIC -> isNumeric(text)
                    ? Optional.empty()
                    : Optional.of("Must be a valid number");
        };
    }

    private static boolean isNumeric(String text) {
        try {
            new BigDecimal(text.trim());
            return true;
        } catch (NumberFormatException e) {
            return false;
        }
    }
}
