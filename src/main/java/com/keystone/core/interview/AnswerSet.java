package com.keystone.core.interview;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Ordered mapping from question identifier to answer value.
 * <p>
 * Values are normalized to one of {@code String}, {@code Boolean}, {@code BigDecimal}
 * or {@code List<String>}. Instances returned by {@link #of(Map)} and by
 * {@link AnswerCollector#collect} are immutable. During collection the collector hands
 * visibility predicates a read-only live view so they always see the answers as they
 * stand after the previous question.
 */
public final class AnswerSet {

    private static final AnswerSet EMPTY = new AnswerSet(Map.of());

    private final Map<String, Object> values;

    private AnswerSet(Map<String, Object> values) {
        this.values = values;
    }

    public static AnswerSet empty() {
        return EMPTY;
    }

    public static AnswerSet of(Map<String, ?> raw) {
        var copy = new LinkedHashMap<String, Object>();
        raw.forEach((id, value) -> {
            Object normalized = normalize(value);
            if (normalized != null) {
                copy.put(id, normalized);
            }
        });
        return new AnswerSet(Collections.unmodifiableMap(copy));
    }

    /** Read-only view over a map that the caller keeps mutating. */
    static AnswerSet liveView(Map<String, Object> backing) {
        return new AnswerSet(Collections.unmodifiableMap(backing));
    }

    public boolean contains(String id) {
        return values.containsKey(id);
    }

    public Optional<Object> get(String id) {
        return Optional.ofNullable(values.get(id));
    }

    /** The answer rendered as text; absent when the question was not answered. */
    public Optional<String> text(String id) {
        return get(id).map(AnswerSet::asText);
    }

    /** {@code true} only for an affirmative answer; unanswered counts as {@code false}. */
    public boolean flag(String id) {
        Object value = values.get(id);
        if (value instanceof Boolean b) {
            return b;
        }
        if (value instanceof String s) {
            String v = s.trim().toLowerCase();
            return v.equals("true") || v.equals("yes") || v.equals("y");
        }
        return false;
    }

    public Optional<BigDecimal> number(String id) {
        Object value = values.get(id);
        if (value instanceof BigDecimal n) {
            return Optional.of(n);
        }
        if (value instanceof String s) {
            try {
                return Optional.of(new BigDecimal(s.trim()));
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    /**
     * The answer as a list of strings. A text answer is split on commas; an unanswered
     * question yields an empty list.
     */
    public List<String> list(String id) {
        Object value = values.get(id);
        if (value instanceof List<?> list) {
            return list.stream().map(String::valueOf).toList();
        }
        if (value instanceof String s) {
            return splitList(s);
        }
        return List.of();
    }

    public Set<String> ids() {
        return values.keySet();
    }

    public Map<String, Object> asMap() {
        return values;
    }

    public int size() {
        return values.size();
    }

    /**
     * Converts a raw answer (from JSON, the console or test code) into its canonical form.
     */
    static Object normalize(Object raw) {
        if (raw == null || raw instanceof String || raw instanceof Boolean || raw instanceof BigDecimal) {
            return raw;
        }
        if (raw instanceof Number n) {
            return new BigDecimal(n.toString());
        }
        if (raw instanceof Collection<?> c) {
            var items = new ArrayList<String>(c.size());
            for (Object item : c) {
                items.add(String.valueOf(item));
            }
            return List.copyOf(items);
        }
        return raw.toString();
    }

    static String asText(Object value) {
        if (value == null) {
            return "";
        }
        if (value instanceof BigDecimal n) {
            return n.toPlainString();
        }
        if (value instanceof List<?> list) {
            return String.join(",", list.stream().map(String::valueOf).toList());
        }
        return value.toString();
    }

    static List<String> splitList(String text) {
        var items = new ArrayList<String>();
        for (String part : text.split(",")) {
            String trimmed = part.trim();
            if (!trimmed.isEmpty()) {
                items.add(trimmed);
            }
        }
        return List.copyOf(items);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AnswerSet other)) return false;
        return values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(values);
    }

    @Override
    public String toString() {
        return "AnswerSet" + values;
    }
}
