package com.keystone.core.interview;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Ordered, read-only set of questions.
 * <p>
 * Definition order is the only ordering: there is no dependency sort. Because a
 * visibility predicate may only reference a question defined before it, the graph is
 * acyclic by construction, which {@link #of(List)} verifies with a single pass over the
 * declared identifiers.
 */
public final class QuestionGraph {

    private final List<Question> questions;
    private final Map<String, Integer> positions;

    private QuestionGraph(List<Question> questions, Map<String, Integer> positions) {
        this.questions = questions;
        this.positions = positions;
    }

    /**
     * Builds a graph, checking identifiers, choices and predicate references.
     *
     * @throws InvalidQuestionGraphException listing every authoring error found
     */
    public static QuestionGraph of(List<Question> questions) {
        var problems = new ArrayList<String>();
        var positions = new HashMap<String, Integer>();

        // ids declared later, for telling a forward reference apart from an unknown one
        var allIds = new HashMap<String, Integer>();
        for (int i = 0; i < questions.size(); i++) {
            String id = questions.get(i).id();
            if (id != null) {
                allIds.putIfAbsent(id, i);
            }
        }

        for (int i = 0; i < questions.size(); i++) {
            Question q = questions.get(i);
            String id = q.id();
            if (id == null || id.isBlank()) {
                problems.add("question #" + (i + 1) + " has no id");
                continue;
            }
            if (q.kind() == null) {
                problems.add("question '" + id + "' has no type");
            } else if (q.kind().hasChoices()) {
                checkChoices(q, problems);
            }
            if (q.when() != null) {
                String field = q.when().field();
                if (!positions.containsKey(field)) {
                    if (field.equals(id)) {
                        problems.add("question '" + id + "' has a visibility condition on itself");
                    } else if (allIds.containsKey(field)) {
                        problems.add("question '" + id + "' has a visibility condition on '"
                                + field + "', which is defined after it");
                    } else {
                        problems.add("question '" + id + "' has a visibility condition on unknown question '"
                                + field + "'");
                    }
                }
            }
            if (positions.putIfAbsent(id, i) != null) {
                problems.add("duplicate question id '" + id + "'");
            }
        }

        if (!problems.isEmpty()) {
            throw new InvalidQuestionGraphException(problems);
        }
        return new QuestionGraph(List.copyOf(questions), Collections.unmodifiableMap(positions));
    }

    private static void checkChoices(Question q, List<String> problems) {
        if (q.choices().isEmpty()) {
            problems.add("question '" + q.id() + "' of type " + q.kind().value() + " has no choices");
            return;
        }
        Object def = q.defaultValue();
        if (def == null) {
            return;
        }
        List<String> defaults = def instanceof List<?> list
                ? list.stream().map(String::valueOf).toList()
                : List.of(AnswerSet.asText(def));
        for (String d : defaults) {
            if (!q.hasChoice(d)) {
                problems.add("question '" + q.id() + "' has default '" + d + "' which is not one of its choices");
            }
        }
    }

    public List<Question> questions() {
        return questions;
    }

    public Optional<Question> find(String id) {
        Integer position = positions.get(id);
        return position == null ? Optional.empty() : Optional.of(questions.get(position));
    }

    /** Definition position of a question, or {@code -1} if the graph has no such question. */
    public int positionOf(String id) {
        return positions.getOrDefault(id, -1);
    }

    public int size() {
        return questions.size();
    }
}
