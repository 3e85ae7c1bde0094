package com.keystone.core.interview;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Walks a {@link QuestionGraph} in definition order and accumulates an {@link AnswerSet}.
 * <p>
 * Each question's visibility predicate is evaluated against the answers collected so
 * far (a live view, never a cached snapshot). Invisible questions are skipped and get no
 * entry. Visible questions are solicited from an {@link AnswerSource}, coerced to their
 * input kind and checked against their validation rule.
 */
@Service
public class AnswerCollector {

    private static final Logger log = LoggerFactory.getLogger(AnswerCollector.class);

    /**
     * Runs the questionnaire.
     *
     * @throws IncompleteAnswerException if a required question ends up without a value
     * @throws InvalidAnswerException    if a non-interactive answer fails validation
     */
    public AnswerSet collect(QuestionGraph graph, AnswerSource source) {
        Map<String, Object> collected = new LinkedHashMap<>();
        AnswerSet live = AnswerSet.liveView(collected);

        for (Question question : graph.questions()) {
            if (!question.isVisible(live)) {
                log.debug("Skipping question '{}' (condition on '{}' not met)",
                        question.id(), question.when().field());
                continue;
            }
            answer(question, live, source).ifPresent(value -> {
                collected.put(question.id(), value);
                log.debug("Answer: {} = {}", question.id(), value);
            });
        }

        log.info("Interview complete: {} answers collected from {} questions", collected.size(), graph.size());
        return AnswerSet.of(collected);
    }

    /**
     * Lists the questions that a traversal would ask given the answers in {@code answers}.
     * Each question only sees answers to questions defined before it, exactly as during
     * {@link #collect}.
     */
    public List<String> visibleQuestions(QuestionGraph graph, AnswerSet answers) {
        var visible = new ArrayList<String>();
        Map<String, Object> prefix = new LinkedHashMap<>();
        AnswerSet live = AnswerSet.liveView(prefix);
        for (Question question : graph.questions()) {
            if (question.isVisible(live)) {
                visible.add(question.id());
                answers.get(question.id()).ifPresent(value -> prefix.put(question.id(), value));
            }
        }
        return visible;
    }

    private Optional<Object> answer(Question question, AnswerSet live, AnswerSource source) {
        while (true) {
            Optional<Object> response = source.solicit(question, live);
            if (response.isEmpty()) {
                return fallBack(question, source);
            }
            try {
                return Optional.of(accept(question, response.get()));
            } catch (InvalidAnswerException e) {
                if (!source.isInteractive()) {
                    throw e;
                }
                log.debug("Rejected answer for '{}': {}", question.id(), e.reason());
                source.reject(question, e.reason());
            }
        }
    }

    private Optional<Object> fallBack(Question question, AnswerSource source) {
        if (question.isRequired() && !source.isInteractive()) {
            throw new IncompleteAnswerException(question.id(), "no answer supplied for a required question");
        }
        if (question.defaultValue() == null) {
            if (question.isRequired()) {
                throw new IncompleteAnswerException(question.id(), "no answer given and no default available");
            }
            return Optional.empty();
        }
        // a default that fails its own rule is an authoring error; report it instead of re-asking
        return Optional.of(accept(question, question.defaultValue()));
    }

    private Object accept(Question question, Object raw) {
        Object value;
        try {
            value = question.kind().coerce(raw);
        } catch (IllegalArgumentException e) {
            throw new InvalidAnswerException(question.id(), "type:" + question.kind().value(), e.getMessage());
        }

        if (question.rule() != null) {
            Optional<String> failure = question.rule().check(value);
            if (failure.isPresent()) {
                throw new InvalidAnswerException(question.id(), question.rule().tag(), failure.get());
            }
        }

        if (question.kind() == QuestionKind.SELECT) {
            requireChoice(question, (String) value);
        } else if (question.kind() == QuestionKind.MULTISELECT) {
            for (Object item : (List<?>) value) {
                requireChoice(question, (String) item);
            }
        }
        return value;
    }

    private void requireChoice(Question question, String value) {
        if (!question.hasChoice(value)) {
            var allowed = question.choices().stream().map(Choice::value).toList();
            throw new InvalidAnswerException(question.id(), "choice",
                    "'" + value + "' is not one of " + String.join(", ", allowed));
        }
    }
}
