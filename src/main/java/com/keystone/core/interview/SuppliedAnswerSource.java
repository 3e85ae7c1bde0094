package com.keystone.core.interview;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Non-interactive answers, typically read from an answers file and {@code --set} flags.
 */
public class SuppliedAnswerSource implements AnswerSource {

    private final Map<String, Object> supplied;

    public SuppliedAnswerSource(Map<String, ?> supplied) {
        this.supplied = new LinkedHashMap<>(supplied);
    }

    @Override
    public Optional<Object> solicit(Question question, AnswerSet answersSoFar) {
        return Optional.ofNullable(supplied.get(question.id()));
    }

    @Override
    public boolean isInteractive() {
        return false;
    }
}
