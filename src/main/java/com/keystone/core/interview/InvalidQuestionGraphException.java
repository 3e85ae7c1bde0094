package com.keystone.core.interview;

import com.keystone.core.KeystoneException;

import java.util.List;

/**
 * Thrown when a question graph has authoring errors, for example a visibility predicate
 * referencing a question defined later.
 */
public class InvalidQuestionGraphException extends KeystoneException {

    private final List<String> problems;

    public InvalidQuestionGraphException(List<String> problems) {
        super("Invalid question graph: " + String.join("; ", problems));
        this.problems = List.copyOf(problems);
    }

    public List<String> problems() {
        return problems;
    }
}
