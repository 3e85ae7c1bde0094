package com.keystone.core.interview;

import com.keystone.core.KeystoneException;

/**
 * Thrown when a visible question requires a value and none could be obtained.
 */
public class IncompleteAnswerException extends KeystoneException {

    private final String questionId;

    public IncompleteAnswerException(String questionId, String reason) {
        super("Missing answer for '" + questionId + "': " + reason);
        this.questionId = questionId;
    }

    public String questionId() {
        return questionId;
    }
}
