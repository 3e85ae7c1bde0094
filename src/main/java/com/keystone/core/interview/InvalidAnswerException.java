package com.keystone.core.interview;

import com.keystone.core.KeystoneException;

/**
 * Thrown when an answer fails its question's validation rule or cannot be read as the
 * question's input kind.
 */
public class InvalidAnswerException extends KeystoneException {

    private final String questionId;
    private final String rule;
    private final String reason;

    /**
     * @param questionId the offending question
     * @param rule       the violated rule tag, or {@code type:<kind>} / {@code choice}
     *                   for input-kind failures
     * @param reason     human-readable explanation
     */
    public InvalidAnswerException(String questionId, String rule, String reason) {
        super("Invalid answer for '" + questionId + "' (" + rule + "): " + reason);
        this.questionId = questionId;
        this.rule = rule;
        this.reason = reason;
    }

    public String questionId() {
        return questionId;
    }

    public String rule() {
        return rule;
    }

    public String reason() {
        return reason;
    }
}
