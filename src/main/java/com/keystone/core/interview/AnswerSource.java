package com.keystone.core.interview;

import java.util.Optional;

/**
 * Supplies raw answers to the {@link AnswerCollector}, one visible question at a time.
 */
public interface AnswerSource {

    /**
     * Asks for an answer. An empty result means "no answer", which the collector turns
     * into the question's default or an {@link IncompleteAnswerException}.
     *
     * @param question      the question being asked
     * @param answersSoFar  answers collected before this question
     */
    Optional<Object> solicit(Question question, AnswerSet answersSoFar);

    /**
     * Interactive sources get failed answers reported back and are asked again;
     * non-interactive sources fail the collection on the first bad answer.
     */
    boolean isInteractive();

    /** Called before re-soliciting a question whose previous answer was rejected. */
    default void reject(Question question, String reason) {
    }
}
