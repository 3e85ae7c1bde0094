package com.keystone.core.interview;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Optional;

/**
 * An immutable questionnaire entry.
 * <p>
 * The rule tag from the pack file is parsed while the question is read, so an unknown
 * tag fails the pack load.
 *
 * @param id           unique key under which the answer is recorded
 * @param kind         input kind
 * @param message      prompt text
 * @param defaultValue value used when no answer is given, may be {@code null}
 * @param choices      options for {@link QuestionKind#SELECT} and {@link QuestionKind#MULTISELECT}
 * @param rule         validation rule, may be {@code null}
 * @param when         visibility predicate, {@code null} when always visible
 */
public record Question(
    String id,
    QuestionKind kind,
    String message,
    Object defaultValue,
    List<Choice> choices,
    AnswerRule rule,
    VisibilityPredicate when
) {

    public Question {
        choices = choices == null ? List.of() : List.copyOf(choices);
        defaultValue = AnswerSet.normalize(defaultValue);
    }

    @JsonCreator
    public static Question fromJson(@JsonProperty("id") String id,
                                    @JsonProperty("type") QuestionKind kind,
                                    @JsonProperty("message") String message,
                                    @JsonProperty("default") Object defaultValue,
                                    @JsonProperty("choices") List<Choice> choices,
                                    @JsonProperty("validate") String validate,
                                    @JsonProperty("when") VisibilityPredicate when) {
        AnswerRule rule = validate == null ? null : AnswerRule.parse(validate);
        return new Question(id, kind, message, defaultValue, choices, rule, when);
    }

    public boolean isVisible(AnswerSet answers) {
        return when == null || when.test(answers);
    }

    public boolean isRequired() {
        return rule != null && rule.kind() == AnswerRule.Kind.REQUIRED;
    }

    public boolean hasChoice(String value) {
        return choices.stream().anyMatch(c -> c.value().equals(value));
    }

    public Optional<String> ruleTag() {
        return Optional.ofNullable(rule).map(AnswerRule::tag);
    }
}
