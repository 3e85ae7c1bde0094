package com.keystone.core.interview;

/**
 * One option of a select or multiselect question.
 *
 * @param name        label shown to the user
 * @param value       value recorded in the answer set
 * @param description optional hint shown next to the label
 */
public record Choice(String name, String value, String description) {

    public static Choice of(String value) {
        return new Choice(value, value, null);
    }
}
