package com.keystone.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * When an agent is expected to write tests alongside its changes.
 */
public enum TestPolicy {
    ALWAYS("always"),
    ON_REQUEST("on-request"),
    NEVER("never");

    private final String value;

    TestPolicy(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static TestPolicy fromValue(String value) {
        for (TestPolicy policy : values()) {
            if (policy.value.equalsIgnoreCase(value)) {
                return policy;
            }
        }
        throw new IllegalArgumentException("Unknown test policy: " + value);
    }
}
