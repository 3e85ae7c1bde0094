package com.keystone.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * How much latitude a coding agent working on the generated project is given.
 */
public enum AutonomyLevel {
    STRICT("strict"),
    BALANCED("balanced"),
    PERMISSIVE("permissive");

    private final String value;

    AutonomyLevel(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static AutonomyLevel fromValue(String value) {
        for (AutonomyLevel level : values()) {
            if (level.value.equalsIgnoreCase(value)) {
                return level;
            }
        }
        throw new IllegalArgumentException("Unknown autonomy level: " + value);
    }
}
