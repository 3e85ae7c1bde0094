package com.keystone.core.blueprint;

/**
 * A broken constraint.
 *
 * @param rule    name of the rule that failed
 * @param path    dotted path of the offending field, e.g. {@code features.database.type}
 * @param message what is wrong
 */
public record Violation(String rule, String path, String message) {

    @Override
    public String toString() {
        return "[" + rule + "] " + path + ": " + message;
    }
}
