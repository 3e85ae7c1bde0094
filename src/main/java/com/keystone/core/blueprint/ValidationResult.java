package com.keystone.core.blueprint;

import java.util.List;

public record ValidationResult(List<Violation> violations) {

    private static final ValidationResult OK = new ValidationResult(List.of());

    public ValidationResult {
        violations = List.copyOf(violations);
    }

    public static ValidationResult ok() {
        return OK;
    }

    public boolean isOk() {
        return violations.isEmpty();
    }

    public List<Violation> forRule(String rule) {
        return violations.stream().filter(v -> v.rule().equals(rule)).toList();
    }
}
