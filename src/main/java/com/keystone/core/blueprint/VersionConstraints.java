package com.keystone.core.blueprint;

import java.util.List;
import java.util.regex.Pattern;

/**
 * The version-constraint grammar accepted for dependency values.
 */
public final class VersionConstraints {

    private VersionConstraints() {}

    private static final String SEMVER = "\\d+\\.\\d+\\.\\d+";

    private static final List<Pattern> ACCEPTED = List.of(
            Pattern.compile("^" + SEMVER + "$"),
            Pattern.compile("^(\\^|~|>=|<=|>|<)" + SEMVER + "$"),
            Pattern.compile("^>=" + SEMVER + ",<" + SEMVER + "$"),
            Pattern.compile("^\\*$"),
            Pattern.compile("^latest$"));

    public static boolean isValid(String constraint) {
        if (constraint == null) {
            return false;
        }
        return ACCEPTED.stream().anyMatch(p -> p.matcher(constraint).matches());
    }
}
