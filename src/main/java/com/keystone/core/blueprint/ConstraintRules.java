package com.keystone.core.blueprint;

import com.keystone.core.model.Blueprint;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.BiConsumer;

/**
 * The standard rule set, in evaluation order.
 */
public final class ConstraintRules {

    private ConstraintRules() {}

    public static final String DISABLED_FEATURE_NEUTRAL = "disabled-feature-neutral";
    public static final String ENABLED_FEATURE_COMPLETE = "enabled-feature-complete";
    public static final String COVERAGE_THRESHOLD = "coverage-threshold";
    public static final String PARENT_TOGGLE = "parent-toggle";
    public static final String DEPENDENCY_VERSION = "dependency-version";
    public static final String REQUIRED_FIELDS = "required-fields";

    public static List<ConstraintRule> standard() {
        return List.of(
                rule(DISABLED_FEATURE_NEUTRAL, ConstraintRules::disabledFeaturesAreNeutral),
                rule(ENABLED_FEATURE_COMPLETE, ConstraintRules::enabledFeaturesAreComplete),
                rule(COVERAGE_THRESHOLD, ConstraintRules::coverageThresholdInRange),
                rule(PARENT_TOGGLE, ConstraintRules::childTogglesNeedParent),
                rule(DEPENDENCY_VERSION, ConstraintRules::dependencyVersionsAreValid),
                rule(REQUIRED_FIELDS, ConstraintRules::requiredFieldsPresent));
    }

    static ConstraintRule rule(String name, BiConsumer<Blueprint, Checks> body) {
        return new ConstraintRule() {
            @Override
            public String name() {
                return name;
            }

            @Override
            public List<Violation> evaluate(Blueprint blueprint) {
                var checks = new Checks(name);
                body.accept(blueprint, checks);
                return checks.violations;
            }

            @Override
            public String toString() {
                return name;
            }
        };
    }

    /** Collects violations for a single rule. */
    static final class Checks {

        private final String rule;
        private final List<Violation> violations = new ArrayList<>();

        Checks(String rule) {
            this.rule = rule;
        }

        void require(boolean condition, String path, String message) {
            if (!condition) {
                violations.add(new Violation(rule, path, message));
            }
        }
    }

    // ── Rules ─────────────────────────────────────────────────────

    private static void disabledFeaturesAreNeutral(Blueprint b, Checks checks) {
        Blueprint.Features features = b.features();
        if (features != null) {
            Blueprint.Database db = features.database();
            if (db != null && !db.enabled()) {
                checks.require(isNone(db.type()), "features.database.type",
                        "must be 'none' when the database is disabled");
                checks.require(isNone(db.orm()), "features.database.orm",
                        "must be 'none' when the database is disabled");
                checks.require(!db.migrations(), "features.database.migrations",
                        "must be false when the database is disabled");
                checks.require(!db.async(), "features.database.async",
                        "must be false when the database is disabled");
            }
            Blueprint.Authentication auth = features.authentication();
            if (auth != null && !auth.enabled()) {
                checks.require(isNone(auth.method()), "features.authentication.method",
                        "must be 'none' when authentication is disabled");
            }
            Blueprint.RateLimiting rateLimiting = features.rateLimiting();
            if (rateLimiting != null && !rateLimiting.enabled()) {
                checks.require(rateLimiting.requestsPerMinute() == 0, "features.rateLimiting.requestsPerMinute",
                        "must be 0 when rate limiting is disabled");
            }
        }
        Blueprint.Ci ci = ci(b);
        if (ci != null && isNone(ci.provider())) {
            checks.require(ci.checks().isEmpty(), "infrastructure.ci.checks",
                    "must be empty when no CI provider is configured");
        }
    }

    private static void enabledFeaturesAreComplete(Blueprint b, Checks checks) {
        Blueprint.Features features = b.features();
        if (features != null) {
            Blueprint.Database db = features.database();
            if (db != null && db.enabled()) {
                checks.require(!isNone(db.type()), "features.database.type",
                        "an enabled database needs a type");
                checks.require(!isNone(db.orm()), "features.database.orm",
                        "an enabled database needs an ORM");
            }
            Blueprint.Authentication auth = features.authentication();
            if (auth != null && auth.enabled()) {
                checks.require(!isNone(auth.method()), "features.authentication.method",
                        "enabled authentication needs a method");
            }
            Blueprint.RateLimiting rateLimiting = features.rateLimiting();
            if (rateLimiting != null && rateLimiting.enabled()) {
                checks.require(rateLimiting.requestsPerMinute() > 0, "features.rateLimiting.requestsPerMinute",
                        "must be positive when rate limiting is enabled");
            }
        }
        Blueprint.Ci ci = ci(b);
        if (ci != null && !isNone(ci.provider())) {
            checks.require(!ci.checks().isEmpty(), "infrastructure.ci.checks",
                    "a configured CI provider needs at least one check");
        }
    }

    private static void coverageThresholdInRange(Blueprint b, Checks checks) {
        if (b.tooling() == null || b.tooling().testing() == null) {
            return;
        }
        Blueprint.Testing testing = b.tooling().testing();
        Integer threshold = testing.coverageThreshold();
        if (testing.coverage()) {
            checks.require(threshold != null, "tooling.testing.coverageThreshold",
                    "required when coverage is enabled");
        }
        if (threshold != null) {
            checks.require(threshold >= 0 && threshold <= 100, "tooling.testing.coverageThreshold",
                    "must be between 0 and 100, got " + threshold);
        }
    }

    private static void childTogglesNeedParent(Blueprint b, Checks checks) {
        if (b.infrastructure() == null || b.infrastructure().docker() == null) {
            return;
        }
        Blueprint.Docker docker = b.infrastructure().docker();
        checks.require(!docker.compose() || docker.enabled(), "infrastructure.docker.compose",
                "docker compose requires docker to be enabled");
    }

    private static void dependencyVersionsAreValid(Blueprint b, Checks checks) {
        if (b.stack() == null) {
            return;
        }
        checkVersions(b.stack().dependencies(), "stack.dependencies.", checks);
        checkVersions(b.stack().devDependencies(), "stack.devDependencies.", checks);
    }

    private static void checkVersions(Map<String, String> dependencies, String prefix, Checks checks) {
        dependencies.forEach((name, version) ->
                checks.require(VersionConstraints.isValid(version), prefix + name,
                        "invalid version constraint '" + version + "'"));
    }

    private static void requiredFieldsPresent(Blueprint b, Checks checks) {
        checks.require(!isBlank(b.version()), "version", "is required");
        if (b.meta() == null) {
            checks.require(false, "meta", "section is missing");
        } else {
            checks.require(!isBlank(b.meta().packId()), "meta.packId", "is required");
        }

        if (b.project() == null) {
            checks.require(false, "project", "section is missing");
        } else {
            checks.require(!isBlank(b.project().name()), "project.name", "is required");
            checks.require(!isBlank(b.project().description()), "project.description", "is required");
        }

        if (b.stack() == null) {
            checks.require(false, "stack", "section is missing");
        } else {
            checks.require(!isBlank(b.stack().language()), "stack.language", "is required");
            checks.require(!isBlank(b.stack().framework()), "stack.framework", "is required");
            Blueprint.Runtime runtime = b.stack().runtime();
            checks.require(runtime != null && !isBlank(runtime.version()), "stack.runtime.version", "is required");
            checks.require(runtime != null && !isBlank(runtime.manager()), "stack.runtime.manager", "is required");
        }

        Blueprint.Features features = b.features();
        if (features == null) {
            checks.require(false, "features", "section is missing");
        } else {
            checks.require(features.database() != null, "features.database", "section is missing");
            checks.require(features.authentication() != null, "features.authentication", "section is missing");
            checks.require(features.rateLimiting() != null, "features.rateLimiting", "section is missing");
        }

        Blueprint.Tooling tooling = b.tooling();
        if (tooling == null) {
            checks.require(false, "tooling", "section is missing");
        } else if (tooling.testing() == null) {
            checks.require(false, "tooling.testing", "section is missing");
        } else {
            checks.require(!isBlank(tooling.testing().framework()), "tooling.testing.framework", "is required");
        }

        Blueprint.Infrastructure infrastructure = b.infrastructure();
        if (infrastructure == null) {
            checks.require(false, "infrastructure", "section is missing");
        } else {
            checks.require(infrastructure.docker() != null, "infrastructure.docker", "section is missing");
            if (infrastructure.ci() == null) {
                checks.require(false, "infrastructure.ci", "section is missing");
            } else {
                checks.require(!isBlank(infrastructure.ci().provider()), "infrastructure.ci.provider", "is required");
            }
        }

        Blueprint.AgentPolicy agent = b.agent();
        if (agent == null) {
            checks.require(false, "agent", "section is missing");
        } else {
            checks.require(agent.strictness() != null, "agent.strictness", "is required");
            checks.require(agent.testRequirements() != null, "agent.testRequirements", "is required");
        }

        Blueprint.Paths paths = b.paths();
        if (paths == null) {
            checks.require(false, "paths", "section is missing");
        } else {
            checks.require(!isBlank(paths.sourceDir()), "paths.sourceDir", "is required");
            checks.require(!isBlank(paths.testDir()), "paths.testDir", "is required");
        }
    }

    // ── Helpers ───────────────────────────────────────────────────

    private static Blueprint.Ci ci(Blueprint b) {
        return b.infrastructure() == null ? null : b.infrastructure().ci();
    }

    private static boolean isNone(String value) {
        return isBlank(value) || Blueprint.NONE.equals(value);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
