package com.keystone.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The validated configuration-of-record for a generated project.
 * <p>
 * Built once per invocation by {@link com.keystone.core.blueprint.BlueprintBuilder},
 * checked by {@link com.keystone.core.blueprint.ConstraintValidator} and persisted as
 * {@code keystone.blueprint.json}. Instances are immutable; regenerating the guidance
 * document re-derives regions from a blueprint but never changes it.
 *
 * @param version        blueprint format version
 * @param meta           generator and pack identity
 * @param project        project identity
 * @param stack          language, framework, runtime constraint and dependency maps
 * @param features       feature flags, some carrying sub-fields
 * @param tooling        linter, formatter, type checker and test framework selections
 * @param infrastructure containerization, CI and deployment selections
 * @param agent          behavior policy for coding agents working on the project
 * @param paths          output, source and test directories
 */
public record Blueprint(
    String version,
    Meta meta,
    Project project,
    Stack stack,
    Features features,
    Tooling tooling,
    Infrastructure infrastructure,
    AgentPolicy agent,
    Paths paths
) {

    public static final String FORMAT_VERSION = "1.0";

    /** Neutral value for string sub-fields of a disabled feature. */
    public static final String NONE = "none";

    public record Meta(
        String packId,
        String packVersion,
        String generatedAt,
        String generator,
        String generatorVersion
    ) {}

    public record Project(
        String name,
        String description,
        String author,
        String license
    ) {}

    public record Stack(
        String language,
        String framework,
        Runtime runtime,
        Map<String, String> dependencies,
        Map<String, String> devDependencies
    ) {
        public Stack {
            dependencies = orderedCopy(dependencies);
            devDependencies = orderedCopy(devDependencies);
        }
    }

    /**
     * @param version version-range expression, e.g. {@code >=3.11,<4.0}
     * @param manager package manager driving the runtime, e.g. {@code poetry}
     */
    public record Runtime(String version, String manager) {}

    public record Features(
        Database database,
        Authentication authentication,
        RateLimiting rateLimiting,
        boolean cors,
        boolean openapi,
        boolean healthCheck
    ) {}

    public record Database(
        boolean enabled,
        String type,
        String orm,
        boolean migrations,
        boolean async
    ) {
        public static Database disabled() {
            return new Database(false, NONE, NONE, false, false);
        }
    }

    public record Authentication(boolean enabled, String method) {
        public static Authentication disabled() {
            return new Authentication(false, NONE);
        }
    }

    public record RateLimiting(boolean enabled, int requestsPerMinute) {
        public static RateLimiting disabled() {
            return new RateLimiting(false, 0);
        }
    }

    public record Tooling(
        Tool linter,
        Tool formatter,
        Tool typeChecker,
        Testing testing
    ) {}

    public record Tool(String tool, String configFile) {}

    /**
     * @param coverageThreshold minimum line coverage percentage, {@code null} when unset
     */
    public record Testing(String framework, boolean coverage, Integer coverageThreshold) {}

    public record Infrastructure(Docker docker, Ci ci, Deployment deployment) {}

    public record Docker(boolean enabled, boolean compose, String registry) {}

    public record Ci(String provider, List<String> checks) {
        public Ci {
            checks = checks == null ? List.of() : List.copyOf(checks);
        }
    }

    public record Deployment(String target) {}

    public record AgentPolicy(
        AutonomyLevel strictness,
        TestPolicy testRequirements,
        List<String> allowedOperations,
        List<String> prohibitedOperations,
        List<String> customRules
    ) {
        public AgentPolicy {
            allowedOperations = allowedOperations == null ? List.of() : List.copyOf(allowedOperations);
            prohibitedOperations = prohibitedOperations == null ? List.of() : List.copyOf(prohibitedOperations);
            customRules = customRules == null ? List.of() : List.copyOf(customRules);
        }
    }

    public record Paths(String outputDir, String sourceDir, String testDir) {}

    private static Map<String, String> orderedCopy(Map<String, String> source) {
        if (source == null) {
            return Map.of();
        }
        return Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }
}
