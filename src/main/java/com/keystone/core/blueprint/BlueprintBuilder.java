package com.keystone.core.blueprint;

import com.keystone.core.config.KeystoneProperties;
import com.keystone.core.interview.AnswerSet;
import com.keystone.core.model.AutonomyLevel;
import com.keystone.core.model.Blueprint;
import com.keystone.core.model.TestPolicy;
import com.keystone.core.pack.FeatureDependencies;
import com.keystone.core.pack.PackDefaults;
import com.keystone.core.pack.PackManifest;
import com.keystone.core.pack.RuntimeTable;
import com.keystone.core.pack.TemplatePack;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * Maps an {@link AnswerSet} plus a pack's defaults onto a {@link Blueprint}.
 * <p>
 * Building never fails. Disabled features are neutralized (string sub-fields become
 * {@code "none"}, boolean sub-fields {@code false}) and contribute no dependencies.
 * Enabled features append their packages to the shared dependency map in the order their
 * toggle questions appear in the pack; when two features name the same package the later
 * one wins and the override is logged. Whether the result is coherent is for the
 * {@link ConstraintValidator} to decide.
 */
@Service
public class BlueprintBuilder {

    private static final Logger log = LoggerFactory.getLogger(BlueprintBuilder.class);

    public static final String GENERATOR = "keystone";
    public static final String DEFAULT_OUTPUT_DIR = ".";
    static final int NOT_A_WHOLE_NUMBER = -1;

    private final Clock clock;
    private final String generatorVersion;

    @Autowired
    public BlueprintBuilder(KeystoneProperties properties) {
        this(Clock.systemUTC(), properties.getGeneratorVersion());
    }

    public BlueprintBuilder(Clock clock, String generatorVersion) {
        this.clock = clock;
        this.generatorVersion = generatorVersion;
    }

    public Blueprint build(AnswerSet answers, TemplatePack pack) {
        return build(answers, pack, DEFAULT_OUTPUT_DIR);
    }

    public Blueprint build(AnswerSet answers, TemplatePack pack, String outputDir) {
        PackManifest manifest = pack.manifest();
        PackDefaults defaults = manifest.defaults();

        var meta = new Blueprint.Meta(
                manifest.id(),
                manifest.version(),
                Instant.now(clock).truncatedTo(ChronoUnit.SECONDS).toString(),
                GENERATOR,
                generatorVersion);

        var project = new Blueprint.Project(
                nonBlank(answers, AnswerKeys.PROJECT_NAME).orElse(defaults.projectName()),
                nonBlank(answers, AnswerKeys.DESCRIPTION)
                        .orElse("A " + manifest.framework() + " application"),
                nonBlank(answers, AnswerKeys.AUTHOR).orElse(null),
                defaults.license());

        RuntimeTable runtimeTable = manifest.runtime();
        String runtimeToken = runtimeTable.question() == null
                ? runtimeTable.defaultVersion()
                : answers.text(runtimeTable.question()).orElse(runtimeTable.defaultVersion());
        var stack = new Blueprint.Stack(
                manifest.language(),
                manifest.framework(),
                new Blueprint.Runtime(runtimeTable.rangeFor(runtimeToken), runtimeTable.manager()),
                dependencies(answers, pack),
                manifest.devDependencies());

        Blueprint.Features features = features(answers, manifest, defaults);

        return new Blueprint(
                Blueprint.FORMAT_VERSION,
                meta,
                project,
                stack,
                features,
                tooling(answers, defaults),
                infrastructure(answers, defaults, features.database().enabled()),
                agentPolicy(answers, defaults),
                new Blueprint.Paths(outputDir, defaults.paths().sourceDir(), defaults.paths().testDir()));
    }

    // ── Features ──────────────────────────────────────────────────

    private Blueprint.Features features(AnswerSet answers, PackManifest manifest, PackDefaults defaults) {
        Blueprint.Database database = Blueprint.Database.disabled();
        if (answers.flag(AnswerKeys.DATABASE_ENABLED)) {
            String type = answers.text(AnswerKeys.DATABASE_TYPE)
                    .orElseGet(() -> defaultOption(manifest, "database"));
            database = new Blueprint.Database(true, type, defaults.orm(), true, true);
        }

        Blueprint.Authentication authentication = Blueprint.Authentication.disabled();
        if (answers.flag(AnswerKeys.AUTH_ENABLED)) {
            String method = answers.text(AnswerKeys.AUTH_METHOD)
                    .orElseGet(() -> defaultOption(manifest, "authentication"));
            authentication = new Blueprint.Authentication(true, method);
        }

        List<String> extras = answers.contains(AnswerKeys.EXTRAS)
                ? answers.list(AnswerKeys.EXTRAS)
                : defaults.extras();

        Blueprint.RateLimiting rateLimiting = Blueprint.RateLimiting.disabled();
        if (extras.contains(AnswerKeys.EXTRA_RATE_LIMITING)) {
            int rpm = answers.number(AnswerKeys.RATE_LIMIT_RPM)
                    .map(n -> wholeNumber(AnswerKeys.RATE_LIMIT_RPM, n))
                    .orElse(defaults.rateLimitRpm());
            rateLimiting = new Blueprint.RateLimiting(true, rpm);
        }

        return new Blueprint.Features(
                database,
                authentication,
                rateLimiting,
                extras.contains(AnswerKeys.EXTRA_CORS),
                extras.contains(AnswerKeys.EXTRA_OPENAPI),
                extras.contains(AnswerKeys.EXTRA_HEALTH_CHECK));
    }

    private static String defaultOption(PackManifest manifest, String feature) {
        return manifest.features().stream()
                .filter(f -> f.feature().equals(feature))
                .map(FeatureDependencies::defaultOption)
                .filter(option -> option != null && !option.isBlank())
                .findFirst()
                .orElse(Blueprint.NONE);
    }

    /**
     * Base dependencies followed by the packages of every enabled feature, features
     * ordered by the position of their toggle question.
     */
    Map<String, String> dependencies(AnswerSet answers, TemplatePack pack) {
        PackManifest manifest = pack.manifest();
        var dependencies = new LinkedHashMap<>(manifest.dependencies());
        Map<String, String> contributedBy = new HashMap<>();

        List<FeatureDependencies> ordered = new ArrayList<>(manifest.features());
        ordered.sort(Comparator.comparingInt(f -> togglePosition(pack, f)));

        for (FeatureDependencies feature : ordered) {
            if (!answers.flag(feature.toggle())) {
                continue;
            }
            String option = feature.selector() == null
                    ? feature.defaultOption()
                    : answers.text(feature.selector()).orElse(feature.defaultOption());
            feature.packagesFor(option).forEach((pkg, version) -> {
                String previous = dependencies.put(pkg, version);
                String owner = contributedBy.put(pkg, feature.feature());
                if (previous != null && !previous.equals(version)) {
                    log.info("Dependency '{}' from feature '{}' overrides {} ({} -> {})",
                            pkg, feature.feature(),
                            owner == null ? "base dependencies" : "feature '" + owner + "'",
                            previous, version);
                }
            });
        }
        return dependencies;
    }

    private static int togglePosition(TemplatePack pack, FeatureDependencies feature) {
        int position = pack.questions().positionOf(feature.toggle());
        return position < 0 ? Integer.MAX_VALUE : position;
    }

    // ── Tooling, infrastructure, policy ───────────────────────────

    private Blueprint.Tooling tooling(AnswerSet answers, PackDefaults defaults) {
        Blueprint.Tooling base = defaults.tooling();
        Blueprint.Testing testing = base.testing();
        boolean coverage = answers.contains(AnswerKeys.COVERAGE_ENABLED)
                ? answers.flag(AnswerKeys.COVERAGE_ENABLED)
                : testing.coverage();
        Integer threshold = null;
        if (coverage) {
            threshold = answers.number(AnswerKeys.COVERAGE_THRESHOLD)
                    .map(n -> wholeNumber(AnswerKeys.COVERAGE_THRESHOLD, n))
                    .orElse(testing.coverageThreshold());
        }
        return new Blueprint.Tooling(
                base.linter(),
                base.formatter(),
                base.typeChecker(),
                new Blueprint.Testing(testing.framework(), coverage, threshold));
    }

    private Blueprint.Infrastructure infrastructure(AnswerSet answers, PackDefaults defaults, boolean databaseEnabled) {
        PackDefaults.Infrastructure base = defaults.infrastructure();

        boolean docker = answers.flag(AnswerKeys.DOCKER_ENABLED);
        boolean compose = docker && (answers.contains(AnswerKeys.COMPOSE_ENABLED)
                ? answers.flag(AnswerKeys.COMPOSE_ENABLED)
                : databaseEnabled);
        var dockerSection = new Blueprint.Docker(docker, compose, docker ? base.registry() : null);

        Blueprint.Ci ci = new Blueprint.Ci(Blueprint.NONE, List.of());
        if (answers.flag(AnswerKeys.CI_ENABLED)) {
            ci = new Blueprint.Ci(
                    answers.text(AnswerKeys.CI_PROVIDER).orElse(base.ciProvider()),
                    answers.contains(AnswerKeys.CI_CHECKS) ? answers.list(AnswerKeys.CI_CHECKS) : base.ciChecks());
        }

        return new Blueprint.Infrastructure(dockerSection, ci, new Blueprint.Deployment(base.deploymentTarget()));
    }

    private Blueprint.AgentPolicy agentPolicy(AnswerSet answers, PackDefaults defaults) {
        Blueprint.AgentPolicy base = defaults.agent();
        AutonomyLevel strictness = parse(answers, AnswerKeys.AUTONOMY, AutonomyLevel::fromValue, base.strictness());
        TestPolicy tests = parse(answers, AnswerKeys.TEST_POLICY, TestPolicy::fromValue, base.testRequirements());

        var rules = new ArrayList<>(base.customRules());
        answers.text(AnswerKeys.CUSTOM_RULES).ifPresent(text -> {
            for (String rule : text.split(";")) {
                if (!rule.isBlank()) {
                    rules.add(rule.trim());
                }
            }
        });
        return new Blueprint.AgentPolicy(strictness, tests, base.allowedOperations(), base.prohibitedOperations(), rules);
    }

    private static <T> T parse(AnswerSet answers, String id, Function<String, T> parser, T fallback) {
        Optional<String> text = answers.text(id);
        if (text.isEmpty()) {
            return fallback;
        }
        try {
            return parser.apply(text.get());
        } catch (IllegalArgumentException e) {
            log.warn("Ignoring answer '{}' for {}: {}", text.get(), id, e.getMessage());
            return fallback;
        }
    }

    /**
     * Exact int value of a numeric answer. Fractions and values outside the int range
     * become {@link #NOT_A_WHOLE_NUMBER}, which every numeric rule rejects.
     */
    static int wholeNumber(String id, BigDecimal value) {
        try {
            return value.stripTrailingZeros().intValueExact();
        } catch (ArithmeticException e) {
            log.warn("Answer {} for {} is not a whole number in range", value.toPlainString(), id);
            return NOT_A_WHOLE_NUMBER;
        }
    }

    private static Optional<String> nonBlank(AnswerSet answers, String id) {
        return answers.text(id).map(String::trim).filter(s -> !s.isEmpty());
    }
}
