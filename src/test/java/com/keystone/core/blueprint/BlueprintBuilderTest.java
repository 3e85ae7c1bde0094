package com.keystone.core.blueprint;

import com.keystone.core.TestPacks;
import com.keystone.core.interview.AnswerCollector;
import com.keystone.core.interview.AnswerSet;
import com.keystone.core.interview.SuppliedAnswerSource;
import com.keystone.core.model.AutonomyLevel;
import com.keystone.core.model.Blueprint;
import com.keystone.core.model.TestPolicy;
import com.keystone.core.pack.FeatureDependencies;
import com.keystone.core.pack.TemplatePack;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class BlueprintBuilderTest {

    private static final Clock FIXED = Clock.fixed(Instant.parse("2024-03-01T12:30:45.678Z"), ZoneOffset.UTC);

    private static TemplatePack python;

    private final BlueprintBuilder builder = new BlueprintBuilder(FIXED, "9.9.9");
    private final ConstraintValidator validator = new ConstraintValidator();

    @BeforeAll
    static void loadPack() {
        python = TestPacks.pythonApi();
    }

    /** Runs the python-api interview non-interactively and builds the result. */
    private Blueprint buildPython(Map<String, ?> supplied) {
        var answers = new HashMap<String, Object>(supplied);
        answers.putIfAbsent("project_name", "billing");
        AnswerSet collected = new AnswerCollector().collect(python.questions(), new SuppliedAnswerSource(answers));
        return builder.build(collected, python, "out");
    }

    // ── Database ─────────────────────────────────────────────────────

    @Nested
    @DisplayName("Database feature")
    class Database {

        @Test
        @DisplayName("disabled database is neutral and the blueprint validates")
        void disabledIsNeutral() {
            Blueprint blueprint = buildPython(Map.of("database_enabled", false));

            Blueprint.Database db = blueprint.features().database();
            assertFalse(db.enabled());
            assertEquals("none", db.type());
            assertEquals("none", db.orm());
            assertFalse(db.migrations());
            assertFalse(db.async());
            assertFalse(blueprint.stack().dependencies().containsKey("sqlalchemy"));
            assertTrue(validator.validate(blueprint).isOk());
        }

        @Test
        @DisplayName("enabled postgresql adds the ORM and the async driver")
        void postgresqlDependencies() {
            Blueprint blueprint = buildPython(Map.of("database_enabled", true, "database_type", "postgresql"));

            Blueprint.Database db = blueprint.features().database();
            assertTrue(db.enabled());
            assertEquals("postgresql", db.type());
            assertEquals("sqlalchemy", db.orm());
            assertTrue(db.migrations());
            assertTrue(db.async());

            Map<String, String> deps = blueprint.stack().dependencies();
            assertEquals("^2.0.23", deps.get("sqlalchemy"));
            assertEquals("^0.29.0", deps.get("asyncpg"));
            assertFalse(deps.containsKey("aiomysql"));
            assertTrue(validator.validate(blueprint).isOk());
        }

        @Test
        @DisplayName("base dependencies come first in declaration order")
        void dependencyOrder() {
            Blueprint blueprint = buildPython(Map.of("database_enabled", true, "database_type", "mysql"));

            List<String> names = List.copyOf(blueprint.stack().dependencies().keySet());
            assertEquals(List.of("fastapi", "uvicorn", "pydantic", "pydantic-settings",
                    "sqlalchemy", "alembic", "aiomysql"), names);
        }
    }

    // ── Mapping ──────────────────────────────────────────────────────

    @Nested
    @DisplayName("Answer mapping")
    class Mapping {

        @Test
        @DisplayName("meta records pack identity and a second-precision timestamp")
        void meta() {
            Blueprint blueprint = buildPython(Map.of());

            assertEquals("python-api", blueprint.meta().packId());
            assertEquals("1.0.0", blueprint.meta().packVersion());
            assertEquals("2024-03-01T12:30:45Z", blueprint.meta().generatedAt());
            assertEquals("keystone", blueprint.meta().generator());
            assertEquals("9.9.9", blueprint.meta().generatorVersion());
            assertEquals("1.0", blueprint.version());
            assertEquals("out", blueprint.paths().outputDir());
        }

        @Test
        @DisplayName("runtime token maps to a version range")
        void runtimeRange() {
            assertEquals(">=3.12,<4.0", buildPython(Map.of("runtime_version", "3.12")).stack().runtime().version());
            assertEquals(">=3.11,<4.0", buildPython(Map.of()).stack().runtime().version());
            assertEquals("poetry", buildPython(Map.of()).stack().runtime().manager());
        }

        @Test
        @DisplayName("rate limiting follows the extras selection")
        void rateLimiting() {
            Blueprint off = buildPython(Map.of("extras", List.of("cors")));
            assertFalse(off.features().rateLimiting().enabled());
            assertEquals(0, off.features().rateLimiting().requestsPerMinute());
            assertTrue(off.features().cors());
            assertFalse(off.features().healthCheck());

            Blueprint on = buildPython(Map.of("extras", List.of("rate-limiting", "openapi"), "rate_limit_rpm", 120));
            assertTrue(on.features().rateLimiting().enabled());
            assertEquals(120, on.features().rateLimiting().requestsPerMinute());
            assertTrue(on.features().openapi());
        }

        @Test
        @DisplayName("disabled coverage drops the threshold")
        void coverage() {
            Blueprint blueprint = buildPython(Map.of("coverage_enabled", false));
            assertFalse(blueprint.tooling().testing().coverage());
            assertNull(blueprint.tooling().testing().coverageThreshold());

            Blueprint strict = buildPython(Map.of("coverage_threshold", 95));
            assertEquals(95, strict.tooling().testing().coverageThreshold());
        }

        @Test
        @DisplayName("fractional or oversized numbers are not narrowed into range")
        void numbersAreNotNarrowed() {
            Blueprint wrapped = buildPython(Map.of("coverage_threshold", "4294967346"));
            Blueprint fractional = buildPython(Map.of("coverage_threshold", "100.9"));
            Blueprint halfRate = buildPython(Map.of("extras", List.of("rate-limiting"), "rate_limit_rpm", "0.5"));

            assertNotEquals(50, wrapped.tooling().testing().coverageThreshold());
            assertEquals(1, validator.validate(wrapped).forRule(ConstraintRules.COVERAGE_THRESHOLD).size());
            assertNotEquals(100, fractional.tooling().testing().coverageThreshold());
            assertEquals(1, validator.validate(fractional).forRule(ConstraintRules.COVERAGE_THRESHOLD).size());
            assertEquals(1, validator.validate(halfRate).forRule(ConstraintRules.ENABLED_FEATURE_COMPLETE).size());

            assertEquals(80, buildPython(Map.of("coverage_threshold", "80.00")).tooling().testing().coverageThreshold());
        }

        @Test
        @DisplayName("compose and registry depend on docker; CI checks depend on a provider")
        void infrastructure() {
            Blueprint noDocker = buildPython(Map.of("docker_enabled", false, "ci_enabled", false));
            assertFalse(noDocker.infrastructure().docker().compose());
            assertNull(noDocker.infrastructure().docker().registry());
            assertEquals("none", noDocker.infrastructure().ci().provider());
            assertTrue(noDocker.infrastructure().ci().checks().isEmpty());
            assertTrue(validator.validate(noDocker).isOk());

            Blueprint docker = buildPython(Map.of("ci_checks", List.of("test")));
            assertTrue(docker.infrastructure().docker().compose());
            assertEquals("ghcr.io", docker.infrastructure().docker().registry());
            assertEquals(List.of("test"), docker.infrastructure().ci().checks());
        }

        @Test
        @DisplayName("agent policy answers and custom rules are applied")
        void agentPolicy() {
            Blueprint blueprint = buildPython(Map.of(
                    "autonomy", "strict",
                    "test_policy", "always",
                    "custom_rules", "Use type hints; Keep handlers thin;"));

            assertEquals(AutonomyLevel.STRICT, blueprint.agent().strictness());
            assertEquals(TestPolicy.ALWAYS, blueprint.agent().testRequirements());
            assertEquals(List.of("Use type hints", "Keep handlers thin"), blueprint.agent().customRules());
            assertTrue(blueprint.agent().prohibitedOperations().contains("modify-migrations"));
        }

        @Test
        @DisplayName("unanswered text falls back to pack defaults")
        void projectDefaults() {
            var answers = AnswerSet.of(Map.of("project_name", "  "));
            Blueprint blueprint = builder.build(answers, python);

            assertEquals("my-api", blueprint.project().name());
            assertEquals("A fastapi application", blueprint.project().description());
            assertNull(blueprint.project().author());
            assertEquals(".", blueprint.paths().outputDir());
        }
    }

    // ── Collisions ───────────────────────────────────────────────────

    @Test
    @DisplayName("a later feature overrides a colliding package from an earlier one")
    void laterFeatureWins() {
        var database = new FeatureDependencies("database", "db_on", null, null,
                Map.of("shared-lib", "^1.0.0"), Map.of());
        var cache = new FeatureDependencies("cache", "cache_on", null, null,
                Map.of("shared-lib", "^2.0.0", "cache-lib", "^0.1.0"), Map.of());
        // features listed out of order; toggle question position decides
        TemplatePack pack = TestPacks.pack(
                List.of(TestPacks.confirm("cache_on", true), TestPacks.confirm("db_on", true)),
                List.of(database, cache));

        Map<String, String> deps = builder.dependencies(AnswerSet.of(Map.of("cache_on", true, "db_on", true)), pack);

        assertEquals("^1.0.0", deps.get("shared-lib"));
        assertEquals("^0.1.0", deps.get("cache-lib"));
        assertEquals("core-lib", deps.keySet().iterator().next());
        assertEquals(3, deps.size());
    }
}
