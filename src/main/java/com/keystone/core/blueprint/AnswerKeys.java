package com.keystone.core.blueprint;

/**
 * Question ids the builder reads. Packs must use these ids for the answers to land in
 * the typed blueprint fields; unanswered ids fall back to the pack defaults.
 */
public final class AnswerKeys {

    private AnswerKeys() {}

    public static final String PROJECT_NAME = "project_name";
    public static final String DESCRIPTION = "description";
    public static final String AUTHOR = "author";

    public static final String DATABASE_ENABLED = "database_enabled";
    public static final String DATABASE_TYPE = "database_type";
    public static final String AUTH_ENABLED = "auth_enabled";
    public static final String AUTH_METHOD = "auth_method";
    public static final String EXTRAS = "extras";
    public static final String RATE_LIMIT_RPM = "rate_limit_rpm";

    public static final String DOCKER_ENABLED = "docker_enabled";
    public static final String COMPOSE_ENABLED = "compose_enabled";
    public static final String CI_ENABLED = "ci_enabled";
    public static final String CI_PROVIDER = "ci_provider";
    public static final String CI_CHECKS = "ci_checks";

    public static final String COVERAGE_ENABLED = "coverage_enabled";
    public static final String COVERAGE_THRESHOLD = "coverage_threshold";

    public static final String AUTONOMY = "autonomy";
    public static final String TEST_POLICY = "test_policy";
    public static final String CUSTOM_RULES = "custom_rules";

    public static final String EXTRA_CORS = "cors";
    public static final String EXTRA_RATE_LIMITING = "rate-limiting";
    public static final String EXTRA_OPENAPI = "openapi";
    public static final String EXTRA_HEALTH_CHECK = "health-check";
}
