package com.keystone.core.pack;

import java.util.List;
import java.util.Map;

/**
 * Pack data consumed by a {@link com.keystone.core.guidance.RegionGenerator}.
 * <p>
 * Command and layout strings may use the placeholders {@code {package}},
 * {@code {sourceDir}} and {@code {testDir}}.
 *
 * @param generator      name of the region generator to use
 * @param serverUrl      where the generated service listens, may be {@code null}
 * @param commands       well-known command name (install, run, lint, ...) to shell command
 * @param layout         project tree entries
 * @param databaseLayout extra tree entries when the database feature is enabled
 */
public record GuidanceSpec(
    String generator,
    String serverUrl,
    Map<String, String> commands,
    List<String> layout,
    List<String> databaseLayout
) {

    public static final String DEFAULT_GENERATOR = "standard";

    public GuidanceSpec {
        generator = generator == null || generator.isBlank() ? DEFAULT_GENERATOR : generator;
        commands = commands == null ? Map.of() : Map.copyOf(commands);
        layout = layout == null ? List.of() : List.copyOf(layout);
        databaseLayout = databaseLayout == null ? List.of() : List.copyOf(databaseLayout);
    }
}
