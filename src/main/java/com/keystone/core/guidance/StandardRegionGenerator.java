package com.keystone.core.guidance;

import com.keystone.core.document.ManagedRegion;
import com.keystone.core.model.Blueprint;
import com.keystone.core.pack.GuidanceSpec;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Renders the quickstart, verification, structure and agent-policy regions.
 * Pure function of the blueprint and the pack's guidance data.
 */
@Component
public class StandardRegionGenerator implements RegionGenerator {

    public static final String QUICKSTART = "quickstart";
    public static final String VERIFICATION = "verification";
    public static final String STRUCTURE = "structure";
    public static final String AGENT_POLICY = "agent-policy";

    private static final List<String> VERIFY_COMMANDS = List.of("format", "lint", "typecheck", "test");

    @Override
    public String name() {
        return GuidanceSpec.DEFAULT_GENERATOR;
    }

    @Override
    public List<ManagedRegion> generate(Blueprint blueprint, GuidanceSpec guidance) {
        return List.of(
                new ManagedRegion(QUICKSTART, quickstart(blueprint, guidance)),
                new ManagedRegion(VERIFICATION, verification(blueprint, guidance)),
                new ManagedRegion(STRUCTURE, structure(blueprint, guidance)),
                new ManagedRegion(AGENT_POLICY, agentPolicy(blueprint)));
    }

    String quickstart(Blueprint blueprint, GuidanceSpec guidance) {
        var sb = new StringBuilder();
        sb.append("## Quickstart\n\n");
        sb.append("- **Stack:** ").append(blueprint.stack().language())
          .append(" / ").append(blueprint.stack().framework())
          .append(" (").append(blueprint.stack().runtime().manager())
          .append(", runtime ").append(blueprint.stack().runtime().version()).append(")\n\n");

        var commands = new ArrayList<String>();
        addCommand(commands, blueprint, guidance, "install");
        if (blueprint.features().database().enabled() && blueprint.features().database().migrations()) {
            addCommand(commands, blueprint, guidance, "migrate");
        }
        addCommand(commands, blueprint, guidance, "run");
        if (!commands.isEmpty()) {
            sb.append("```bash\n").append(String.join("\n", commands)).append("\n```\n");
        }
        if (blueprint.infrastructure().docker().compose()) {
            sb.append("\nWith containers: `docker compose up --build`\n");
        }
        if (guidance.serverUrl() != null && !guidance.serverUrl().isBlank()) {
            sb.append("\nThe service listens on ").append(guidance.serverUrl()).append(".");
            if (blueprint.features().openapi()) {
                sb.append(" API docs: ").append(guidance.serverUrl()).append("/docs");
            }
            sb.append("\n");
        }
        return sb.toString();
    }

    String verification(Blueprint blueprint, GuidanceSpec guidance) {
        var sb = new StringBuilder();
        sb.append("## Verification\n\n");
        var commands = new ArrayList<String>();
        for (String name : VERIFY_COMMANDS) {
            if (name.equals("typecheck") && blueprint.tooling().typeChecker() == null) {
                continue;
            }
            addCommand(commands, blueprint, guidance, name);
        }
        if (commands.isEmpty()) {
            sb.append("No verification commands are defined for this stack.\n");
        } else {
            sb.append("Run these before declaring a change done:\n\n");
            sb.append("```bash\n").append(String.join("\n", commands)).append("\n```\n");
        }

        Blueprint.Testing testing = blueprint.tooling().testing();
        if (testing.coverage() && testing.coverageThreshold() != null) {
            sb.append("\nLine coverage must stay at or above ").append(testing.coverageThreshold()).append("%.\n");
        }
        Blueprint.Ci ci = blueprint.infrastructure().ci();
        if (!Blueprint.NONE.equals(ci.provider()) && !ci.checks().isEmpty()) {
            sb.append("\nCI (").append(ci.provider()).append(") runs: ")
              .append(String.join(", ", ci.checks())).append(".\n");
        }
        return sb.toString();
    }

    String structure(Blueprint blueprint, GuidanceSpec guidance) {
        var entries = new ArrayList<>(guidance.layout());
        if (blueprint.features().database().enabled()) {
            entries.addAll(guidance.databaseLayout());
        }
        if (blueprint.infrastructure().docker().enabled()) {
            entries.add("Dockerfile");
        }
        if (blueprint.infrastructure().docker().compose()) {
            entries.add("docker-compose.yml");
        }

        var sb = new StringBuilder();
        sb.append("## Project Structure\n\n```\n");
        sb.append(blueprint.project().name()).append("/\n");
        for (String entry : entries) {
            sb.append("  ").append(expand(entry, blueprint)).append("\n");
        }
        sb.append("```\n");
        return sb.toString();
    }

    String agentPolicy(Blueprint blueprint) {
        Blueprint.AgentPolicy agent = blueprint.agent();
        var sb = new StringBuilder();
        sb.append("## Agent Policy\n\n");
        sb.append("- **Autonomy:** ").append(agent.strictness().value()).append("\n");
        sb.append("- **Tests:** ").append(describe(agent.testRequirements().value())).append("\n");
        if (!agent.allowedOperations().isEmpty()) {
            sb.append("- **Allowed without asking:** ").append(String.join(", ", agent.allowedOperations())).append("\n");
        }
        if (!agent.prohibitedOperations().isEmpty()) {
            sb.append("- **Never:** ").append(String.join(", ", agent.prohibitedOperations())).append("\n");
        }
        if (!agent.customRules().isEmpty()) {
            sb.append("\n### Project Rules\n\n");
            agent.customRules().forEach(rule -> sb.append("- ").append(rule).append("\n"));
        }
        return sb.toString();
    }

    private static String describe(String testPolicy) {
        return switch (testPolicy) {
            case "always" -> "every change ships with tests";
            case "never" -> "do not add tests unless asked";
            default -> "add tests when asked or when fixing a bug";
        };
    }

    private static void addCommand(List<String> commands, Blueprint blueprint, GuidanceSpec guidance, String name) {
        String command = guidance.commands().get(name);
        if (command != null && !command.isBlank()) {
            commands.add(expand(command, blueprint));
        }
    }

    static String expand(String template, Blueprint blueprint) {
        return template
                .replace("{package}", packageName(blueprint.project().name()))
                .replace("{sourceDir}", blueprint.paths().sourceDir())
                .replace("{testDir}", blueprint.paths().testDir());
    }

    /** Project name as an importable module name, e.g. {@code my-api} becomes {@code my_api}. */
    static String packageName(String projectName) {
        String name = projectName.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]+", "_");
        name = name.replaceAll("^_+|_+$", "");
        if (name.isEmpty()) {
            return "app";
        }
        return Character.isDigit(name.charAt(0)) ? "_" + name : name;
    }
}
