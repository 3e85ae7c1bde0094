package com.keystone.core.pack;

import com.keystone.core.model.Blueprint;

import java.util.List;

/**
 * Blueprint values a pack supplies for everything the interview leaves unanswered.
 */
public record PackDefaults(
    String projectName,
    String license,
    String orm,
    List<String> extras,
    int rateLimitRpm,
    Blueprint.Tooling tooling,
    Infrastructure infrastructure,
    Blueprint.AgentPolicy agent,
    Blueprint.Paths paths
) {

    public PackDefaults {
        extras = extras == null ? List.of() : List.copyOf(extras);
    }

    public record Infrastructure(
        String registry,
        String deploymentTarget,
        String ciProvider,
        List<String> ciChecks
    ) {
        public Infrastructure {
            ciChecks = ciChecks == null ? List.of() : List.copyOf(ciChecks);
        }
    }
}
