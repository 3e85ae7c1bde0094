package com.keystone.core.pack;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Fixed lookup table from a runtime version token (e.g. {@code 3.11}) to the
 * version-range expression recorded in the blueprint (e.g. {@code >=3.11,<4.0}).
 *
 * @param manager        package manager for the runtime
 * @param question       id of the question that picks the token
 * @param defaultVersion token used when the question is unanswered or the answer is unknown
 * @param versions       token to range expression
 */
public record RuntimeTable(
    String manager,
    String question,
    @JsonProperty("default") String defaultVersion,
    Map<String, String> versions
) {

    public RuntimeTable {
        versions = versions == null ? Map.of() : Map.copyOf(versions);
    }

    public String rangeFor(String token) {
        String range = token == null ? null : versions.get(token);
        return range != null ? range : versions.getOrDefault(defaultVersion, "*");
    }
}
