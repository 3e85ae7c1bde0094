package com.keystone.core.pack;

import com.keystone.core.interview.Question;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Contents of a pack's {@code pack.json}. Unknown keys are rejected by the loader.
 */
public record PackManifest(
    String id,
    String version,
    String name,
    String description,
    String language,
    String framework,
    RuntimeTable runtime,
    Map<String, String> dependencies,
    Map<String, String> devDependencies,
    List<FeatureDependencies> features,
    PackDefaults defaults,
    GuidanceSpec guidance,
    List<Question> questions
) {

    public PackManifest {
        dependencies = ordered(dependencies);
        devDependencies = ordered(devDependencies);
        features = features == null ? List.of() : List.copyOf(features);
        questions = questions == null ? List.of() : List.copyOf(questions);
        guidance = guidance == null ? new GuidanceSpec(null, null, null, null, null) : guidance;
    }

    public PackMetadata metadata() {
        return new PackMetadata(id, version, name, description, language, framework);
    }

    private static Map<String, String> ordered(Map<String, String> source) {
        return source == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }
}
