package com.keystone.core.pack;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Packages a feature adds to the blueprint's dependency map when its toggle is on.
 * <p>
 * Which engine maps to which driver is pack data; the builder only knows the mechanism:
 * the {@code common} packages plus the packages of the selected option are appended to
 * the shared map.
 *
 * @param feature       feature name, e.g. {@code database}
 * @param toggle        id of the confirm question enabling the feature
 * @param selector      id of the question choosing an option, may be {@code null}
 * @param defaultOption option assumed when the selector is unanswered
 * @param common        packages added whatever the option
 * @param options       option to packages
 */
public record FeatureDependencies(
    String feature,
    String toggle,
    String selector,
    String defaultOption,
    Map<String, String> common,
    Map<String, Map<String, String>> options
) {

    public FeatureDependencies {
        common = common == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(common));
        options = options == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(options));
    }

    /** Common packages followed by the option's packages, in declaration order. */
    public Map<String, String> packagesFor(String option) {
        var packages = new LinkedHashMap<>(common);
        if (option != null) {
            packages.putAll(options.getOrDefault(option, Map.of()));
        }
        return packages;
    }
}
