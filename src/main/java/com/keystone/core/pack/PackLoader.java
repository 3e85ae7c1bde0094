package com.keystone.core.pack;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.keystone.core.config.KeystoneProperties;
import com.keystone.core.guidance.RegionGenerator;
import com.keystone.core.interview.InvalidQuestionGraphException;
import com.keystone.core.interview.QuestionGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Reads {@code packs/<id>/pack.json}, from the configured packs directory when one is
 * set and the pack exists there, otherwise from the classpath.
 */
@Service
public class PackLoader {

    private static final Logger log = LoggerFactory.getLogger(PackLoader.class);

    public static final String MANIFEST = "pack.json";
    static final String CLASSPATH_ROOT = "packs/";

    private static final Pattern PACK_ID = Pattern.compile("^[A-Za-z0-9-]+$");

    private final KeystoneProperties properties;
    private final Map<String, RegionGenerator> generators = new LinkedHashMap<>();
    private final ObjectMapper mapper = new ObjectMapper()
            .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    public PackLoader(KeystoneProperties properties, List<RegionGenerator> generators) {
        this.properties = properties;
        generators.forEach(g -> this.generators.put(g.name(), g));
    }

    public static boolean isValidId(String packId) {
        return packId != null && PACK_ID.matcher(packId).matches();
    }

    /**
     * @throws PackNotFoundException if no manifest exists for {@code packId}
     * @throws PackLoadException     if the id is invalid or the manifest is unusable
     */
    public TemplatePack load(String packId) {
        if (!isValidId(packId)) {
            throw new PackLoadException(String.valueOf(packId),
                    "pack ids may only contain letters, digits and hyphens");
        }
        Resource resource = locate(packId);
        if (!resource.exists()) {
            throw new PackNotFoundException(packId);
        }

        PackManifest manifest;
        try (InputStream in = resource.getInputStream()) {
            manifest = mapper.readValue(in, PackManifest.class);
        } catch (IOException e) {
            throw new PackLoadException(packId, "cannot parse " + MANIFEST + ": " + e.getMessage(), e);
        } catch (IllegalArgumentException e) {
            throw new PackLoadException(packId, e.getMessage(), e);
        }

        checkManifest(packId, manifest);

        QuestionGraph graph;
        try {
            graph = QuestionGraph.of(manifest.questions());
        } catch (InvalidQuestionGraphException e) {
            throw new PackLoadException(packId, e.getMessage(), e);
        }
        checkReferences(packId, manifest, graph);

        RegionGenerator generator = generators.get(manifest.guidance().generator());
        if (generator == null) {
            throw new PackLoadException(packId,
                    "unknown region generator '" + manifest.guidance().generator() + "'");
        }

        log.debug("Loaded pack {}@{} from {} ({} questions)",
                manifest.id(), manifest.version(), resource.getDescription(), graph.size());
        return new TemplatePack(manifest, graph, generator);
    }

    Resource locate(String packId) {
        if (properties.getPacks().hasDirectory()) {
            Path manifest = Path.of(properties.getPacks().getDirectory(), packId, MANIFEST);
            var file = new FileSystemResource(manifest);
            if (file.exists()) {
                return file;
            }
        }
        return new ClassPathResource(CLASSPATH_ROOT + packId + "/" + MANIFEST);
    }

    private static void checkManifest(String packId, PackManifest manifest) {
        var missing = new ArrayList<String>();
        if (isBlank(manifest.id())) missing.add("id");
        if (isBlank(manifest.version())) missing.add("version");
        if (isBlank(manifest.name())) missing.add("name");
        if (isBlank(manifest.language())) missing.add("language");
        if (isBlank(manifest.framework())) missing.add("framework");
        if (manifest.runtime() == null) missing.add("runtime");
        PackDefaults defaults = manifest.defaults();
        if (defaults == null) {
            missing.add("defaults");
        } else {
            if (defaults.tooling() == null) missing.add("defaults.tooling");
            else if (defaults.tooling().testing() == null) missing.add("defaults.tooling.testing");
            if (defaults.infrastructure() == null) missing.add("defaults.infrastructure");
            if (defaults.agent() == null) {
                missing.add("defaults.agent");
            } else {
                if (defaults.agent().strictness() == null) missing.add("defaults.agent.strictness");
                if (defaults.agent().testRequirements() == null) missing.add("defaults.agent.testRequirements");
            }
            if (defaults.paths() == null) missing.add("defaults.paths");
        }
        if (!missing.isEmpty()) {
            throw new PackLoadException(packId, "missing required fields: " + String.join(", ", missing));
        }
        if (!manifest.id().equals(packId)) {
            throw new PackLoadException(packId,
                    "declared id '" + manifest.id() + "' does not match directory '" + packId + "'");
        }
    }

    private static void checkReferences(String packId, PackManifest manifest, QuestionGraph graph) {
        var problems = new ArrayList<String>();
        String runtimeQuestion = manifest.runtime().question();
        if (runtimeQuestion != null && graph.find(runtimeQuestion).isEmpty()) {
            problems.add("runtime question '" + runtimeQuestion + "' is not defined");
        }
        for (FeatureDependencies feature : manifest.features()) {
            if (isBlank(feature.feature()) || isBlank(feature.toggle())) {
                problems.add("feature entries need 'feature' and 'toggle'");
                continue;
            }
            if (graph.find(feature.toggle()).isEmpty()) {
                problems.add("feature '" + feature.feature() + "' toggle '" + feature.toggle() + "' is not defined");
            }
            if (feature.selector() != null && graph.find(feature.selector()).isEmpty()) {
                problems.add("feature '" + feature.feature() + "' selector '" + feature.selector() + "' is not defined");
            }
        }
        if (!problems.isEmpty()) {
            throw new PackLoadException(packId, String.join("; ", problems));
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
