package com.keystone.core.pack;

import com.keystone.core.KeystoneException;
import com.keystone.core.config.KeystoneProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;
import org.springframework.core.io.support.ResourcePatternResolver;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Stream;

/**
 * Discovers and caches template packs.
 */
@Service
public class PackRegistry {

    private static final Logger log = LoggerFactory.getLogger(PackRegistry.class);

    private static final String CLASSPATH_PATTERN = "classpath*:" + PackLoader.CLASSPATH_ROOT + "*/" + PackLoader.MANIFEST;

    private final PackLoader loader;
    private final KeystoneProperties properties;
    private final ResourcePatternResolver resolver;
    private final Map<String, TemplatePack> cache = new ConcurrentHashMap<>();

    @Autowired
    public PackRegistry(PackLoader loader, KeystoneProperties properties) {
        this(loader, properties, new PathMatchingResourcePatternResolver());
    }

    PackRegistry(PackLoader loader, KeystoneProperties properties, ResourcePatternResolver resolver) {
        this.loader = loader;
        this.properties = properties;
        this.resolver = resolver;
    }

    public TemplatePack getPack(String packId) {
        TemplatePack cached = cache.get(packId);
        if (cached != null) {
            return cached;
        }
        TemplatePack pack = loader.load(packId);
        cache.put(packId, pack);
        return pack;
    }

    /** Ids of every discoverable pack, sorted. */
    public List<String> listPackIds() {
        var ids = new TreeSet<String>();
        try {
            for (Resource resource : resolver.getResources(CLASSPATH_PATTERN)) {
                packIdOf(resource).ifPresent(ids::add);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot scan classpath for packs", e);
        }
        if (properties.getPacks().hasDirectory()) {
            ids.addAll(directoryPackIds(Path.of(properties.getPacks().getDirectory())));
        }
        return List.copyOf(ids);
    }

    /** Metadata of every pack that loads; broken packs are logged and left out. */
    public List<PackMetadata> listPacks() {
        var packs = new ArrayList<PackMetadata>();
        for (String id : listPackIds()) {
            try {
                packs.add(getPack(id).metadata());
            } catch (KeystoneException e) {
                log.warn("Skipping pack '{}': {}", id, e.getMessage());
            }
        }
        return packs;
    }

    public Optional<TemplatePack> findByLanguage(String language, String framework) {
        return listPacks().stream()
                .filter(m -> m.language().equalsIgnoreCase(language))
                .filter(m -> framework == null || m.framework().equalsIgnoreCase(framework))
                .findFirst()
                .map(m -> getPack(m.id()));
    }

    static Optional<String> packIdOf(Resource resource) {
        try {
            String uri = resource.getURI().toString();
            String dir = uri.substring(0, uri.length() - PackLoader.MANIFEST.length() - 1);
            String id = dir.substring(dir.lastIndexOf('/') + 1);
            return PackLoader.isValidId(id) ? Optional.of(id) : Optional.empty();
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot resolve pack resource " + resource.getDescription(), e);
        }
    }

    private static List<String> directoryPackIds(Path root) {
        if (!Files.isDirectory(root)) {
            log.warn("Packs directory {} does not exist", root);
            return List.of();
        }
        try (Stream<Path> children = Files.list(root)) {
            return children
                    .filter(dir -> Files.isRegularFile(dir.resolve(PackLoader.MANIFEST)))
                    .map(dir -> dir.getFileName().toString())
                    .filter(PackLoader::isValidId)
                    .toList();
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot list packs directory " + root, e);
        }
    }
}
