package com.keystone.core.pack;

import com.keystone.core.config.KeystoneProperties;
import com.keystone.core.guidance.StandardRegionGenerator;
import com.keystone.core.interview.QuestionKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PackLoaderTest {

    static final String TINY = """
            {
              "id": "%s",
              "version": "0.1.0",
              "name": "Tiny",
              "language": "go",
              "framework": "chi",
              "runtime": { "manager": "go", "default": "1.22", "versions": { "1.22": ">=1.22.0" } },
              "defaults": {
                "projectName": "tiny",
                "tooling": { "testing": { "framework": "go-test", "coverage": false } },
                "infrastructure": { "deploymentTarget": "docker", "ciProvider": "github-actions", "ciChecks": ["test"] },
                "agent": { "strictness": "balanced", "testRequirements": "on-request" },
                "paths": { "outputDir": ".", "sourceDir": "internal", "testDir": "internal" }
              },
              "questions": [
                { "id": "project_name", "type": "text", "message": "Name", "validate": "required" }
              ]
            }
            """;

    static void writePack(Path root, String dir, String json) throws IOException {
        Path packDir = Files.createDirectories(root.resolve(dir));
        Files.writeString(packDir.resolve(PackLoader.MANIFEST), json);
    }

    private static PackLoader loaderFor(Path directory) {
        var properties = new KeystoneProperties();
        if (directory != null) {
            properties.getPacks().setDirectory(directory.toString());
        }
        return new PackLoader(properties, List.of(new StandardRegionGenerator()));
    }

    // ── Bundled packs ────────────────────────────────────────────────

    @Nested
    @DisplayName("Bundled packs")
    class Bundled {

        private final PackLoader loader = loaderFor(null);

        @Test
        @DisplayName("python-api loads with its questions and features")
        void loadsPythonApi() {
            TemplatePack pack = loader.load("python-api");

            assertEquals("python-api", pack.id());
            assertEquals("fastapi", pack.metadata().framework());
            assertEquals(QuestionKind.SELECT, pack.questions().find("database_type").orElseThrow().kind());
            assertEquals(2, pack.manifest().features().size());
            assertEquals("standard", pack.regionGenerator().name());
        }

        @Test
        @DisplayName("node-api loads")
        void loadsNodeApi() {
            assertEquals("typescript", loader.load("node-api").manifest().language());
        }

        @Test
        @DisplayName("a missing pack is reported as not found")
        void missingPack() {
            var ex = assertThrows(PackNotFoundException.class, () -> loader.load("cobol-api"));
            assertEquals("cobol-api", ex.packId());
        }

        @Test
        @DisplayName("ids that could escape the packs root are rejected")
        void invalidId() {
            assertThrows(PackLoadException.class, () -> loader.load("../python-api"));
            assertThrows(PackLoadException.class, () -> loader.load("python_api"));
            assertThrows(PackLoadException.class, () -> loader.load(null));
        }
    }

    // ── Directory packs ──────────────────────────────────────────────

    @Nested
    @DisplayName("Packs directory")
    class Directory {

        @TempDir
        Path root;

        private PackLoader loader;

        @BeforeEach
        void setUp() {
            loader = loaderFor(root);
        }

        @Test
        @DisplayName("loads a pack from the directory")
        void loadsFromDirectory() throws IOException {
            writePack(root, "tiny", TINY.formatted("tiny"));

            TemplatePack pack = loader.load("tiny");

            assertEquals("chi", pack.manifest().framework());
            assertEquals(">=1.22.0", pack.manifest().runtime().rangeFor(null));
        }

        @Test
        @DisplayName("a directory pack shadows the bundled one")
        void shadowsClasspath() throws IOException {
            writePack(root, "python-api", TINY.formatted("python-api"));

            assertEquals("go", loader.load("python-api").manifest().language());
        }

        @Test
        @DisplayName("falls back to the classpath when absent from the directory")
        void fallsBack() {
            assertEquals("python", loader.load("python-api").manifest().language());
        }

        @Test
        @DisplayName("the declared id must match the directory")
        void idMismatch() throws IOException {
            writePack(root, "tiny", TINY.formatted("other"));

            var ex = assertThrows(PackLoadException.class, () -> loader.load("tiny"));
            assertTrue(ex.getMessage().contains("does not match"));
        }

        @Test
        @DisplayName("unknown keys and malformed JSON fail the load")
        void malformedManifest() throws IOException {
            writePack(root, "extra", TINY.formatted("extra").replace("\"name\": \"Tiny\",", "\"name\": \"Tiny\", \"colour\": \"red\","));
            writePack(root, "broken", "{ \"id\": ");

            assertThrows(PackLoadException.class, () -> loader.load("extra"));
            assertThrows(PackLoadException.class, () -> loader.load("broken"));
        }

        @Test
        @DisplayName("an unknown validation tag fails the load")
        void unknownRuleTag() throws IOException {
            writePack(root, "tiny", TINY.formatted("tiny").replace("\"required\"", "\"uppercase\""));

            assertThrows(PackLoadException.class, () -> loader.load("tiny"));
        }

        @Test
        @DisplayName("feature toggles must name defined questions")
        void danglingToggle() throws IOException {
            String json = TINY.formatted("tiny").replace("\"defaults\"",
                    "\"features\": [ { \"feature\": \"cache\", \"toggle\": \"cache_enabled\" } ], \"defaults\"");
            writePack(root, "tiny", json);

            var ex = assertThrows(PackLoadException.class, () -> loader.load("tiny"));
            assertTrue(ex.getMessage().contains("toggle 'cache_enabled' is not defined"));
        }

        @Test
        @DisplayName("missing required manifest fields are listed")
        void missingFields() throws IOException {
            writePack(root, "bare", "{ \"id\": \"bare\", \"version\": \"1.0.0\" }");

            var ex = assertThrows(PackLoadException.class, () -> loader.load("bare"));
            assertTrue(ex.getMessage().contains("name, language, framework, runtime, defaults"));
        }

        @Test
        @DisplayName("defaults must carry every section the builder reads")
        void incompleteDefaults() throws IOException {
            String json = TINY.formatted("tiny")
                    .replace("\"tooling\": { \"testing\": { \"framework\": \"go-test\", \"coverage\": false } },", "")
                    .replace("\"strictness\": \"balanced\", ", "");
            writePack(root, "tiny", json);

            var ex = assertThrows(PackLoadException.class, () -> loader.load("tiny"));
            assertTrue(ex.getMessage().contains("defaults.tooling, defaults.agent.strictness"), ex::getMessage);
        }
    }
}
