package com.keystone.core.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "keystone")
public class KeystoneProperties {

    private String blueprintFile = "keystone.blueprint.json";
    private String guideFile = "AGENT.md";
    private String markerNamespace = "keystone:managed";
    private String generatorVersion = "0.1.0";
    private final Packs packs = new Packs();

    public String getBlueprintFile() {
        return blueprintFile;
    }

    public void setBlueprintFile(String blueprintFile) {
        this.blueprintFile = blueprintFile;
    }

    public String getGuideFile() {
        return guideFile;
    }

    public void setGuideFile(String guideFile) {
        this.guideFile = guideFile;
    }

    public String getMarkerNamespace() {
        return markerNamespace;
    }

    public void setMarkerNamespace(String markerNamespace) {
        this.markerNamespace = markerNamespace;
    }

    public String getGeneratorVersion() {
        return generatorVersion;
    }

    public void setGeneratorVersion(String generatorVersion) {
        this.generatorVersion = generatorVersion;
    }

    public Packs getPacks() {
        return packs;
    }

    /**
     * Where template packs are looked up. Packs found under {@code directory} shadow
     * the ones bundled on the classpath.
     */
    public static class Packs {

        private String directory = "";

        public String getDirectory() {
            return directory;
        }

        public void setDirectory(String directory) {
            this.directory = directory;
        }

        public boolean hasDirectory() {
            return directory != null && !directory.isBlank();
        }
    }
}
