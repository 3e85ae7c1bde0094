package com.keystone.core.pack;

import com.keystone.core.document.ManagedRegion;
import com.keystone.core.guidance.RegionGenerator;
import com.keystone.core.interview.QuestionGraph;
import com.keystone.core.model.Blueprint;

import java.util.List;

/**
 * A loaded, validated pack: its manifest, its question graph and the generator that
 * renders its guidance regions.
 */
public record TemplatePack(PackManifest manifest, QuestionGraph questions, RegionGenerator regionGenerator) {

    public String id() {
        return manifest.id();
    }

    public String version() {
        return manifest.version();
    }

    public PackMetadata metadata() {
        return manifest.metadata();
    }

    public List<ManagedRegion> renderRegions(Blueprint blueprint) {
        return regionGenerator.generate(blueprint, manifest.guidance());
    }
}
