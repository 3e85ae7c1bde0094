package com.keystone.core.guidance;

import com.keystone.core.document.ManagedRegion;
import com.keystone.core.model.Blueprint;
import com.keystone.core.pack.GuidanceSpec;

import java.util.List;

/**
 * Derives the managed regions of a guidance document from a blueprint.
 * Implementations are registered as Spring beans and selected by the pack's
 * {@code guidance.generator} name.
 */
public interface RegionGenerator {

    String name();

    /** Regions in the order they should be appended to a new document. Must be deterministic. */
    List<ManagedRegion> generate(Blueprint blueprint, GuidanceSpec guidance);
}
