package com.keystone.core.document;

import java.util.Objects;

/**
 * A named span of a guidance document owned by the generator.
 *
 * @param name    region name; letters, digits, dot, underscore and hyphen
 * @param content text between the markers
 */
public record ManagedRegion(String name, String content) {

    public ManagedRegion {
        Objects.requireNonNull(name, "name");
        if (!RegionMarkers.isValidName(name)) {
            throw new IllegalArgumentException("Invalid region name '" + name + "'");
        }
        content = content == null ? "" : content;
    }
}
