package com.keystone.core.pack;

/**
 * Identity of a template pack, as shown by {@code keystone packs}.
 */
public record PackMetadata(
    String id,
    String version,
    String name,
    String description,
    String language,
    String framework
) {}
