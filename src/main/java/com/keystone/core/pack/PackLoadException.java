package com.keystone.core.pack;

import com.keystone.core.KeystoneException;

/**
 * Thrown when a pack exists but cannot be used: invalid id, unparseable manifest,
 * id mismatch or an invalid question graph.
 */
public class PackLoadException extends KeystoneException {

    private final String packId;

    public PackLoadException(String packId, String message) {
        super("Failed to load pack '" + packId + "': " + message);
        this.packId = packId;
    }

    public PackLoadException(String packId, String message, Throwable cause) {
        super("Failed to load pack '" + packId + "': " + message, cause);
        this.packId = packId;
    }

    public String packId() {
        return packId;
    }
}
