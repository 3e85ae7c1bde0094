package com.keystone.core.pack;

import com.keystone.core.KeystoneException;

public class PackNotFoundException extends KeystoneException {

    private final String packId;

    public PackNotFoundException(String packId) {
        super("Template pack not found: " + packId);
        this.packId = packId;
    }

    public String packId() {
        return packId;
    }
}
