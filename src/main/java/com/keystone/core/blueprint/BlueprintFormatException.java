package com.keystone.core.blueprint;

import com.keystone.core.KeystoneException;

/**
 * Thrown when a persisted blueprint cannot be read back.
 */
public class BlueprintFormatException extends KeystoneException {

    public BlueprintFormatException(String message) {
        super(message);
    }

    public BlueprintFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
