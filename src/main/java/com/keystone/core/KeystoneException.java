package com.keystone.core;

/**
 * Base class for all Keystone failures that are caused by caller input or caller data.
 * None of them are transient, so nothing in Keystone retries on them.
 */
public class KeystoneException extends RuntimeException {
    public KeystoneException(String message) {
        super(message);
    }

    public KeystoneException(String message, Throwable cause) {
        super(message, cause);
    }
}
