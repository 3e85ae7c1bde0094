package com.keystone.core.document;

import com.keystone.core.KeystoneException;

/**
 * Thrown when managed-region markers are nested, mismatched, duplicated or unterminated.
 * The document is left untouched.
 */
public class MalformedDocumentException extends KeystoneException {

    private final String marker;
    private final int line;

    public MalformedDocumentException(String message, String marker, int line) {
        super("Line " + line + ": " + message);
        this.marker = marker;
        this.line = line;
    }

    /** The offending marker line as it appears in the document. */
    public String marker() {
        return marker;
    }

    /** One-based line number of the offending marker. */
    public int line() {
        return line;
    }
}
