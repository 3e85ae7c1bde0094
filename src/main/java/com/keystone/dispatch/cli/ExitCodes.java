package com.keystone.dispatch.cli;

import com.keystone.core.blueprint.BlueprintFormatException;
import com.keystone.core.document.MalformedDocumentException;
import com.keystone.core.interview.IncompleteAnswerException;
import com.keystone.core.interview.InvalidAnswerException;
import com.keystone.core.pack.PackNotFoundException;

/**
 * Process exit codes shared by all commands.
 */
public final class ExitCodes {

    private ExitCodes() {}

    public static final int OK = 0;
    public static final int FAILURE = 1;
    public static final int VIOLATIONS = 2;
    public static final int PACK_NOT_FOUND = 3;
    public static final int MALFORMED_DOCUMENT = 4;
    public static final int INVALID_ANSWERS = 5;

    public static int forException(Throwable e) {
        if (e instanceof PackNotFoundException) {
            return PACK_NOT_FOUND;
        }
        if (e instanceof MalformedDocumentException || e instanceof BlueprintFormatException) {
            return MALFORMED_DOCUMENT;
        }
        if (e instanceof IncompleteAnswerException || e instanceof InvalidAnswerException) {
            return INVALID_ANSWERS;
        }
        return FAILURE;
    }
}
