package com.keystone.core.document;

import java.util.List;

/**
 * Outcome of a merge.
 *
 * @param text      the merged document
 * @param replaced  regions whose content was replaced, in document order
 * @param preserved regions kept verbatim because no fresh content was supplied
 * @param appended  regions that did not exist and were added at the end
 */
public record MergeResult(
    String text,
    List<String> replaced,
    List<String> preserved,
    List<String> appended
) {

    public MergeResult {
        replaced = List.copyOf(replaced);
        preserved = List.copyOf(preserved);
        appended = List.copyOf(appended);
    }

    public boolean changed(String original) {
        return !text.equals(original);
    }
}
