package com.keystone.core.document;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Replaces the content of managed regions in a text document, leaving everything outside
 * the markers byte-for-byte untouched.
 * <ul>
 *   <li>a region present in both the document and the fresh set gets the fresh content</li>
 *   <li>a region only in the document is preserved verbatim</li>
 *   <li>a region only in the fresh set is appended at the end, in fresh-set order</li>
 * </ul>
 * Fresh content is normalized to end with a line break, so merging the output of a merge
 * with the same regions again yields identical text.
 */
public class ManagedDocumentMerger {

    private static final Logger log = LoggerFactory.getLogger(ManagedDocumentMerger.class);

    private static final Pattern BARE_LF = Pattern.compile("(?<!\r)\n");

    private final RegionMarkers markers;

    public ManagedDocumentMerger(RegionMarkers markers) {
        this.markers = markers;
    }

    public ManagedDocumentMerger() {
        this(RegionMarkers.defaults());
    }

    public RegionMarkers markers() {
        return markers;
    }

    public String merge(String existing, List<ManagedRegion> fresh) {
        return mergeDetailed(existing, fresh).text();
    }

    /**
     * @throws MalformedDocumentException if the existing document's markers are broken
     * @throws IllegalArgumentException   if the fresh set names a region twice or its
     *                                    content contains a marker line
     */
    public MergeResult mergeDetailed(String existing, List<ManagedRegion> fresh) {
        String source = existing == null ? "" : existing;
        ManagedDocument document = ManagedDocument.parse(source, markers);
        String eol = document.lineSeparator();
        Map<String, String> contents = freshContents(fresh, eol);

        var out = new StringBuilder(source.length() + 256);
        var replaced = new ArrayList<String>();
        var preserved = new ArrayList<String>();
        Set<String> consumed = new HashSet<>();

        for (ManagedDocument.Segment segment : document.segments()) {
            if (segment instanceof ManagedDocument.Region region && contents.containsKey(region.name())) {
                out.append(region.startLine())
                   .append(contents.get(region.name()))
                   .append(region.endLine());
                replaced.add(region.name());
                consumed.add(region.name());
            } else {
                if (segment instanceof ManagedDocument.Region region) {
                    preserved.add(region.name());
                }
                out.append(segment.raw());
            }
        }

        var appended = new ArrayList<String>();
        for (Map.Entry<String, String> entry : contents.entrySet()) {
            if (consumed.contains(entry.getKey())) {
                continue;
            }
            if (out.length() > 0) {
                if (out.charAt(out.length() - 1) != '\n') {
                    out.append(eol);
                }
                out.append(eol);
            }
            out.append(markers.start(entry.getKey())).append(eol)
               .append(entry.getValue())
               .append(markers.end(entry.getKey())).append(eol);
            appended.add(entry.getKey());
        }

        log.debug("Merged document: replaced={}, preserved={}, appended={}", replaced, preserved, appended);
        return new MergeResult(out.toString(), replaced, preserved, appended);
    }

    private Map<String, String> freshContents(List<ManagedRegion> fresh, String eol) {
        var contents = new LinkedHashMap<String, String>();
        for (ManagedRegion region : fresh) {
            if (contents.containsKey(region.name())) {
                throw new IllegalArgumentException("Region '" + region.name() + "' supplied twice");
            }
            String content = normalize(region.content(), eol);
            for (String line : ManagedDocument.splitLines(content)) {
                if (markers.match(ManagedDocument.stripTerminator(line)).isPresent()) {
                    throw new IllegalArgumentException(
                            "Content of region '" + region.name() + "' contains a marker line");
                }
            }
            contents.put(region.name(), content);
        }
        return contents;
    }

    static String normalize(String content, String eol) {
        if (content.isEmpty()) {
            return content;
        }
        String text = eol.equals("\r\n") ? BARE_LF.matcher(content).replaceAll("\r\n") : content;
        return text.endsWith("\n") ? text : text + eol;
    }
}
