package com.keystone.core.document;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Optional;

/**
 * A document split into literal spans and managed regions. Concatenating the raw text of
 * every segment reproduces the input exactly, line terminators included.
 */
public final class ManagedDocument {

    public interface Segment {
        String raw();
    }

    public record Literal(String text) implements Segment {
        @Override
        public String raw() {
            return text;
        }
    }

    /**
     * @param startLine marker line including its terminator
     * @param endLine   marker line including its terminator, if any
     * @param lineNumber one-based line of the start marker
     */
    public record Region(String name, String startLine, String content, String endLine, int lineNumber)
            implements Segment {
        @Override
        public String raw() {
            return startLine + content + endLine;
        }
    }

    private final List<Segment> segments;
    private final String lineSeparator;

    private ManagedDocument(List<Segment> segments, String lineSeparator) {
        this.segments = List.copyOf(segments);
        this.lineSeparator = lineSeparator;
    }

    /**
     * @throws MalformedDocumentException on nested, mismatched, duplicated, stray or
     *                                    unterminated markers
     */
    public static ManagedDocument parse(String text, RegionMarkers markers) {
        var segments = new ArrayList<Segment>();
        var seen = new HashMap<String, Integer>();
        var literal = new StringBuilder();

        String openName = null;
        String openLine = null;
        int openNumber = 0;
        var content = new StringBuilder();

        int lineNumber = 0;
        for (String line : splitLines(text)) {
            lineNumber++;
            String bare = stripTerminator(line);
            Optional<RegionMarkers.Marker> marker = markers.match(bare);

            if (openName == null) {
                if (marker.isEmpty()) {
                    literal.append(line);
                } else if (marker.get().start()) {
                    String name = marker.get().name();
                    Integer previous = seen.get(name);
                    if (previous != null) {
                        throw new MalformedDocumentException(
                                "Duplicate region '" + name + "' (first defined at line " + previous + ")",
                                bare, lineNumber);
                    }
                    flush(literal, segments);
                    openName = name;
                    openLine = line;
                    openNumber = lineNumber;
                    content.setLength(0);
                } else {
                    throw new MalformedDocumentException(
                            "End marker for '" + marker.get().name() + "' without a matching start",
                            bare, lineNumber);
                }
            } else if (marker.isEmpty()) {
                content.append(line);
            } else if (marker.get().start()) {
                throw new MalformedDocumentException(
                        "Start marker for '" + marker.get().name() + "' inside region '" + openName
                                + "' opened at line " + openNumber,
                        bare, lineNumber);
            } else if (!marker.get().name().equals(openName)) {
                throw new MalformedDocumentException(
                        "End marker for '" + marker.get().name() + "' does not match open region '"
                                + openName + "'",
                        bare, lineNumber);
            } else {
                segments.add(new Region(openName, openLine, content.toString(), line, openNumber));
                seen.put(openName, openNumber);
                openName = null;
            }
        }

        if (openName != null) {
            throw new MalformedDocumentException(
                    "Region '" + openName + "' is never closed", stripTerminator(openLine), openNumber);
        }
        flush(literal, segments);
        return new ManagedDocument(segments, detectLineSeparator(text));
    }

    public List<Segment> segments() {
        return segments;
    }

    public List<Region> regions() {
        return segments.stream()
                .filter(Region.class::isInstance)
                .map(Region.class::cast)
                .toList();
    }

    /** {@code \r\n} when the document's first line break is CRLF, otherwise {@code \n}. */
    public String lineSeparator() {
        return lineSeparator;
    }

    public String render() {
        var out = new StringBuilder();
        segments.forEach(s -> out.append(s.raw()));
        return out.toString();
    }

    /** Splits after every {@code \n}, keeping terminators attached to their line. */
    static List<String> splitLines(String text) {
        var lines = new ArrayList<String>();
        int start = 0;
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '\n') {
                lines.add(text.substring(start, i + 1));
                start = i + 1;
            }
        }
        if (start < text.length()) {
            lines.add(text.substring(start));
        }
        return lines;
    }

    static String stripTerminator(String line) {
        String bare = line.endsWith("\n") ? line.substring(0, line.length() - 1) : line;
        return bare.endsWith("\r") ? bare.substring(0, bare.length() - 1) : bare;
    }

    static String detectLineSeparator(String text) {
        int lf = text.indexOf('\n');
        return lf > 0 && text.charAt(lf - 1) == '\r' ? "\r\n" : "\n";
    }

    private static void flush(StringBuilder literal, List<Segment> segments) {
        if (literal.length() > 0) {
            segments.add(new Literal(literal.toString()));
            literal.setLength(0);
        }
    }
}
