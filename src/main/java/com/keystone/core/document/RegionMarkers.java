package com.keystone.core.document;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Start and end marker syntax for managed regions:
 * <pre>
 * &lt;!-- keystone:managed:start:NAME --&gt;
 * &lt;!-- keystone:managed:end:NAME --&gt;
 * </pre>
 * A marker is recognized only when it is the whole line, surrounding blanks aside.
 */
public final class RegionMarkers {

    public static final String DEFAULT_NAMESPACE = "keystone:managed";

    private static final String NAME = "[A-Za-z0-9][A-Za-z0-9._-]*";
    private static final Pattern VALID_NAME = Pattern.compile("^" + NAME + "$");

    private final String namespace;
    private final Pattern markerLine;

    public RegionMarkers(String namespace) {
        if (namespace == null || namespace.isBlank()) {
            throw new IllegalArgumentException("Marker namespace must not be blank");
        }
        this.namespace = namespace;
        this.markerLine = Pattern.compile(
                "^[ \\t]*<!--[ \\t]*" + Pattern.quote(namespace) + ":(start|end):(" + NAME + ")[ \\t]*-->[ \\t]*$");
    }

    public static RegionMarkers defaults() {
        return new RegionMarkers(DEFAULT_NAMESPACE);
    }

    public static boolean isValidName(String name) {
        return VALID_NAME.matcher(name).matches();
    }

    public String namespace() {
        return namespace;
    }

    public String start(String name) {
        return "<!-- " + namespace + ":start:" + name + " -->";
    }

    public String end(String name) {
        return "<!-- " + namespace + ":end:" + name + " -->";
    }

    /** Parses a line with its terminator already removed. */
    public Optional<Marker> match(String line) {
        Matcher m = markerLine.matcher(line);
        if (!m.matches()) {
            return Optional.empty();
        }
        return Optional.of(new Marker(m.group(1).equals("start"), m.group(2)));
    }

    public record Marker(boolean start, String name) {}
}
