package com.keystone.core.document;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ManagedDocumentTest {

    private final RegionMarkers markers = RegionMarkers.defaults();

    @Test
    void renderReproducesInputExactly() {
        String text = "# Doc\r\n\r\n" + markers.start("a") + "\r\nbody\r\n" + markers.end("a") + "\r\ntail";

        ManagedDocument doc = ManagedDocument.parse(text, markers);

        assertEquals(text, doc.render());
        assertEquals("\r\n", doc.lineSeparator());
        assertEquals(3, doc.segments().size());
        assertEquals("a", doc.regions().get(0).name());
        assertEquals("body\r\n", doc.regions().get(0).content());
        assertEquals(3, doc.regions().get(0).lineNumber());
    }

    @Test
    void plainTextIsOneLiteral() {
        ManagedDocument doc = ManagedDocument.parse("no markers here\n", markers);

        assertEquals(List.of(new ManagedDocument.Literal("no markers here\n")), doc.segments());
        assertTrue(doc.regions().isEmpty());
        assertEquals("\n", doc.lineSeparator());
    }

    @Test
    void markerSyntax() {
        assertEquals("<!-- keystone:managed:start:quickstart -->", markers.start("quickstart"));
        assertTrue(markers.match("<!--keystone:managed:end:v1.2_x-->").isPresent());
        assertTrue(markers.match("<!-- keystone:managed:start:-bad -->").isEmpty());
        assertTrue(markers.match("text <!-- keystone:managed:start:a -->").isEmpty());
        assertThrows(IllegalArgumentException.class, () -> new ManagedRegion("has space", ""));
        assertThrows(IllegalArgumentException.class, () -> new RegionMarkers(" "));
    }
}
