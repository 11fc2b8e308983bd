package com.questrail.board.manifest.json;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.questrail.board.api.BoardGroup;
import com.questrail.board.api.BoardItem;
import com.questrail.board.api.BoardState;
import com.questrail.board.api.Connection;
import com.questrail.board.api.ConnectionType;
import com.questrail.board.api.Viewport;
import com.questrail.board.manifest.codec.impl.DefaultBoardManifestEncoder;
import com.questrail.board.manifest.model.Manifest;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class ManifestJsonWriterTest
{
    private static final String DOC = "https://example.org/board/1";

    private final ManifestJsonWriter writer = new ManifestJsonWriter();
    private final DefaultBoardManifestEncoder encoder = new DefaultBoardManifestEncoder();

    @Test
    void rootCarriesContextAndRequiredFields()
    {
        ObjectNode root = writer.toTree(encoder.encode(BoardState.empty(), DOC, "Untitled"));

        assertEquals(ManifestJsonWriter.PRESENTATION_CONTEXT, root.path("@context").asText());
        assertEquals(DOC, root.path("id").asText());
        assertEquals("Manifest", root.path("type").asText());
        assertEquals("Untitled", root.path("label").path("en").path(0).asText());
        assertEquals("individuals", root.path("behavior").path(0).asText());
    }

    @Test
    void emptyOptionalContainersAreLeftOut()
    {
        ObjectNode root = writer.toTree(encoder.encode(BoardState.empty(), DOC, "Untitled"));

        assertFalse(root.has("structures"));
        assertFalse(root.has("viewingDirection"));
        JsonNode surface = root.path("items").path(0);
        assertFalse(surface.has("annotations"));
        assertTrue(surface.path("items").path(0).path("items").isArray());

        Manifest bare = new Manifest("m", null, null, null, null, null, null);
        ObjectNode bareRoot = writer.toTree(bare);
        assertFalse(bareRoot.has("service"));
        assertFalse(bareRoot.has("behavior"));
        assertTrue(bareRoot.path("items").isArray());
        assertTrue(bareRoot.path("label").isObject());
    }

    @Test
    void annotationsAndRecordsHaveTheirWireShape()
    {
        BoardState state = new BoardState(
                List.of(
                        BoardItem.resource("a", "r:a", 1, 2, 3, 4, "Canvas", "A"),
                        BoardItem.resource("b", "r:b", 10, 2, 3, 4, "Canvas", "")),
                List.of(Connection.of("c", "a", "b", ConnectionType.SEQUENCE).withLabel("then")),
                List.of(new BoardGroup("g", "G", List.of("a"), "red")),
                new Viewport(1, 2, 3));

        ObjectNode root = writer.toTree(encoder.encode(state, DOC, "B"));

        JsonNode painting = root.path("items").path(0).path("items").path(0).path("items");
        assertEquals("painting", painting.path(0).path("motivation").asText());
        assertEquals("SpecificResource", painting.path(0).path("body").path("type").asText());
        assertEquals("r:a", painting.path(0).path("body").path("source").asText());
        assertEquals(DOC + "/surface#xywh=1,2,3,4", painting.path(0).path("target").asText());
        assertFalse(painting.path(1).path("body").has("label"));

        JsonNode link = root.path("items").path(0).path("annotations").path(0).path("items").path(0);
        assertEquals("r:a", link.path("target").asText());
        assertEquals("sequence", link.path("body").path("label").path("en").path(0).asText());
        JsonNode meta = link.path("service").path(0);
        assertEquals("ConnectionMetadata", meta.path("type").asText());
        assertEquals("then", meta.path("label").asText());
        assertFalse(meta.has("color"));

        JsonNode range = root.path("structures").path(0);
        assertEquals("Range", range.path("type").asText());
        assertEquals("Canvas", range.path("items").path(0).path("type").asText());
        assertEquals("red", range.path("service").path(0).path("color").asText());

        JsonNode viewport = root.path("service").path(1);
        assertEquals("BoardViewport", viewport.path("type").asText());
        assertEquals(3.0, viewport.path("zoom").asDouble());
        assertEquals("BoardMarker", root.path("service").path(0).path("type").asText());
    }

    @Test
    void streamAndStringOutputAgree()
    {
        Manifest manifest = encoder.encode(BoardState.empty(), DOC, "Untitled");
        ByteArrayOutputStream out = new ByteArrayOutputStream();

        writer.write(manifest, out);

        assertEquals(writer.write(manifest), out.toString(StandardCharsets.UTF_8));
    }
}
