package com.questrail.board.manifest.codec.impl;

import com.questrail.board.api.AnchorSide;
import com.questrail.board.api.BoardGroup;
import com.questrail.board.api.Connection;
import com.questrail.board.api.ConnectionStyle;
import com.questrail.board.api.ConnectionType;
import com.questrail.board.api.Viewport;
import com.questrail.board.manifest.model.BoardMarker;
import com.questrail.board.manifest.model.BoardViewport;
import com.questrail.board.manifest.model.ConnectionMetadata;
import com.questrail.board.manifest.model.ExtensionRecord;
import com.questrail.board.manifest.model.ForeignExtension;
import com.questrail.board.manifest.model.GroupMetadata;
import com.questrail.board.manifest.model.Manifest;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class ExtensionRecordsTest
{
    private static final String DOC = "https://example.org/board/7";

    @Test
    void rootRecordsAreMarkerThenViewport()
    {
        List<ExtensionRecord> records = ExtensionRecords.rootRecords(DOC, new Viewport(-50, 25, 1.5));

        assertEquals(2, records.size());
        assertEquals(new BoardMarker(DOC + "/board"), records.get(0));
        assertEquals(new BoardViewport(DOC + "/viewport", -50.0, 25.0, 1.5), records.get(1));
    }

    @Test
    void connectionMetadataOnlyWhenSomethingToCarry()
    {
        Connection plain = Connection.of("c1", "a", "b", ConnectionType.REQUIRES);
        assertTrue(ExtensionRecords.connectionMetadata(plain).isEmpty());

        Connection styled = plain
                .withAnchors(AnchorSide.RIGHT, AnchorSide.LEFT)
                .withAppearance(ConnectionStyle.ELBOW, "#ff0000");
        ConnectionMetadata meta = ExtensionRecords.connectionMetadata(styled).orElseThrow();

        assertEquals("c1/connection-meta", meta.id());
        assertEquals("R", meta.fromAnchor());
        assertEquals("L", meta.toAnchor());
        assertEquals("elbow", meta.style());
        assertEquals("#ff0000", meta.color());
        assertNull(meta.label());
    }

    @Test
    void connectionMetadataAppliesBack()
    {
        Connection decoded = Connection.of("c1", "a", "b", ConnectionType.REQUIRES);
        List<ExtensionRecord> service = List.of(
                new ConnectionMetadata("c1/connection-meta", "B", "T", "curved", "blue", "depends on"));

        Connection applied = ExtensionRecords.applyConnectionMetadata(decoded, service);

        assertEquals(AnchorSide.BOTTOM, applied.fromAnchor());
        assertEquals(AnchorSide.TOP, applied.toAnchor());
        assertEquals(ConnectionStyle.CURVED, applied.style());
        assertEquals("blue", applied.color());
        assertEquals("depends on", applied.label());
        assertEquals(ConnectionType.REQUIRES, applied.type());
    }

    @Test
    void unknownAnchorAndStyleStringsAreIgnored()
    {
        Connection decoded = Connection.of("c1", "a", "b", ConnectionType.DEFAULT);
        List<ExtensionRecord> service = List.of(
                new ConnectionMetadata("c1/connection-meta", "X", null, "zigzag", null, null));

        Connection applied = ExtensionRecords.applyConnectionMetadata(decoded, service);

        assertNull(applied.fromAnchor());
        assertNull(applied.toAnchor());
        assertNull(applied.style());
    }

    @Test
    void groupMetadataCarriesColorOnly()
    {
        assertTrue(ExtensionRecords.groupMetadata("r", BoardGroup.of("g", "G", List.of())).isEmpty());

        GroupMetadata meta = ExtensionRecords
                .groupMetadata("r", new BoardGroup("g", "G", List.of(), "#00ff00"))
                .orElseThrow();
        assertEquals("r/meta", meta.id());
        assertEquals("#00ff00", ExtensionRecords.readGroupColor(List.of(meta)).orElseThrow());
    }

    @Test
    void missingViewportReadsAsDefault()
    {
        assertEquals(Viewport.DEFAULT, ExtensionRecords.readViewport(List.of()));
        assertEquals(Viewport.DEFAULT, ExtensionRecords.readViewport(List.of(new BoardMarker(DOC + "/board"))));
    }

    @Test
    void viewportFieldsDefaultIndividually()
    {
        Viewport v = ExtensionRecords.readViewport(List.of(new BoardViewport("v", 12.0, null, null)));
        assertEquals(new Viewport(12, 0, 1), v);
    }

    @Test
    void nonPositiveOrNonFiniteZoomReadsAsOne()
    {
        assertEquals(1.0, ExtensionRecords.readViewport(List.of(new BoardViewport("v", 0.0, 0.0, 0.0))).zoom());
        assertEquals(1.0, ExtensionRecords.readViewport(List.of(new BoardViewport("v", 0.0, 0.0, -2.0))).zoom());
        assertEquals(1.0, ExtensionRecords.readViewport(List.of(new BoardViewport("v", 0.0, 0.0, Double.NaN))).zoom());
    }

    @Test
    void boardDiscoveryRequiresTheMarker()
    {
        Manifest marked = new Manifest(DOC, null, null, null, null, null,
                List.of(new ForeignExtension("x", "Other"), new BoardMarker(DOC + "/board")));
        Manifest viewportOnly = new Manifest(DOC, null, null, null, null, null,
                List.of(new BoardViewport(DOC + "/viewport", 0.0, 0.0, 1.0)));

        assertTrue(ExtensionRecords.isBoard(marked));
        assertFalse(ExtensionRecords.isBoard(viewportOnly));
    }
}
