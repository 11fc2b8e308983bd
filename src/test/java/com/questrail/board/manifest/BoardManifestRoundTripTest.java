package com.questrail.board.manifest;

import com.questrail.board.api.AnchorSide;
import com.questrail.board.api.BoardGroup;
import com.questrail.board.api.BoardItem;
import com.questrail.board.api.BoardState;
import com.questrail.board.api.Connection;
import com.questrail.board.api.ConnectionStyle;
import com.questrail.board.api.ConnectionType;
import com.questrail.board.api.Viewport;
import com.questrail.board.manifest.model.Manifest;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Board -> manifest -> board through the document model, without JSON.
 */
final class BoardManifestRoundTripTest
{
    private final BoardManifestCodec codec = new BoardManifestCodec();

    @Test
    void emptyBoardRoundTripsToEmptyBoard()
    {
        BoardState empty = new BoardState(List.of(), List.of(), List.of(), new Viewport(0, 0, 1));

        BoardState decoded = codec.decode(codec.encode(empty, "doc1", "Untitled"));

        assertEquals(empty, decoded);
    }

    @Test
    void twoItemSequenceWithGroup()
    {
        BoardItem a = BoardItem.resource("A", "https://example.org/canvas/a", 0, 0, 200, 150, "Canvas", "A");
        BoardItem b = BoardItem.resource("B", "https://example.org/canvas/b", 300, 0, 200, 150, "Canvas", "B");
        BoardState state = new BoardState(
                List.of(a, b),
                List.of(Connection.of("A-B", "A", "B", ConnectionType.SEQUENCE)),
                List.of(BoardGroup.of("g", "Pair", List.of("A", "B"))),
                Viewport.DEFAULT);

        BoardState decoded = codec.decode(codec.encode(state, "https://example.org/board/2", "Scenario"));

        assertEquals(2, decoded.items().size());
        assertEquals(a.bounds(), decoded.items().get(0).bounds());
        assertEquals(b.bounds(), decoded.items().get(1).bounds());

        assertEquals(1, decoded.connections().size());
        Connection connection = decoded.connections().get(0);
        assertEquals(ConnectionType.SEQUENCE, connection.type());
        assertEquals("A", connection.fromId());
        assertEquals("B", connection.toId());

        assertEquals(1, decoded.groups().size());
        assertEquals(List.of("A", "B"), decoded.groups().get(0).itemIds());
    }

    // Decoded items list placed resources before notes.
    @Test
    void fullBoardRoundTripsExactly()
    {
        BoardState state = new BoardState(
                List.of(
                        BoardItem.resource("i1", "https://example.org/canvas/1", 10, 20, 300, 200, "Canvas", "Map"),
                        BoardItem.resource("i2", "https://example.org/canvas/2", 10, 400, 300, 200, "Canvas", "Survey"),
                        BoardItem.note("n1", 400, 20, 150, 90, "Compare with the 1820 survey")),
                List.of(
                        Connection.of("c1", "i1", "i2", ConnectionType.SIMILAR_TO)
                                .withAnchors(AnchorSide.BOTTOM, AnchorSide.TOP)
                                .withAppearance(ConnectionStyle.ELBOW, "#aa0000"),
                        Connection.of("c2", "n1", "i1", ConnectionType.REFERENCES).withLabel("about")),
                List.of(new BoardGroup("g1", "Maps", List.of("i1", "i2"), "#eeeeff")),
                new Viewport(-120, 35.5, 0.75));

        BoardState decoded = codec.decode(codec.encode(state, "https://example.org/board/3", "Survey board"));

        assertEquals(state.items(), decoded.items());
        assertEquals(state.connections(), decoded.connections());
        assertEquals(state.groups(), decoded.groups());
        assertEquals(state.viewport(), decoded.viewport());
    }

    @Test
    void subPixelItemSurvivesWithinOnePixel()
    {
        BoardState state = new BoardState(
                List.of(BoardItem.resource("i1", "r:1", 10, 10, 0.4, 100, "Canvas", "Sliver")),
                List.of(), List.of(), Viewport.DEFAULT);

        BoardState decoded = codec.decode(codec.encode(state, "doc", "T"));

        assertEquals(1, decoded.items().size());
        BoardItem item = decoded.items().get(0);
        assertEquals("r:1", item.resourceId());
        assertTrue(Math.abs(item.w() - 0.4) <= 1.0);
        assertEquals(100, item.h());
    }

    @Test
    void connectionsAndGroupsOnNotesSurvive()
    {
        BoardState state = new BoardState(
                List.of(
                        BoardItem.resource("i1", "r:1", 0, 0, 100, 100, "Canvas", "One"),
                        BoardItem.note("n1", 200, 0, 80, 60, "see left")),
                List.of(Connection.of("c1", "n1", "i1", ConnectionType.REFERENCES)),
                List.of(BoardGroup.of("g1", "G", List.of("i1", "n1"))),
                Viewport.DEFAULT);

        BoardState decoded = codec.decode(codec.encode(state, "doc", "T"));

        assertEquals("n1", decoded.items().get(1).resourceId());
        assertEquals(state.connections(), decoded.connections());
        assertEquals(List.of("i1", "n1"), decoded.groups().get(0).itemIds());
    }

    @Test
    void reEncodingIsStable()
    {
        BoardState state = new BoardState(
                List.of(BoardItem.resource("i1", "r:1", 0, 0, 10, 10, "Canvas", "One")),
                List.of(),
                List.of(BoardGroup.of("g1", "G", List.of("i1"))),
                Viewport.DEFAULT);

        Manifest first = codec.encode(state, "doc", "T");
        Manifest second = codec.encode(codec.decode(first), "doc", "T");

        assertEquals(first, second);
    }
}
