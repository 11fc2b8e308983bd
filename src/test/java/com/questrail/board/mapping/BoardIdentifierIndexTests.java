package com.questrail.board.mapping;

import com.questrail.board.api.BoardItem;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BoardIdentifierIndexTests
{
    private static BoardItem item(String id, String resourceId) {
        return BoardItem.resource(id, resourceId, 0, 0, 10, 10, "Canvas", id);
    }

    @Test
    void providesBidirectionalLookup() {
        IdentifierIndex index = BoardIdentifierIndex.of(List.of(
                item("s1", "https://example.org/canvas/1"),
                item("s2", "https://example.org/canvas/2")));

        assertEquals("https://example.org/canvas/1", index.toResourceId("s1"));
        assertEquals("s2", index.toSessionId("https://example.org/canvas/2"));
        assertTrue(index.containsSession("s1"));
        assertTrue(index.containsResource("https://example.org/canvas/2"));
        assertEquals(2, index.size());
    }

    @Test
    void unknownIdsFallBackUnchanged() {
        IdentifierIndex index = BoardIdentifierIndex.of(List.of(item("s1", "r1")));

        assertEquals("nope", index.toResourceId("nope"));
        assertEquals("https://elsewhere.org/x", index.toSessionId("https://elsewhere.org/x"));
        assertFalse(index.containsSession("nope"));
        assertFalse(index.containsResource("https://elsewhere.org/x"));
    }

    @Test
    void firstRegistrationWinsForSharedResource() {
        BoardIdentifierIndex index = new BoardIdentifierIndex();
        index.register(item("first", "r"));
        index.register(item("second", "r"));

        assertEquals("first", index.toSessionId("r"));
        assertEquals("r", index.toResourceId("second"));
        assertEquals(2, index.size());
    }

    @Test
    void notesResolveThroughTheirOwnId() {
        BoardIdentifierIndex index = new BoardIdentifierIndex();
        index.register(BoardItem.note("n1", 0, 0, 50, 50, "text"));

        assertEquals("n1", index.toResourceId("n1"));
        assertTrue(index.containsResource("n1"));
    }
}
