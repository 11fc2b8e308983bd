package com.questrail.board.core;

import com.questrail.board.api.BoardState;
import com.questrail.board.api.ConnectionType;
import com.questrail.board.api.Viewport;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BoardStateBuilderTests
{
    @Test
    void buildsBoardInInsertionOrder() {
        BoardState state = new BoardStateBuilder()
                .item("a", "r:a", 0, 0, 200, 150, "A")
                .item("b", "r:b", 300, 0, 200, 150, "B")
                .note("n", 0, 200, 100, 50, "todo")
                .connect("ab", "a", "b", ConnectionType.SEQUENCE)
                .group("g", "Pair", "a", "b", "a")
                .viewport(10, 20, 2)
                .build();

        assertEquals(3, state.items().size());
        assertEquals("n", state.items().get(2).id());
        assertTrue(state.items().get(2).note());
        assertEquals(1, state.connections().size());
        assertEquals(List.of("a", "b"), state.groups().get(0).itemIds());
        assertEquals(new Viewport(10, 20, 2), state.viewport());
    }

    @Test
    void duplicateItemIdIsRejected() {
        BoardStateBuilder builder = new BoardStateBuilder().item("a", "r:a", 0, 0, 1, 1, "A");

        assertThrows(IllegalArgumentException.class,
                () -> builder.note("a", 0, 0, 1, 1, "x"));
    }

    @Test
    void connectionEndpointsMustExistAndDiffer() {
        BoardStateBuilder builder = new BoardStateBuilder()
                .item("a", "r:a", 0, 0, 1, 1, "A");

        assertThrows(IllegalArgumentException.class,
                () -> builder.connect("c1", "a", "ghost", ConnectionType.DEFAULT));
        assertThrows(IllegalArgumentException.class,
                () -> builder.connect("c2", "a", "a", ConnectionType.DEFAULT));
    }

    @Test
    void groupMembersMustExist() {
        BoardStateBuilder builder = new BoardStateBuilder()
                .item("a", "r:a", 0, 0, 1, 1, "A");

        assertThrows(IllegalArgumentException.class, () -> builder.group("g", "G", "a", "ghost"));
    }

    @Test
    void fromCopiesAnExistingBoard() {
        BoardState original = new BoardStateBuilder()
                .item("a", "r:a", 0, 0, 1, 1, "A")
                .viewport(1, 1, 1)
                .build();

        BoardState extended = BoardStateBuilder.from(original)
                .item("b", "r:b", 5, 5, 1, 1, "B")
                .connect("ab", "a", "b", ConnectionType.REQUIRES)
                .build();

        assertEquals(1, original.items().size());
        assertEquals(2, extended.items().size());
        assertEquals(original.viewport(), extended.viewport());
    }

    @Test
    void degenerateItemIsRejectedByTheItemItself() {
        assertThrows(IllegalArgumentException.class,
                () -> new BoardStateBuilder().item("a", "r:a", 0, 0, 0, 10, "A"));
    }
}
