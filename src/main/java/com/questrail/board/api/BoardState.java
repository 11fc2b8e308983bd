package com.questrail.board.api;

import java.util.List;
import java.util.Objects;

/**
 * BoardState
 * -----------------------------------------------------------------------------
 * The aggregate root of an editable board: items, connections, groups and the
 * current viewport.
 *
 * <p>Instances are immutable. Editing collaborators produce new values; the
 * manifest codec only ever reads a {@code BoardState} or returns a fresh one.
 * Callers that edit concurrently must serialize their edits before encoding.</p>
 */
public record BoardState(
        List<BoardItem> items,
        List<Connection> connections,
        List<BoardGroup> groups,
        Viewport viewport
)
{
    private static final BoardState EMPTY =
            new BoardState(List.of(), List.of(), List.of(), Viewport.DEFAULT);

    public BoardState {
        items = List.copyOf(Objects.requireNonNull(items, "items"));
        connections = List.copyOf(Objects.requireNonNull(connections, "connections"));
        groups = List.copyOf(Objects.requireNonNull(groups, "groups"));
        Objects.requireNonNull(viewport, "viewport");
    }

    /**
     * Returns a board with no items, connections or groups at the default viewport.
     */
    public static BoardState empty() {
        return EMPTY;
    }

    /**
     * Returns an empty board at the given viewport.
     */
    public static BoardState empty(Viewport viewport) {
        return new BoardState(List.of(), List.of(), List.of(), viewport);
    }

    public BoardState withViewport(Viewport viewport) {
        return new BoardState(items, connections, groups, viewport);
    }
}
