package com.questrail.board.core;

import com.questrail.board.api.BoardGroup;
import com.questrail.board.api.BoardItem;
import com.questrail.board.api.BoardState;
import com.questrail.board.api.Connection;
import com.questrail.board.api.Rect;

import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Read-only queries over a {@link BoardState}.
 */
public final class BoardQueries
{
    private BoardQueries() {}

    public static Optional<BoardItem> itemById(BoardState state, String id) {
        return state.items().stream()
                .filter(item -> item.id().equals(id))
                .findFirst();
    }

    /**
     * Returns every connection touching the item, incoming or outgoing.
     */
    public static List<Connection> connectionsFor(BoardState state, String itemId) {
        return state.connections().stream()
                .filter(c -> c.fromId().equals(itemId) || c.toId().equals(itemId))
                .collect(Collectors.toList());
    }

    public static boolean isEmpty(BoardState state) {
        return state.items().isEmpty();
    }

    /**
     * Returns the smallest rectangle enclosing every item, or
     * {@link Optional#empty()} for a board without items.
     */
    public static Optional<Rect> bounds(BoardState state) {
        if (state.items().isEmpty()) {
            return Optional.empty();
        }
        double minX = Double.POSITIVE_INFINITY;
        double minY = Double.POSITIVE_INFINITY;
        double maxX = Double.NEGATIVE_INFINITY;
        double maxY = Double.NEGATIVE_INFINITY;
        for (BoardItem item : state.items()) {
            minX = Math.min(minX, item.x());
            minY = Math.min(minY, item.y());
            maxX = Math.max(maxX, item.x() + item.w());
            maxY = Math.max(maxY, item.y() + item.h());
        }
        return Optional.of(new Rect(minX, minY, maxX - minX, maxY - minY));
    }

    /**
     * Returns the connections with an endpoint that names no item, typically
     * stubs left by decoding a manifest whose items could not all be read.
     */
    public static List<Connection> unresolvedConnections(BoardState state) {
        Set<String> ids = itemIds(state);
        return state.connections().stream()
                .filter(c -> !ids.contains(c.fromId()) || !ids.contains(c.toId()))
                .collect(Collectors.toList());
    }

    /**
     * Returns the groups that contain the item.
     */
    public static List<BoardGroup> groupsContaining(BoardState state, String itemId) {
        return state.groups().stream()
                .filter(g -> g.contains(itemId))
                .collect(Collectors.toList());
    }

    private static Set<String> itemIds(BoardState state) {
        Set<String> ids = new HashSet<>(state.items().size() * 2);
        for (BoardItem item : state.items()) {
            ids.add(item.id());
        }
        return ids;
    }
}
