package com.questrail.board.core;

import com.questrail.board.api.BoardGroup;
import com.questrail.board.api.BoardItem;
import com.questrail.board.api.BoardState;
import com.questrail.board.api.Connection;
import com.questrail.board.api.ConnectionType;
import com.questrail.board.api.Viewport;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * BoardStateBuilder
 * -----------------------------------------------------------------------------
 * Builder for constructing {@link BoardState} instances incrementally.
 *
 * <h2>Purpose</h2>
 * This class exists to:
 * <ul>
 *   <li>Enforce the cross-entity invariants a single record cannot check</li>
 *   <li>Provide readable, intention-revealing APIs for editors and tests</li>
 *   <li>Start from an existing board and derive a new one</li>
 * </ul>
 *
 * <h2>Validation</h2>
 * <ul>
 *   <li>Item session ids are unique</li>
 *   <li>A connection joins two different items already added to the builder</li>
 *   <li>Group members name items already added to the builder</li>
 * </ul>
 * Violations throw {@link IllegalArgumentException}. Ids are supplied by the
 * caller; the builder never generates them.
 */
public final class BoardStateBuilder
{
    private final Map<String, BoardItem> items = new LinkedHashMap<>();
    private final List<Connection> connections = new ArrayList<>();
    private final List<BoardGroup> groups = new ArrayList<>();
    private Viewport viewport = Viewport.DEFAULT;

    public BoardStateBuilder() {
    }

    /**
     * Starts from a copy of an existing board. The existing board is not
     * re-validated.
     */
    public static BoardStateBuilder from(BoardState state) {
        BoardStateBuilder builder = new BoardStateBuilder();
        state.items().forEach(item -> builder.items.put(item.id(), item));
        builder.connections.addAll(state.connections());
        builder.groups.addAll(state.groups());
        builder.viewport = state.viewport();
        return builder;
    }

    /**
     * Adds an item or note.
     */
    public BoardStateBuilder item(BoardItem item) {
        Objects.requireNonNull(item, "item");
        if (items.containsKey(item.id())) {
            throw new IllegalArgumentException("Duplicate board item id: " + item.id());
        }
        items.put(item.id(), item);
        return this;
    }

    /**
     * Adds a resource item.
     */
    public BoardStateBuilder item(String id, String resourceId, double x, double y, double w, double h, String label) {
        return item(BoardItem.resource(id, resourceId, x, y, w, h, "Canvas", label));
    }

    /**
     * Adds a note.
     */
    public BoardStateBuilder note(String id, double x, double y, double w, double h, String text) {
        return item(BoardItem.note(id, x, y, w, h, text));
    }

    /**
     * Adds a connection after checking its endpoints.
     */
    public BoardStateBuilder connection(Connection connection) {
        Objects.requireNonNull(connection, "connection");
        if (connection.isSelfReferential()) {
            throw new IllegalArgumentException("Connection " + connection.id() + " joins an item to itself");
        }
        requireItem(connection.fromId(), connection.id());
        requireItem(connection.toId(), connection.id());
        connections.add(connection);
        return this;
    }

    /**
     * Connects two items with the given type and no further decoration.
     */
    public BoardStateBuilder connect(String id, String fromId, String toId, ConnectionType type) {
        return connection(Connection.of(id, fromId, toId, type));
    }

    /**
     * Adds a group after checking its members.
     */
    public BoardStateBuilder group(BoardGroup group) {
        Objects.requireNonNull(group, "group");
        for (String itemId : group.itemIds()) {
            requireItem(itemId, group.id());
        }
        groups.add(group);
        return this;
    }

    public BoardStateBuilder group(String id, String label, String... itemIds) {
        return group(BoardGroup.of(id, label, List.of(itemIds)));
    }

    public BoardStateBuilder viewport(Viewport viewport) {
        this.viewport = Objects.requireNonNull(viewport, "viewport");
        return this;
    }

    public BoardStateBuilder viewport(double x, double y, double zoom) {
        return viewport(new Viewport(x, y, zoom));
    }

    /**
     * Builds an immutable {@link BoardState}; the builder may be reused.
     */
    public BoardState build() {
        return new BoardState(new ArrayList<>(items.values()), connections, groups, viewport);
    }

    private void requireItem(String itemId, String ownerId) {
        if (!items.containsKey(itemId)) {
            throw new IllegalArgumentException(ownerId + " refers to unknown board item " + itemId);
        }
    }
}
