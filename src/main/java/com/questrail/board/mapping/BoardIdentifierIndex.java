package com.questrail.board.mapping;

import com.questrail.board.api.BoardItem;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * BoardIdentifierIndex
 * -----------------------------------------------------------------------------
 * A map-backed {@link IdentifierIndex} populated from {@link BoardItem}s.
 *
 * <ul>
 *   <li>session id -> resource id</li>
 *   <li>resource id -> session id</li>
 * </ul>
 *
 * The index is filled incrementally: the decoder registers each item as soon as
 * it is decoded, so anything decoded later in the same pass resolves against
 * every item seen so far.
 *
 * When the same resource is placed on the board more than once, the first
 * registered item wins the reverse lookup.
 */
public final class BoardIdentifierIndex implements IdentifierIndex
{
    private final Map<String, String> resourceBySession = new HashMap<>();
    private final Map<String, String> sessionByResource = new HashMap<>();

    /**
     * Creates an empty index.
     */
    public BoardIdentifierIndex() {
    }

    /**
     * Creates an index holding the given items, in iteration order.
     */
    public static BoardIdentifierIndex of(Iterable<BoardItem> items) {
        Objects.requireNonNull(items, "items");
        BoardIdentifierIndex index = new BoardIdentifierIndex();
        for (BoardItem item : items) {
            index.register(item);
        }
        return index;
    }

    /**
     * Registers an item. Later registrations never displace an earlier mapping.
     */
    public void register(BoardItem item) {
        Objects.requireNonNull(item, "item");
        resourceBySession.putIfAbsent(item.id(), item.resourceId());
        sessionByResource.putIfAbsent(item.resourceId(), item.id());
    }

    @Override
    public String toResourceId(String sessionId) {
        return resourceBySession.getOrDefault(sessionId, sessionId);
    }

    @Override
    public String toSessionId(String resourceId) {
        return sessionByResource.getOrDefault(resourceId, resourceId);
    }

    @Override
    public boolean containsSession(String sessionId) {
        return resourceBySession.containsKey(sessionId);
    }

    @Override
    public boolean containsResource(String resourceId) {
        return sessionByResource.containsKey(resourceId);
    }

    @Override
    public int size() {
        return resourceBySession.size();
    }
}
