package com.questrail.board.mapping;

/**
 * IdentifierIndex
 * -----------------------------------------------------------------------------
 * {@code IdentifierIndex} defines the mapping between session ids (the ids a
 * board uses internally to wire connections and groups) and resource ids (the
 * externally meaningful ids written into manifests).
 *
 * <h2>Why this exists</h2>
 * Session ids do not survive export: a manifest refers to content by resource
 * id only. Connections and group members must therefore be translated on the
 * way out and reconstructed on the way back in. This interface isolates that
 * translation so that encoder and decoder never search item lists themselves.
 *
 * <h2>Fallback Semantics</h2>
 * Both lookups are total. An unknown id is returned unchanged rather than
 * rejected:
 * <ul>
 *   <li>On encode, an unknown session id is written as-is</li>
 *   <li>On decode, an unresolvable resource id becomes the raw endpoint of a
 *       connection stub, which keeps the relationship visible instead of
 *       deleting it without warning</li>
 * </ul>
 * Callers that need to know whether a lookup hit use
 * {@link #containsSession(String)} and {@link #containsResource(String)}.
 *
 * <h2>Scope</h2>
 * An index lives for exactly one encode or decode pass and is never shared
 * across passes.
 */
public interface IdentifierIndex
{
    /**
     * Maps a session id to the resource id of the item it names.
     *
     * @param sessionId item session id
     * @return the resource id, or {@code sessionId} unchanged if no item matches
     */
    String toResourceId(String sessionId);

    /**
     * Maps a resource id back to the session id of the item carrying it.
     *
     * @param resourceId externally meaningful resource id
     * @return the session id, or {@code resourceId} unchanged if no item matches
     */
    String toSessionId(String resourceId);

    /**
     * @return {@code true} if an item with this session id is known
     */
    boolean containsSession(String sessionId);

    /**
     * @return {@code true} if an item with this resource id is known
     */
    boolean containsResource(String resourceId);

    /**
     * @return the number of items registered
     */
    int size();
}
