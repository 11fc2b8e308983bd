package com.questrail.board.manifest.model;

/**
 * ExtensionRecord
 * -----------------------------------------------------------------------------
 * A tagged vendor record carried in the {@code service} array of a manifest,
 * range or annotation.
 *
 * <h2>Record kinds</h2>
 * <ul>
 *   <li>{@link BoardMarker}: on the manifest root, marks the document as a board</li>
 *   <li>{@link BoardViewport}: on the manifest root, pan and zoom</li>
 *   <li>{@link ConnectionMetadata}: on a linking annotation, connection details
 *       the standard annotation shape cannot hold</li>
 *   <li>{@link GroupMetadata}: on a range, group color</li>
 *   <li>{@link ForeignExtension}: any other record, kept but never interpreted</li>
 * </ul>
 *
 * Board data travels only through these explicit variants; nothing is injected
 * as ad-hoc properties on the standard containers.
 */
public sealed interface ExtensionRecord
        permits BoardMarker, BoardViewport, ConnectionMetadata, GroupMetadata, ForeignExtension
{
    /**
     * @return the record id
     */
    String id();

    /**
     * @return the record kind, written as the JSON {@code type}
     */
    String type();
}
