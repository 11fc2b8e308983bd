package com.questrail.board.manifest.model;

import java.util.Objects;

/**
 * Marks a manifest as produced by the board encoder. Its presence on the root
 * is the only test for whether a manifest can be opened as a board.
 */
public record BoardMarker(String id) implements ExtensionRecord
{
    public static final String TYPE = "BoardMarker";

    public BoardMarker {
        Objects.requireNonNull(id, "id");
    }

    @Override
    public String type() {
        return TYPE;
    }
}
