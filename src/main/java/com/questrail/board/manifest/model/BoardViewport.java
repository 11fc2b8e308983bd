package com.questrail.board.manifest.model;

import java.util.Objects;

/**
 * Viewport record. Each coordinate is {@code null} when the manifest did not
 * carry it; the decoder substitutes defaults.
 */
public record BoardViewport(String id, Double x, Double y, Double zoom) implements ExtensionRecord
{
    public static final String TYPE = "BoardViewport";

    public BoardViewport {
        Objects.requireNonNull(id, "id");
    }

    @Override
    public String type() {
        return TYPE;
    }
}
