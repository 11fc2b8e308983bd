package com.questrail.board.manifest.model;

import java.util.Objects;

/**
 * Connection details carried beside a linking annotation.
 *
 * <p>All fields except {@code id} are optional and {@code null} when absent.
 * Anchors and style are kept as their manifest strings; unknown values decode
 * as absent.</p>
 *
 * @param fromAnchor anchor side code of the source end
 * @param toAnchor   anchor side code of the target end
 * @param style      line style name
 * @param color      CSS color string
 * @param label      free-text connection label, when it differs from the type
 */
public record ConnectionMetadata(
        String id,
        String fromAnchor,
        String toAnchor,
        String style,
        String color,
        String label
) implements ExtensionRecord
{
    public static final String TYPE = "ConnectionMetadata";

    public ConnectionMetadata {
        Objects.requireNonNull(id, "id");
    }

    public boolean isEmpty() {
        return fromAnchor == null && toAnchor == null && style == null && color == null && label == null;
    }

    @Override
    public String type() {
        return TYPE;
    }
}
