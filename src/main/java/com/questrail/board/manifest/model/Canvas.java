package com.questrail.board.manifest.model;

import java.util.List;
import java.util.Objects;

/**
 * Canvas
 * -----------------------------------------------------------------------------
 * A virtual drawing surface.
 *
 * <ul>
 *   <li>{@code items} holds the painting annotation pages</li>
 *   <li>{@code annotations} holds the supplementing pages (linking and
 *       commenting); it is omitted from JSON when empty</li>
 * </ul>
 *
 * A board is encoded onto a single canvas, the surface, whose size is
 * {@link #SURFACE_WIDTH} x {@link #SURFACE_HEIGHT}.
 */
public record Canvas(
        String id,
        LanguageMap label,
        int width,
        int height,
        List<AnnotationPage> items,
        List<AnnotationPage> annotations
)
{
    public static final String TYPE = "Canvas";

    public static final int SURFACE_WIDTH = 10000;
    public static final int SURFACE_HEIGHT = 10000;

    public Canvas {
        Objects.requireNonNull(id, "id");
        label = label == null ? LanguageMap.empty() : label;
        items = items == null ? List.of() : List.copyOf(items);
        annotations = annotations == null ? List.of() : List.copyOf(annotations);
    }
}
