package com.questrail.board.manifest.model;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Manifest
 * -----------------------------------------------------------------------------
 * Root of the presentation document.
 *
 * <h2>Board layout</h2>
 * A board manifest has:
 * <ul>
 *   <li>exactly one canvas in {@code items}, the surface</li>
 *   <li>one {@link Range} per board group in {@code structures}</li>
 *   <li>{@link BoardMarker} and {@link BoardViewport} records in {@code service}</li>
 * </ul>
 *
 * Values of this type are built whole by the encoder or the JSON reader and
 * never edited in place.
 */
public record Manifest(
        String id,
        LanguageMap label,
        List<Canvas> items,
        List<String> behavior,
        ViewingDirection viewingDirection,
        List<Range> structures,
        List<ExtensionRecord> service
)
{
    public static final String TYPE = "Manifest";

    public Manifest {
        Objects.requireNonNull(id, "id");
        label = label == null ? LanguageMap.empty() : label;
        items = items == null ? List.of() : List.copyOf(items);
        behavior = behavior == null ? List.of() : List.copyOf(behavior);
        structures = structures == null ? List.of() : List.copyOf(structures);
        service = service == null ? List.of() : List.copyOf(service);
    }

    /**
     * Returns the first canvas, which a board treats as its surface.
     */
    public Optional<Canvas> firstCanvas() {
        return items.isEmpty() ? Optional.empty() : Optional.of(items.get(0));
    }

    public Optional<ViewingDirection> viewingDirectionValue() {
        return Optional.ofNullable(viewingDirection);
    }
}
