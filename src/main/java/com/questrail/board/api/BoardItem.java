package com.questrail.board.api;

import java.util.Objects;
import java.util.Optional;

/**
 * BoardItem
 * -----------------------------------------------------------------------------
 * A resource or free-text note placed on the board surface.
 *
 * <h2>Identity</h2>
 * <ul>
 *   <li>{@link #id()} is the session id: stable for one editing session and used
 *       by connections and groups to refer to the item</li>
 *   <li>{@link #resourceId()} identifies the underlying content outside the
 *       session (a canvas id, a manifest id, ...). A note has no content outside
 *       the board, so its resource id is its session id</li>
 * </ul>
 *
 * <h2>Invariants</h2>
 * <ul>
 *   <li>{@code w} and {@code h} are strictly positive</li>
 *   <li>A note always carries a non-empty {@link #annotation()} text</li>
 *   <li>A note's resource id is its session id</li>
 * </ul>
 *
 * Positions are board coordinates and may be fractional while the item is being
 * dragged; the manifest encoding rounds them to whole pixels.
 */
public record BoardItem(
        String id,
        String resourceId,
        double x,
        double y,
        double w,
        double h,
        String resourceType,
        String label,
        String annotation,
        boolean note
)
{
    public BoardItem {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(resourceId, "resourceId");
        Objects.requireNonNull(resourceType, "resourceType");
        Objects.requireNonNull(label, "label");
        if (!(w > 0) || !(h > 0)) {
            throw new IllegalArgumentException(
                    "Board item " + id + " must have a positive size (was " + w + "x" + h + ")");
        }
        if (note && (annotation == null || annotation.isEmpty())) {
            throw new IllegalArgumentException("Note " + id + " must carry annotation text");
        }
        if (note && !resourceId.equals(id)) {
            throw new IllegalArgumentException(
                    "Note " + id + " must use its id as resource id (was " + resourceId + ")");
        }
    }

    /**
     * Creates a resource item (not a note) without annotation text.
     */
    public static BoardItem resource(String id,
                                     String resourceId,
                                     double x, double y, double w, double h,
                                     String resourceType,
                                     String label) {
        return new BoardItem(id, resourceId, x, y, w, h, resourceType, label, null, false);
    }

    /**
     * Creates a note. The note's resource id is its session id.
     */
    public static BoardItem note(String id, double x, double y, double w, double h, String text) {
        return new BoardItem(id, id, x, y, w, h, "Text", NoteLabels.labelFor(text), text, true);
    }

    /**
     * Returns the free-text annotation attached to this item, if any.
     */
    public Optional<String> annotationText() {
        return Optional.ofNullable(annotation);
    }

    /**
     * Returns the rectangle occupied by this item.
     */
    public Rect bounds() {
        return new Rect(x, y, w, h);
    }

    /**
     * Returns a copy of this item moved and resized to the given rectangle.
     */
    public BoardItem withBounds(Rect rect) {
        return new BoardItem(id, resourceId, rect.x(), rect.y(), rect.w(), rect.h(),
                resourceType, label, annotation, note);
    }
}
