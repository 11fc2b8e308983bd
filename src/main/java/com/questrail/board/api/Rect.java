package com.questrail.board.api;

/**
 * An axis-aligned rectangle in board coordinates: top-left corner plus size.
 *
 * <p>No invariants are enforced here. A rectangle read from a hand-edited
 * manifest may have a zero size; {@link BoardItem} is where positive sizes are
 * required.</p>
 */
public record Rect(double x, double y, double w, double h)
{
    public double right() {
        return x + w;
    }

    public double bottom() {
        return y + h;
    }

    public boolean hasPositiveSize() {
        return w > 0 && h > 0;
    }
}
