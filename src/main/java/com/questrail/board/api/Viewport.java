package com.questrail.board.api;

/**
 * Pan and zoom state of the board view.
 *
 * @param x    horizontal pan offset
 * @param y    vertical pan offset
 * @param zoom zoom factor, strictly positive
 */
public record Viewport(double x, double y, double zoom)
{
    /** Origin at 1x zoom. */
    public static final Viewport DEFAULT = new Viewport(0, 0, 1);

    public Viewport {
        if (!(zoom > 0)) {
            throw new IllegalArgumentException("zoom must be positive (was " + zoom + ")");
        }
    }
}
