package com.questrail.board.api;

import java.util.Optional;

/**
 * Side of a board item a connection end attaches to.
 */
public enum AnchorSide
{
    TOP("T"),
    RIGHT("R"),
    BOTTOM("B"),
    LEFT("L");

    private final String code;

    AnchorSide(String code) {
        this.code = code;
    }

    /**
     * Returns the one-letter code used in manifests ({@code T}, {@code R},
     * {@code B} or {@code L}).
     */
    public String code() {
        return code;
    }

    /**
     * Looks up a side by its one-letter code.
     *
     * @return the side, or {@link Optional#empty()} for an unknown or null code
     */
    public static Optional<AnchorSide> fromCode(String code) {
        if (code == null) {
            return Optional.empty();
        }
        for (AnchorSide side : values()) {
            if (side.code.equals(code)) {
                return Optional.of(side);
            }
        }
        return Optional.empty();
    }
}
