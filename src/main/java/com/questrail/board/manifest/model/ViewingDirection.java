package com.questrail.board.manifest.model;

import java.util.Optional;

/**
 * Manifest {@code viewingDirection} values.
 */
public enum ViewingDirection
{
    LEFT_TO_RIGHT("left-to-right"),
    RIGHT_TO_LEFT("right-to-left"),
    TOP_TO_BOTTOM("top-to-bottom"),
    BOTTOM_TO_TOP("bottom-to-top");

    private final String value;

    ViewingDirection(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static Optional<ViewingDirection> fromValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        for (ViewingDirection direction : values()) {
            if (direction.value.equals(value)) {
                return Optional.of(direction);
            }
        }
        return Optional.empty();
    }
}
