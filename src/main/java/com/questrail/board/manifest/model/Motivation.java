package com.questrail.board.manifest.model;

import java.util.Optional;

/**
 * Annotation motivations the board codec reads and writes.
 */
public enum Motivation
{
    /** Places content on a canvas: a board item. */
    PAINTING("painting"),
    /** Attaches a comment: a board note. */
    COMMENTING("commenting"),
    /** Expresses a relationship: a board connection. */
    LINKING("linking");

    private final String value;

    Motivation(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    /**
     * Looks up a motivation by its manifest string.
     *
     * @return the motivation, or {@link Optional#empty()} for anything else
     */
    public static Optional<Motivation> fromValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        for (Motivation motivation : values()) {
            if (motivation.value.equals(value)) {
                return Optional.of(motivation);
            }
        }
        return Optional.empty();
    }
}
