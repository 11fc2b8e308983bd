package com.questrail.board.api;

import java.util.Optional;

/**
 * Line style used to draw a connection.
 */
public enum ConnectionStyle
{
    STRAIGHT("straight"),
    ELBOW("elbow"),
    CURVED("curved");

    private final String value;

    ConnectionStyle(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static Optional<ConnectionStyle> fromValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        for (ConnectionStyle style : values()) {
            if (style.value.equals(value)) {
                return Optional.of(style);
            }
        }
        return Optional.empty();
    }
}
