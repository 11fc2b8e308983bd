package com.questrail.board.manifest.model;

import java.util.Objects;

/**
 * Group details carried beside a range. {@code color} is {@code null} when absent.
 */
public record GroupMetadata(String id, String color) implements ExtensionRecord
{
    public static final String TYPE = "GroupMetadata";

    public GroupMetadata {
        Objects.requireNonNull(id, "id");
    }

    @Override
    public String type() {
        return TYPE;
    }
}
