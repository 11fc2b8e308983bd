package com.questrail.board.manifest.model;

import java.util.Objects;

/**
 * A service record of a kind the board codec does not interpret, such as an
 * image service reference. Only its id and type are kept.
 */
public record ForeignExtension(String id, String type) implements ExtensionRecord
{
    public ForeignExtension {
        id = id == null ? "" : id;
        Objects.requireNonNull(type, "type");
    }
}
