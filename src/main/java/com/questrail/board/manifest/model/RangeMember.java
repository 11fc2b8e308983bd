package com.questrail.board.manifest.model;

import java.util.Objects;

/**
 * A reference from a {@link Range} to one of its members.
 *
 * @param id   resource id of the member
 * @param type resource type of the member; board groups always write {@code Canvas}
 */
public record RangeMember(String id, String type)
{
    public RangeMember {
        Objects.requireNonNull(id, "id");
        type = type == null ? Canvas.TYPE : type;
    }

    public static RangeMember canvas(String id) {
        return new RangeMember(id, Canvas.TYPE);
    }
}
