package com.questrail.board.manifest.model;

import java.util.List;
import java.util.Objects;

/**
 * Range
 * -----------------------------------------------------------------------------
 * An entry of a manifest's {@code structures} list.
 *
 * <p>The {@code type} is kept as read: the structures container may hold entries
 * that are not ranges, and the decoder only turns entries of type
 * {@link #TYPE} into board groups.</p>
 */
public record Range(
        String id,
        String type,
        LanguageMap label,
        List<RangeMember> items,
        List<ExtensionRecord> service
)
{
    public static final String TYPE = "Range";

    public Range {
        Objects.requireNonNull(id, "id");
        type = type == null ? "" : type;
        label = label == null ? LanguageMap.empty() : label;
        items = items == null ? List.of() : List.copyOf(items);
        service = service == null ? List.of() : List.copyOf(service);
    }

    public boolean isRange() {
        return TYPE.equals(type);
    }
}
