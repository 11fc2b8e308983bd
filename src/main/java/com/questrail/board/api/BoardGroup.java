package com.questrail.board.api;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A named cluster of board items.
 *
 * <p>{@link #itemIds()} has set semantics: repeated ids collapse to their first
 * occurrence, so the list order is the order in which members were added.
 * Empty groups are valid values; pruning them is left to callers.</p>
 */
public record BoardGroup(
        String id,
        String label,
        List<String> itemIds,
        String color
)
{
    public BoardGroup {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(label, "label");
        Objects.requireNonNull(itemIds, "itemIds");
        itemIds = List.copyOf(new LinkedHashSet<>(itemIds));
    }

    public static BoardGroup of(String id, String label, List<String> itemIds) {
        return new BoardGroup(id, label, itemIds, null);
    }

    public Optional<String> colorValue() {
        return Optional.ofNullable(color);
    }

    public boolean contains(String itemId) {
        return itemIds.contains(itemId);
    }

    public boolean isEmpty() {
        return itemIds.isEmpty();
    }
}
