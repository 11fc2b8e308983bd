package com.questrail.board.api;

import java.util.Objects;
import java.util.Optional;

/**
 * Connection
 * -----------------------------------------------------------------------------
 * A directed, typed relationship between two {@link BoardItem}s, referenced by
 * their session ids.
 *
 * <h2>Invariants</h2>
 * <ul>
 *   <li>On an edited board, {@code fromId != toId} and both ids name items of
 *       the same {@link BoardState}. {@code BoardStateBuilder} enforces this;
 *       the encoder drops connections that violate it</li>
 *   <li>A decoded connection may refer to a raw resource id when its endpoint
 *       could not be resolved. Such stubs are representable so that decoding
 *       never loses a user-authored relationship</li>
 * </ul>
 *
 * All fields after {@code type} are optional and may be {@code null}.
 */
public record Connection(
        String id,
        String fromId,
        String toId,
        ConnectionType type,
        String label,
        AnchorSide fromAnchor,
        AnchorSide toAnchor,
        ConnectionStyle style,
        String color
)
{
    public Connection {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(fromId, "fromId");
        Objects.requireNonNull(toId, "toId");
        Objects.requireNonNull(type, "type");
    }

    /**
     * Creates a connection with no label, anchors, style or color.
     */
    public static Connection of(String id, String fromId, String toId, ConnectionType type) {
        return new Connection(id, fromId, toId, type, null, null, null, null, null);
    }

    public boolean isSelfReferential() {
        return fromId.equals(toId);
    }

    public Optional<String> labelText() {
        return Optional.ofNullable(label);
    }

    public Optional<AnchorSide> fromAnchorSide() {
        return Optional.ofNullable(fromAnchor);
    }

    public Optional<AnchorSide> toAnchorSide() {
        return Optional.ofNullable(toAnchor);
    }

    public Optional<ConnectionStyle> lineStyle() {
        return Optional.ofNullable(style);
    }

    public Optional<String> colorValue() {
        return Optional.ofNullable(color);
    }

    /**
     * Returns a copy with the given anchor sides.
     */
    public Connection withAnchors(AnchorSide from, AnchorSide to) {
        return new Connection(id, fromId, toId, type, label, from, to, style, color);
    }

    /**
     * Returns a copy with the given line style and color.
     */
    public Connection withAppearance(ConnectionStyle style, String color) {
        return new Connection(id, fromId, toId, type, label, fromAnchor, toAnchor, style, color);
    }

    /**
     * Returns a copy carrying the given free-text label.
     */
    public Connection withLabel(String label) {
        return new Connection(id, fromId, toId, type, label, fromAnchor, toAnchor, style, color);
    }
}
