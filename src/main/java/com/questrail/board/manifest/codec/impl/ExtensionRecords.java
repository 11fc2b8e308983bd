package com.questrail.board.manifest.codec.impl;

import com.questrail.board.api.AnchorSide;
import com.questrail.board.api.BoardGroup;
import com.questrail.board.api.Connection;
import com.questrail.board.api.ConnectionStyle;
import com.questrail.board.api.Viewport;
import com.questrail.board.manifest.model.BoardMarker;
import com.questrail.board.manifest.model.BoardViewport;
import com.questrail.board.manifest.model.ConnectionMetadata;
import com.questrail.board.manifest.model.ExtensionRecord;
import com.questrail.board.manifest.model.GroupMetadata;
import com.questrail.board.manifest.model.Manifest;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * ExtensionRecords
 * -----------------------------------------------------------------------------
 * Reads and writes the board's vendor records.
 *
 * <h2>Writing</h2>
 * <ul>
 *   <li>The manifest root always gets a {@link BoardMarker} and a
 *       {@link BoardViewport}</li>
 *   <li>{@link ConnectionMetadata} and {@link GroupMetadata} are written only
 *       when at least one of their optional fields is set</li>
 * </ul>
 *
 * <h2>Reading</h2>
 * A missing record means "all fields absent", never an error. Viewport fields
 * default individually to {@code 0}, {@code 0} and {@code 1}.
 */
public final class ExtensionRecords
{
    static final String MARKER_SUFFIX = "/board";
    static final String VIEWPORT_SUFFIX = "/viewport";
    static final String CONNECTION_META_SUFFIX = "/connection-meta";
    static final String GROUP_META_SUFFIX = "/meta";

    private ExtensionRecords() {}

    // ========================================================================
    // Write
    // ========================================================================

    /**
     * Returns the records for the manifest root: board marker, then viewport.
     */
    public static List<ExtensionRecord> rootRecords(String documentId, Viewport viewport)
    {
        Objects.requireNonNull(viewport, "viewport");
        return List.of(
                new BoardMarker(documentId + MARKER_SUFFIX),
                new BoardViewport(documentId + VIEWPORT_SUFFIX,
                        viewport.x(), viewport.y(), viewport.zoom()));
    }

    /**
     * Returns the metadata record for a connection, if it has anything to carry.
     */
    public static Optional<ConnectionMetadata> connectionMetadata(Connection connection)
    {
        ConnectionMetadata meta = new ConnectionMetadata(
                connection.id() + CONNECTION_META_SUFFIX,
                connection.fromAnchorSide().map(AnchorSide::code).orElse(null),
                connection.toAnchorSide().map(AnchorSide::code).orElse(null),
                connection.lineStyle().map(ConnectionStyle::value).orElse(null),
                connection.color(),
                connection.label());
        return meta.isEmpty() ? Optional.empty() : Optional.of(meta);
    }

    /**
     * Returns the metadata record for a group, if it has a color.
     *
     * @param rangeId id of the range the record is attached to
     */
    public static Optional<GroupMetadata> groupMetadata(String rangeId, BoardGroup group)
    {
        return group.colorValue().map(color -> new GroupMetadata(rangeId + GROUP_META_SUFFIX, color));
    }

    // ========================================================================
    // Read
    // ========================================================================

    /**
     * Returns the first record of the given kind.
     */
    public static <T extends ExtensionRecord> Optional<T> find(List<ExtensionRecord> records, Class<T> kind)
    {
        for (ExtensionRecord record : records) {
            if (kind.isInstance(record)) {
                return Optional.of(kind.cast(record));
            }
        }
        return Optional.empty();
    }

    /**
     * Reads the viewport from the root records. A missing record, or a missing
     * field, reads as the {@link Viewport#DEFAULT} value; a zoom that is not
     * strictly positive reads as {@code 1}.
     */
    public static Viewport readViewport(List<ExtensionRecord> records)
    {
        Optional<BoardViewport> record = find(records, BoardViewport.class);
        if (record.isEmpty()) {
            return Viewport.DEFAULT;
        }
        BoardViewport v = record.get();
        double x = finiteOr(v.x(), Viewport.DEFAULT.x());
        double y = finiteOr(v.y(), Viewport.DEFAULT.y());
        double zoom = finiteOr(v.zoom(), Viewport.DEFAULT.zoom());
        return new Viewport(x, y, zoom > 0 ? zoom : Viewport.DEFAULT.zoom());
    }

    /**
     * Applies a connection's metadata record, when present, to a decoded
     * connection. Unknown anchor or style strings are ignored.
     */
    public static Connection applyConnectionMetadata(Connection connection, List<ExtensionRecord> records)
    {
        Optional<ConnectionMetadata> record = find(records, ConnectionMetadata.class);
        if (record.isEmpty()) {
            return connection;
        }
        ConnectionMetadata meta = record.get();
        return new Connection(
                connection.id(),
                connection.fromId(),
                connection.toId(),
                connection.type(),
                meta.label(),
                AnchorSide.fromCode(meta.fromAnchor()).orElse(null),
                AnchorSide.fromCode(meta.toAnchor()).orElse(null),
                ConnectionStyle.fromValue(meta.style()).orElse(null),
                meta.color());
    }

    /**
     * Reads the group color from a range's records.
     */
    public static Optional<String> readGroupColor(List<ExtensionRecord> records)
    {
        return find(records, GroupMetadata.class).map(GroupMetadata::color);
    }

    /**
     * Board discovery predicate: {@code true} iff the manifest root carries a
     * {@link BoardMarker}.
     */
    public static boolean isBoard(Manifest manifest)
    {
        return find(manifest.service(), BoardMarker.class).isPresent();
    }

    private static double finiteOr(Double value, double fallback)
    {
        return (value == null || !Double.isFinite(value)) ? fallback : value;
    }
}
