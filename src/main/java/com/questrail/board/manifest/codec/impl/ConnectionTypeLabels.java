package com.questrail.board.manifest.codec.impl;

import com.questrail.board.api.ConnectionType;

import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Closed two-way mapping between {@link ConnectionType} and the label written
 * on linking annotation bodies.
 *
 * <p>Unknown labels decode to {@link ConnectionType#DEFAULT}; hand-authored
 * relationships keep existing even when their type is not understood.</p>
 */
public final class ConnectionTypeLabels
{
    private static final Map<ConnectionType, String> LABEL_BY_TYPE;
    private static final Map<String, ConnectionType> TYPE_BY_LABEL;

    static {
        Map<ConnectionType, String> labels = new EnumMap<>(ConnectionType.class);
        labels.put(ConnectionType.ASSOCIATED, "associated");
        labels.put(ConnectionType.PART_OF, "partOf");
        labels.put(ConnectionType.SIMILAR_TO, "similarTo");
        labels.put(ConnectionType.REFERENCES, "references");
        labels.put(ConnectionType.REQUIRES, "requires");
        labels.put(ConnectionType.SEQUENCE, "sequence");
        LABEL_BY_TYPE = Collections.unmodifiableMap(labels);

        Map<String, ConnectionType> types = new HashMap<>();
        labels.forEach((type, label) -> types.put(label, type));
        TYPE_BY_LABEL = Collections.unmodifiableMap(types);
    }

    private ConnectionTypeLabels() {}

    /**
     * @return the manifest label for the type, e.g. {@code partOf}
     */
    public static String labelOf(ConnectionType type)
    {
        return LABEL_BY_TYPE.get(Objects.requireNonNull(type, "type"));
    }

    /**
     * @return the type for a manifest label, {@link ConnectionType#DEFAULT} if
     *         the label is unknown or {@code null}
     */
    public static ConnectionType typeOf(String label)
    {
        if (label == null) {
            return ConnectionType.DEFAULT;
        }
        return TYPE_BY_LABEL.getOrDefault(label, ConnectionType.DEFAULT);
    }

    public static boolean isKnown(String label)
    {
        return label != null && TYPE_BY_LABEL.containsKey(label);
    }
}
