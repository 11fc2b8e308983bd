package com.questrail.board.api;

/**
 * ConnectionType
 * -----------------------------------------------------------------------------
 * The closed set of relationship kinds a {@link Connection} can express.
 *
 * <p>Each type carries two display labels: a plain-language one for newcomers
 * and the precise term shown when advanced terminology is enabled. The label
 * written into manifests is not part of this enum; see
 * {@code ConnectionTypeLabels} in the manifest codec.</p>
 */
public enum ConnectionType
{
    ASSOCIATED("Related", "Associated"),
    PART_OF("Part of", "Part Of"),
    SIMILAR_TO("Similar", "Similar To"),
    REFERENCES("References", "References"),
    REQUIRES("Needs", "Requires"),
    SEQUENCE("Next", "Sequence");

    /** Type assumed when nothing more specific is known. */
    public static final ConnectionType DEFAULT = ASSOCIATED;

    private final String simpleLabel;
    private final String advancedLabel;

    ConnectionType(String simpleLabel, String advancedLabel) {
        this.simpleLabel = simpleLabel;
        this.advancedLabel = advancedLabel;
    }

    /**
     * Returns the label to show for this type.
     *
     * @param advanced whether advanced terminology is enabled
     */
    public String displayLabel(boolean advanced) {
        return advanced ? advancedLabel : simpleLabel;
    }
}
