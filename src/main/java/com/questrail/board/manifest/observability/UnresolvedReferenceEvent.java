package com.questrail.board.manifest.observability;

/**
 * A resource id that matched no decoded item.
 *
 * @param ownerId    id of the connection or group holding the reference
 * @param resourceId the unmatched resource id
 * @param outcome    what the decoder did with it
 */
public record UnresolvedReferenceEvent(
    String ownerId,
    String resourceId,
    Outcome outcome
) {
    public enum Outcome {
        /** Connection endpoint kept as the raw resource id. */
        KEPT_RAW,
        /** Group member left out of the group. */
        DROPPED
    }
}
