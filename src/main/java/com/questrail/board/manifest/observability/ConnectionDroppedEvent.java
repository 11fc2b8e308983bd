package com.questrail.board.manifest.observability;

/**
 * A connection the encoder left out of the manifest.
 */
public record ConnectionDroppedEvent(
    String connectionId,
    Reason reason
) {
    public enum Reason {
        /** An endpoint names no item of the board being encoded. */
        DANGLING_ENDPOINT,
        /** Both endpoints name the same item. */
        SELF_REFERENCE
    }
}
