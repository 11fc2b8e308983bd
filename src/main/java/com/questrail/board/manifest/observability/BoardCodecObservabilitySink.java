package com.questrail.board.manifest.observability;

/**
 * Receives the degradations the board codec applies silently.
 *
 * <p>The codec never reports problems to end users; it skips or keeps-as-is
 * whatever it cannot map. Implementations of this interface are how callers
 * audit those decisions (logging, import diagnostics, metrics).</p>
 */
public interface BoardCodecObservabilitySink {
    /**
     * Called when an annotation is left out of a decoded board.
     * @param event which annotation and why
     */
    void onAnnotationSkipped(AnnotationSkippedEvent event);

    /**
     * Called when a connection is left out of an encoded manifest.
     * @param event which connection and why
     */
    void onConnectionDropped(ConnectionDroppedEvent event);

    /**
     * Called when the encoder writes an item at a position or size other than
     * its board rectangle.
     * @param event which item, and what was written
     */
    void onPlacementAdjusted(PlacementAdjustedEvent event);

    /**
     * Called when a resource id read from a manifest matches no decoded item.
     * @param event the reference and what was done with it
     */
    void onReferenceUnresolved(UnresolvedReferenceEvent event);

    /**
     * Called once at the end of every encode or decode pass.
     * @param event summary counts for the pass
     */
    void onPassCompleted(CodecPassCompletedEvent event);
}
