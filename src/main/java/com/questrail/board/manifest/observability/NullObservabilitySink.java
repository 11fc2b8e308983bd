package com.questrail.board.manifest.observability;

/**
 * No-op implementation of BoardCodecObservabilitySink.
 */
public final class NullObservabilitySink implements BoardCodecObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onAnnotationSkipped(AnnotationSkippedEvent event) {}

    @Override
    public void onConnectionDropped(ConnectionDroppedEvent event) {}

    @Override
    public void onPlacementAdjusted(PlacementAdjustedEvent event) {}

    @Override
    public void onReferenceUnresolved(UnresolvedReferenceEvent event) {}

    @Override
    public void onPassCompleted(CodecPassCompletedEvent event) {}
}
