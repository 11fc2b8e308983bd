package com.questrail.board.manifest.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Implementation of BoardCodecObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jBoardCodecObservabilitySink implements BoardCodecObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jBoardCodecObservabilitySink.class);

    @Override
    public void onAnnotationSkipped(AnnotationSkippedEvent event) {
        log.debug("Skipped annotation {}: {}", event.annotationId(), event.reason());
    }

    @Override
    public void onConnectionDropped(ConnectionDroppedEvent event) {
        log.debug("Dropped connection {}: {}", event.connectionId(), event.reason());
    }

    @Override
    public void onPlacementAdjusted(PlacementAdjustedEvent event) {
        log.debug("Adjusted placement of {}: {} written as {}",
            event.itemId(),
            event.bounds(),
            event.selector());
    }

    @Override
    public void onReferenceUnresolved(UnresolvedReferenceEvent event) {
        log.debug("Unresolved reference {} in {}: {}",
            event.resourceId(),
            event.ownerId(),
            event.outcome());
    }

    @Override
    public void onPassCompleted(CodecPassCompletedEvent event) {
        log.debug("Board {} of {}: {} items, {} connections, {} groups",
            event.direction(),
            event.documentId(),
            event.items(),
            event.connections(),
            event.groups());
    }
}
