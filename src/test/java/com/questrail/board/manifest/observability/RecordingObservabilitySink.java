package com.questrail.board.manifest.observability;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Test sink that records events for assertions.
 */
public final class RecordingObservabilitySink implements BoardCodecObservabilitySink {
    private final List<Object> events = new ArrayList<>();

    @Override
    public synchronized void onAnnotationSkipped(AnnotationSkippedEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onConnectionDropped(ConnectionDroppedEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onPlacementAdjusted(PlacementAdjustedEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onReferenceUnresolved(UnresolvedReferenceEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onPassCompleted(CodecPassCompletedEvent event) {
        events.add(event);
    }

    public synchronized List<Object> getAllEvents() {
        return new ArrayList<>(events);
    }

    public synchronized <T> List<T> eventsOfType(Class<T> type) {
        return events.stream()
            .filter(type::isInstance)
            .map(type::cast)
            .collect(Collectors.toList());
    }

    public synchronized <T> boolean hasEventOfType(Class<T> type) {
        return events.stream().anyMatch(type::isInstance);
    }
}
