package com.questrail.board.manifest.observability;

/**
 * Summary of one encode or decode pass.
 */
public record CodecPassCompletedEvent(
    Direction direction,
    String documentId,
    int items,
    int connections,
    int groups
) {
    public enum Direction {
        ENCODE,
        DECODE
    }
}
