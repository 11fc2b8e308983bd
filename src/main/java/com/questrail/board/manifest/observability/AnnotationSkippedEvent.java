package com.questrail.board.manifest.observability;

/**
 * An annotation the decoder could not turn into a board item or connection.
 */
public record AnnotationSkippedEvent(
    String annotationId,
    Reason reason
) {
    public enum Reason {
        /** Target carries no {@code #xywh=} selector the codec can parse. */
        UNPARSABLE_SELECTOR,
        /** Selector parsed but width or height is zero. */
        DEGENERATE_SIZE,
        /** Commenting annotation with no text. */
        EMPTY_NOTE,
        /** Linking annotation without a source or target. */
        MISSING_ENDPOINT,
        /** Motivation other than commenting or linking in a supplementing page. */
        UNSUPPORTED_MOTIVATION
    }
}
