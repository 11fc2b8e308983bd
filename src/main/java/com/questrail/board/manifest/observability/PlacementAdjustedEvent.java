package com.questrail.board.manifest.observability;

import com.questrail.board.api.Rect;

/**
 * An item the encoder placed somewhere other than its board rectangle, because
 * the fragment selector cannot express the rectangle as it is.
 *
 * @param itemId   session id of the item
 * @param bounds   rectangle on the board
 * @param selector selector actually written, e.g. {@code xywh=0,40,1,100}
 */
public record PlacementAdjustedEvent(
    String itemId,
    Rect bounds,
    String selector
) {
}
