package com.questrail.board.core;

import com.questrail.board.api.AnchorSide;
import com.questrail.board.api.BoardItem;

/**
 * Default anchor sides for a new connection, chosen from the relative
 * position of the two items.
 *
 * <p>When the items are further apart horizontally than vertically the
 * connection leaves through the facing left/right sides; otherwise through
 * the facing top/bottom sides. Ties count as vertical.</p>
 *
 * @param from side of the source item
 * @param to   side of the target item
 */
public record AnchorPoints(AnchorSide from, AnchorSide to)
{
    public static AnchorPoints between(BoardItem fromItem, BoardItem toItem) {
        double dx = toItem.x() - fromItem.x();
        double dy = toItem.y() - fromItem.y();

        if (Math.abs(dx) > Math.abs(dy)) {
            return dx > 0
                    ? new AnchorPoints(AnchorSide.RIGHT, AnchorSide.LEFT)
                    : new AnchorPoints(AnchorSide.LEFT, AnchorSide.RIGHT);
        }
        return dy > 0
                ? new AnchorPoints(AnchorSide.BOTTOM, AnchorSide.TOP)
                : new AnchorPoints(AnchorSide.TOP, AnchorSide.BOTTOM);
    }
}
