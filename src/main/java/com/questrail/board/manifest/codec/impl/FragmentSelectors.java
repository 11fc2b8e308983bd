package com.questrail.board.manifest.codec.impl;

import com.questrail.board.api.Rect;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * FragmentSelectors
 * -----------------------------------------------------------------------------
 * Converts rectangles to and from {@code xywh} media fragments.
 *
 * <p>Encoding rounds each component to the nearest integer, halves away from
 * zero, so a round trip is exact for integer rectangles and otherwise off by at
 * most one pixel per component. Negative positions are written as 0: the
 * fragment grammar only admits non-negative numbers. A positive width or
 * height is written as at least 1 so that the rectangle never collapses.</p>
 *
 * <p>Decoding accepts non-negative integers or decimals and reports anything
 * else as absent rather than failing, so one malformed target never aborts a
 * whole decode.</p>
 */
public final class FragmentSelectors
{
    static final String PREFIX = "xywh=";

    private static final Pattern XYWH = Pattern.compile(
            "#xywh=(\\d+(?:\\.\\d+)?),(\\d+(?:\\.\\d+)?),(\\d+(?:\\.\\d+)?),(\\d+(?:\\.\\d+)?)");

    private FragmentSelectors() {}

    /**
     * Formats a rectangle as {@code xywh=x,y,w,h}.
     */
    public static String encodeRect(Rect rect)
    {
        return PREFIX
                + Math.max(0L, round(rect.x())) + ","
                + Math.max(0L, round(rect.y())) + ","
                + size(rect.w()) + ","
                + size(rect.h());
    }

    /**
     * @return {@code true} if {@link #encodeRect(Rect)} writes this rectangle
     *         somewhere other than where it is: a negative position or a
     *         positive size that rounds to zero
     */
    public static boolean isAdjusted(Rect rect)
    {
        return rect.x() < 0 || rect.y() < 0
                || (rect.w() > 0 && round(rect.w()) == 0)
                || (rect.h() > 0 && round(rect.h()) == 0);
    }

    /**
     * Builds a selector target {@code <canvasId>#xywh=x,y,w,h}.
     */
    public static String target(String canvasId, Rect rect)
    {
        return canvasId + "#" + encodeRect(rect);
    }

    /**
     * Extracts the rectangle from a target containing {@code #xywh=x,y,w,h}.
     *
     * @param target annotation target, may be {@code null}
     * @return the rectangle, or {@link Optional#empty()} if no selector matches
     */
    public static Optional<Rect> decodeRect(String target)
    {
        if (target == null) {
            return Optional.empty();
        }
        Matcher m = XYWH.matcher(target);
        if (!m.find()) {
            return Optional.empty();
        }
        return Optional.of(new Rect(
                Double.parseDouble(m.group(1)),
                Double.parseDouble(m.group(2)),
                Double.parseDouble(m.group(3)),
                Double.parseDouble(m.group(4))));
    }

    private static long size(double value)
    {
        return value > 0 ? Math.max(1L, round(value)) : 0L;
    }

    static long round(double value)
    {
        long magnitude = Math.round(Math.abs(value));
        return value < 0 ? -magnitude : magnitude;
    }
}
