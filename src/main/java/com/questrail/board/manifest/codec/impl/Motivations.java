package com.questrail.board.manifest.codec.impl;

import com.questrail.board.api.BoardItem;
import com.questrail.board.manifest.model.Motivation;

/**
 * Fixed motivation policy of the board encoding.
 *
 * <ul>
 *   <li>item (not a note): {@link Motivation#PAINTING}</li>
 *   <li>note: {@link Motivation#COMMENTING}</li>
 *   <li>connection: {@link Motivation#LINKING}</li>
 * </ul>
 */
public final class Motivations
{
    private Motivations() {}

    public static Motivation forItem(BoardItem item)
    {
        return item.note() ? Motivation.COMMENTING : Motivation.PAINTING;
    }

    public static Motivation forConnection()
    {
        return Motivation.LINKING;
    }
}
