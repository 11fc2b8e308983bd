package com.questrail.board.manifest;

import com.questrail.board.manifest.codec.impl.ExtensionRecords;
import com.questrail.board.manifest.model.Manifest;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Picks out the manifests that can be opened as boards.
 *
 * <p>A manifest qualifies if and only if its root carries the board marker
 * record. Shape alone (a single large canvas, linking annotations, ranges) is
 * never enough: foreign manifests look the same.</p>
 */
public final class BoardDiscovery
{
    private BoardDiscovery() {}

    public static boolean isBoard(Manifest manifest)
    {
        return ExtensionRecords.isBoard(Objects.requireNonNull(manifest, "manifest"));
    }

    /**
     * @return the boards among {@code manifests}, in iteration order
     */
    public static List<Manifest> findBoards(Iterable<Manifest> manifests)
    {
        Objects.requireNonNull(manifests, "manifests");
        List<Manifest> boards = new ArrayList<>();
        for (Manifest manifest : manifests) {
            if (manifest != null && ExtensionRecords.isBoard(manifest)) {
                boards.add(manifest);
            }
        }
        return boards;
    }
}
