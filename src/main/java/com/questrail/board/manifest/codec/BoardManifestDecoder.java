package com.questrail.board.manifest.codec;

import com.questrail.board.api.BoardState;
import com.questrail.board.manifest.model.Manifest;

/**
 * BoardManifestDecoder
 * -----------------------------------------------------------------------------
 * Inbound boundary: reconstructs a {@link BoardState} from a {@link Manifest}.
 *
 * <p>The manifest may have been written by the board encoder, edited by hand,
 * or produced by an unrelated tool. Decoding therefore degrades by omission:
 * whatever cannot be mapped is skipped, and the decoder never throws because
 * of manifest content.</p>
 *
 * <p>The decoder is <strong>not</strong> responsible for deciding whether a
 * manifest should be offered as a board; see {@code BoardDiscovery}.</p>
 */
public interface BoardManifestDecoder
{
    /**
     * Decodes a manifest.
     *
     * @param manifest manifest to read
     * @return the decoded board; empty (with the manifest's viewport) when the
     *         manifest has no canvas
     */
    BoardState decode(Manifest manifest);
}
