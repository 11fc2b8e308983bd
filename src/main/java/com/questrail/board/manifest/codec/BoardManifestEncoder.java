package com.questrail.board.manifest.codec;

import com.questrail.board.api.BoardState;
import com.questrail.board.manifest.config.EncodeOptions;
import com.questrail.board.manifest.model.Manifest;

/**
 * BoardManifestEncoder
 * -----------------------------------------------------------------------------
 * Outbound boundary: turns a {@link BoardState} snapshot into a complete
 * {@link Manifest}.
 *
 * <p>The encoder is responsible for:</p>
 * <ul>
 *   <li>Placing every item on the surface canvas with a fragment selector</li>
 *   <li>Translating session ids of connection endpoints and group members to
 *       resource ids</li>
 *   <li>Writing viewport, board marker and connection/group metadata as
 *       extension records</li>
 *   <li>Omitting connections whose endpoints are not on the board</li>
 * </ul>
 *
 * <p>Encoding is a pure function of its arguments. The same inputs always give
 * structurally identical manifests; the encoder introduces no ids or
 * randomness of its own beyond ids derived from {@code documentId}.</p>
 */
public interface BoardManifestEncoder
{
    /**
     * Encodes a board.
     *
     * @param state      board to encode
     * @param documentId id of the manifest; every derived id starts with it
     * @param title      manifest label
     * @param options    behavior and viewing direction to pass through
     * @return a freshly built manifest
     */
    Manifest encode(BoardState state, String documentId, String title, EncodeOptions options);

    /**
     * Encodes a board with {@link EncodeOptions#defaults()}.
     */
    default Manifest encode(BoardState state, String documentId, String title) {
        return encode(state, documentId, title, EncodeOptions.defaults());
    }
}
