package com.questrail.board.manifest.json;

/**
 * Indicates that input could not be read as a manifest at all.
 *
 * This covers only:
 * <ul>
 *   <li>Text that is not valid JSON</li>
 *   <li>A JSON root that is not an object</li>
 *   <li>I/O failure while reading a stream</li>
 * </ul>
 *
 * Missing or oddly shaped fields inside a manifest object are normalized, never
 * reported through this exception.
 */
public final class ManifestReadException extends RuntimeException
{
    public ManifestReadException(String message) {
        super(message);
    }

    public ManifestReadException(String message, Throwable cause) {
        super(message, cause);
    }
}
