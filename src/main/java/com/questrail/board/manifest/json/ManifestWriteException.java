package com.questrail.board.manifest.json;

/**
 * Indicates that a manifest could not be serialized or written out.
 */
public final class ManifestWriteException extends RuntimeException
{
    public ManifestWriteException(String message, Throwable cause) {
        super(message, cause);
    }
}
