package com.questrail.board.manifest.json;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

/**
 * Factory for the {@link ObjectMapper} used to read and write manifests.
 */
public final class ManifestObjectMappers
{
    private ManifestObjectMappers() {}

    public static ObjectMapper create() {
        ObjectMapper om = new ObjectMapper();
        // Manifests are meant to be read by people as well as viewers.
        om.enable(SerializationFeature.INDENT_OUTPUT);
        // "{...} garbage" is not a manifest.
        om.enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
        return om;
    }
}
