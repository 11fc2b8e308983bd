package com.questrail.board.manifest.model;

import java.util.Objects;

/**
 * A body that points at another resource through {@code source}.
 *
 * @param source id of the referenced resource
 * @param label  optional label; empty when absent
 */
public record SpecificResource(String source, LanguageMap label) implements AnnotationBody
{
    public static final String TYPE = "SpecificResource";

    public SpecificResource {
        Objects.requireNonNull(source, "source");
        label = label == null ? LanguageMap.empty() : label;
    }

    @Override
    public String type() {
        return TYPE;
    }
}
