package com.questrail.board.manifest.model;

import java.util.List;
import java.util.Objects;

/**
 * An ordered collection of annotations.
 */
public record AnnotationPage(String id, List<Annotation> items)
{
    public static final String TYPE = "AnnotationPage";

    public AnnotationPage {
        Objects.requireNonNull(id, "id");
        items = items == null ? List.of() : List.copyOf(items);
    }

    public boolean isEmpty() {
        return items.isEmpty();
    }
}
