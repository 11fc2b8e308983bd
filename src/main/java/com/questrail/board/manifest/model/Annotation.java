package com.questrail.board.manifest.model;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Annotation
 * -----------------------------------------------------------------------------
 * A single annotation on a canvas.
 *
 * <h2>Fields</h2>
 * <ul>
 *   <li>{@code motivation} is kept as the raw manifest string so that decoding
 *       can ignore motivations it does not know; see {@link #knownMotivation()}</li>
 *   <li>{@code body} may be {@code null} when the manifest had no body the
 *       codec understands</li>
 *   <li>{@code target} is either {@code <canvasId>#xywh=x,y,w,h} (painting,
 *       commenting) or a bare resource id (linking); it is empty, never
 *       {@code null}, when the manifest target was not a string</li>
 *   <li>{@code service} carries extension records, most notably
 *       {@link ConnectionMetadata}</li>
 * </ul>
 */
public record Annotation(
        String id,
        String motivation,
        AnnotationBody body,
        String target,
        List<ExtensionRecord> service
)
{
    public static final String TYPE = "Annotation";

    public Annotation {
        Objects.requireNonNull(id, "id");
        motivation = motivation == null ? "" : motivation;
        target = target == null ? "" : target;
        service = service == null ? List.of() : List.copyOf(service);
    }

    public Annotation(String id, Motivation motivation, AnnotationBody body, String target) {
        this(id, motivation.value(), body, target, List.of());
    }

    public Optional<Motivation> knownMotivation() {
        return Motivation.fromValue(motivation);
    }

    public Optional<AnnotationBody> bodyValue() {
        return Optional.ofNullable(body);
    }

    public Annotation withService(List<ExtensionRecord> service) {
        return new Annotation(id, motivation, body, target, service);
    }
}
