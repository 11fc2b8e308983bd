package com.questrail.board.manifest.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.questrail.board.manifest.model.Annotation;
import com.questrail.board.manifest.model.AnnotationBody;
import com.questrail.board.manifest.model.AnnotationPage;
import com.questrail.board.manifest.model.BoardViewport;
import com.questrail.board.manifest.model.Canvas;
import com.questrail.board.manifest.model.ConnectionMetadata;
import com.questrail.board.manifest.model.ExtensionRecord;
import com.questrail.board.manifest.model.GroupMetadata;
import com.questrail.board.manifest.model.LanguageMap;
import com.questrail.board.manifest.model.Manifest;
import com.questrail.board.manifest.model.Range;
import com.questrail.board.manifest.model.RangeMember;
import com.questrail.board.manifest.model.SpecificResource;
import com.questrail.board.manifest.model.TextualBody;

import java.io.IOException;
import java.io.OutputStream;
import java.util.List;
import java.util.Objects;

/**
 * ManifestJsonWriter
 * -----------------------------------------------------------------------------
 * Serializes a {@link Manifest} to IIIF Presentation 3 JSON.
 *
 * <p>Optional containers are left out rather than written empty:</p>
 * <ul>
 *   <li>{@code annotations} on a canvas without supplementing pages</li>
 *   <li>{@code structures}, {@code behavior}, {@code service} when empty</li>
 *   <li>a body {@code label} when the label is empty</li>
 * </ul>
 */
public final class ManifestJsonWriter
{
    public static final String PRESENTATION_CONTEXT = "http://iiif.io/api/presentation/3/context.json";

    private final ObjectMapper om;

    public ManifestJsonWriter()
    {
        this(ManifestObjectMappers.create());
    }

    public ManifestJsonWriter(ObjectMapper om)
    {
        this.om = Objects.requireNonNull(om, "om");
    }

    public String write(Manifest manifest)
    {
        try {
            return om.writeValueAsString(toTree(manifest));
        } catch (JsonProcessingException e) {
            throw new ManifestWriteException("Failed to serialize manifest " + manifest.id(), e);
        }
    }

    public void write(Manifest manifest, OutputStream out)
    {
        try {
            om.writeValue(out, toTree(manifest));
        } catch (IOException e) {
            throw new ManifestWriteException("Failed to write manifest " + manifest.id(), e);
        }
    }

    public ObjectNode toTree(Manifest manifest)
    {
        Objects.requireNonNull(manifest, "manifest");

        ObjectNode n = om.createObjectNode();
        n.put("@context", PRESENTATION_CONTEXT);
        n.put("id", manifest.id());
        n.put("type", Manifest.TYPE);
        n.set("label", languageMap(manifest.label()));

        ArrayNode items = n.putArray("items");
        for (Canvas canvas : manifest.items()) {
            items.add(canvas(canvas));
        }

        if (!manifest.behavior().isEmpty()) {
            ArrayNode behavior = n.putArray("behavior");
            manifest.behavior().forEach(behavior::add);
        }
        manifest.viewingDirectionValue().ifPresent(d -> n.put("viewingDirection", d.value()));

        if (!manifest.structures().isEmpty()) {
            ArrayNode structures = n.putArray("structures");
            for (Range range : manifest.structures()) {
                structures.add(range(range));
            }
        }
        putService(n, manifest.service());
        return n;
    }

    // ========================================================================
    // Containers
    // ========================================================================

    private ObjectNode canvas(Canvas canvas)
    {
        ObjectNode n = om.createObjectNode();
        n.put("id", canvas.id());
        n.put("type", Canvas.TYPE);
        n.set("label", languageMap(canvas.label()));
        n.put("width", canvas.width());
        n.put("height", canvas.height());

        ArrayNode items = n.putArray("items");
        for (AnnotationPage page : canvas.items()) {
            items.add(page(page));
        }
        if (!canvas.annotations().isEmpty()) {
            ArrayNode annotations = n.putArray("annotations");
            for (AnnotationPage page : canvas.annotations()) {
                annotations.add(page(page));
            }
        }
        return n;
    }

    private ObjectNode page(AnnotationPage page)
    {
        ObjectNode n = om.createObjectNode();
        n.put("id", page.id());
        n.put("type", AnnotationPage.TYPE);
        ArrayNode items = n.putArray("items");
        for (Annotation annotation : page.items()) {
            items.add(annotation(annotation));
        }
        return n;
    }

    private ObjectNode annotation(Annotation annotation)
    {
        ObjectNode n = om.createObjectNode();
        n.put("id", annotation.id());
        n.put("type", Annotation.TYPE);
        n.put("motivation", annotation.motivation());
        annotation.bodyValue().ifPresent(body -> n.set("body", body(body)));
        n.put("target", annotation.target());
        putService(n, annotation.service());
        return n;
    }

    private ObjectNode body(AnnotationBody body)
    {
        ObjectNode n = om.createObjectNode();
        n.put("type", body.type());
        if (body instanceof SpecificResource resource) {
            n.put("source", resource.source());
            if (!resource.label().isEmpty()) {
                n.set("label", languageMap(resource.label()));
            }
        }
        else if (body instanceof TextualBody text) {
            n.put("value", text.value());
            n.put("format", text.format());
        }
        return n;
    }

    private ObjectNode range(Range range)
    {
        ObjectNode n = om.createObjectNode();
        n.put("id", range.id());
        n.put("type", range.type());
        n.set("label", languageMap(range.label()));
        ArrayNode items = n.putArray("items");
        for (RangeMember member : range.items()) {
            ObjectNode m = items.addObject();
            m.put("id", member.id());
            m.put("type", member.type());
        }
        putService(n, range.service());
        return n;
    }

    // ========================================================================
    // Values
    // ========================================================================

    private ObjectNode languageMap(LanguageMap map)
    {
        ObjectNode n = om.createObjectNode();
        map.asMap().forEach((language, values) -> {
            ArrayNode strings = n.putArray(language);
            values.forEach(strings::add);
        });
        return n;
    }

    private void putService(ObjectNode owner, List<ExtensionRecord> records)
    {
        if (records.isEmpty()) {
            return;
        }
        ArrayNode service = owner.putArray("service");
        for (ExtensionRecord record : records) {
            service.add(extension(record));
        }
    }

    private ObjectNode extension(ExtensionRecord record)
    {
        ObjectNode n = om.createObjectNode();
        n.put("id", record.id());
        n.put("type", record.type());

        // Markers and foreign records carry nothing beyond id and type.
        if (record instanceof BoardViewport v) {
            putIfPresent(n, "x", v.x());
            putIfPresent(n, "y", v.y());
            putIfPresent(n, "zoom", v.zoom());
        }
        else if (record instanceof ConnectionMetadata m) {
            putIfPresent(n, "fromAnchor", m.fromAnchor());
            putIfPresent(n, "toAnchor", m.toAnchor());
            putIfPresent(n, "style", m.style());
            putIfPresent(n, "color", m.color());
            putIfPresent(n, "label", m.label());
        }
        else if (record instanceof GroupMetadata g) {
            putIfPresent(n, "color", g.color());
        }
        return n;
    }

    private static void putIfPresent(ObjectNode n, String field, Double value)
    {
        if (value != null) {
            n.put(field, value);
        }
    }

    private static void putIfPresent(ObjectNode n, String field, String value)
    {
        if (value != null) {
            n.put(field, value);
        }
    }
}
