package com.questrail.board.manifest.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.questrail.board.manifest.model.Annotation;
import com.questrail.board.manifest.model.AnnotationBody;
import com.questrail.board.manifest.model.AnnotationPage;
import com.questrail.board.manifest.model.BoardMarker;
import com.questrail.board.manifest.model.BoardViewport;
import com.questrail.board.manifest.model.Canvas;
import com.questrail.board.manifest.model.ConnectionMetadata;
import com.questrail.board.manifest.model.ExtensionRecord;
import com.questrail.board.manifest.model.ForeignExtension;
import com.questrail.board.manifest.model.GroupMetadata;
import com.questrail.board.manifest.model.LanguageMap;
import com.questrail.board.manifest.model.Manifest;
import com.questrail.board.manifest.model.Range;
import com.questrail.board.manifest.model.RangeMember;
import com.questrail.board.manifest.model.SpecificResource;
import com.questrail.board.manifest.model.TextualBody;
import com.questrail.board.manifest.model.ViewingDirection;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * ManifestJsonReader
 * -----------------------------------------------------------------------------
 * Reads manifest JSON into the document model, normalizing shape on entry.
 *
 * <h2>Normalization</h2>
 * Manifests may be hand-edited or produced by unrelated tools, so every field
 * is read leniently and mapped to one canonical shape:
 * <ul>
 *   <li>A missing field becomes an empty default ({@code ""}, empty list,
 *       empty {@link LanguageMap})</li>
 *   <li>A field that may hold one value or an array of them is always read as
 *       a list ({@code items}, {@code body}, {@code service}, ...); single-value
 *       fields such as {@code body} and {@code motivation} take the first entry</li>
 *   <li>Labels: a bare string, a language map whose values are strings or
 *       lists, or an array of such maps all become a {@link LanguageMap}</li>
 *   <li>Targets given as a {@code SpecificResource} with a fragment selector
 *       are flattened to {@code source#selector}</li>
 *   <li>Entries of {@code items} that are not canvases are ignored</li>
 * </ul>
 *
 * <h2>Failures</h2>
 * Only input that is not a JSON object raises {@link ManifestReadException}.
 */
public final class ManifestJsonReader
{
    private final ObjectMapper om;

    public ManifestJsonReader()
    {
        this(ManifestObjectMappers.create());
    }

    public ManifestJsonReader(ObjectMapper om)
    {
        this.om = Objects.requireNonNull(om, "om");
    }

    public Manifest read(String json)
    {
        Objects.requireNonNull(json, "json");
        try {
            return fromTree(om.readTree(json));
        } catch (JsonProcessingException e) {
            throw new ManifestReadException("Manifest is not valid JSON", e);
        }
    }

    public Manifest read(InputStream in)
    {
        Objects.requireNonNull(in, "in");
        try {
            return fromTree(om.readTree(in));
        } catch (IOException e) {
            throw new ManifestReadException("Failed to read manifest JSON", e);
        }
    }

    public Manifest fromTree(JsonNode root)
    {
        if (root == null || !root.isObject()) {
            throw new ManifestReadException("Manifest JSON root must be an object");
        }

        List<Canvas> canvases = new ArrayList<>();
        for (JsonNode node : elements(root.path("items"))) {
            if (node.isObject() && isTypeOrUntyped(node, Canvas.TYPE)) {
                canvases.add(canvas(node));
            }
        }

        List<String> behavior = new ArrayList<>();
        for (JsonNode node : elements(root.path("behavior"))) {
            if (node.isTextual()) {
                behavior.add(node.asText());
            }
        }

        ViewingDirection viewingDirection =
                ViewingDirection.fromValue(text(root.path("viewingDirection"))).orElse(null);

        List<Range> structures = new ArrayList<>();
        for (JsonNode node : elements(root.path("structures"))) {
            if (node.isObject()) {
                structures.add(range(node));
            }
        }

        return new Manifest(
                text(root.path("id")),
                languageMap(root.path("label")),
                canvases,
                behavior,
                viewingDirection,
                structures,
                service(root.path("service")));
    }

    // ========================================================================
    // Containers
    // ========================================================================

    private Canvas canvas(JsonNode node)
    {
        return new Canvas(
                text(node.path("id")),
                languageMap(node.path("label")),
                node.path("width").asInt(0),
                node.path("height").asInt(0),
                pages(node.path("items")),
                pages(node.path("annotations")));
    }

    private List<AnnotationPage> pages(JsonNode node)
    {
        List<AnnotationPage> pages = new ArrayList<>();
        for (JsonNode page : elements(node)) {
            if (!page.isObject()) {
                continue;
            }
            List<Annotation> annotations = new ArrayList<>();
            for (JsonNode annotation : elements(page.path("items"))) {
                if (annotation.isObject()) {
                    annotations.add(annotation(annotation));
                }
            }
            pages.add(new AnnotationPage(text(page.path("id")), annotations));
        }
        return pages;
    }

    private Annotation annotation(JsonNode node)
    {
        AnnotationBody body = null;
        for (JsonNode candidate : elements(node.path("body"))) {
            body = body(candidate);
            if (body != null) {
                break;
            }
        }
        return new Annotation(
                text(node.path("id")),
                firstText(node.path("motivation")),
                body,
                target(node.path("target")),
                service(node.path("service")));
    }

    private AnnotationBody body(JsonNode node)
    {
        if (!node.isObject()) {
            return null;
        }
        String type = text(node.path("type"));
        JsonNode value = node.path("value");
        if (TextualBody.TYPE.equals(type) || value.isTextual()) {
            return new TextualBody(text(value), textOrNull(node.path("format")));
        }

        // SpecificResource: source may be an id string or an object with an id.
        // Any other resource body is referenced by its own id.
        JsonNode source = node.path("source");
        String sourceId = source.isObject() ? text(source.path("id")) : text(source);
        if (sourceId.isEmpty()) {
            sourceId = text(node.path("id"));
        }
        if (sourceId.isEmpty()) {
            return null;
        }
        return new SpecificResource(sourceId, languageMap(node.path("label")));
    }

    private String target(JsonNode node)
    {
        List<JsonNode> targets = elements(node);
        if (targets.isEmpty()) {
            return "";
        }
        JsonNode first = targets.get(0);
        if (first.isTextual()) {
            return first.asText();
        }
        if (!first.isObject()) {
            return "";
        }

        JsonNode source = first.path("source");
        String sourceId = source.isObject() ? text(source.path("id")) : text(source);
        if (sourceId.isEmpty()) {
            return text(first.path("id"));
        }
        for (JsonNode selector : elements(first.path("selector"))) {
            String value = text(selector.path("value"));
            if (!value.isEmpty()) {
                return sourceId + "#" + value;
            }
        }
        return sourceId;
    }

    private Range range(JsonNode node)
    {
        List<RangeMember> members = new ArrayList<>();
        for (JsonNode member : elements(node.path("items"))) {
            String id = member.isTextual() ? member.asText() : text(member.path("id"));
            if (!id.isEmpty()) {
                members.add(new RangeMember(id, textOrNull(member.path("type"))));
            }
        }
        return new Range(
                text(node.path("id")),
                text(node.path("type")),
                languageMap(node.path("label")),
                members,
                service(node.path("service")));
    }

    private List<ExtensionRecord> service(JsonNode node)
    {
        List<ExtensionRecord> records = new ArrayList<>();
        for (JsonNode entry : elements(node)) {
            if (!entry.isObject()) {
                continue;
            }
            String id = text(entry.path("id"));
            if (id.isEmpty()) {
                id = text(entry.path("@id"));
            }
            String type = text(entry.path("type"));
            if (type.isEmpty()) {
                type = text(entry.path("@type"));
            }

            switch (type) {
                case BoardMarker.TYPE -> records.add(new BoardMarker(id));
                case BoardViewport.TYPE -> records.add(new BoardViewport(id,
                        number(entry.path("x")),
                        number(entry.path("y")),
                        number(entry.path("zoom"))));
                case ConnectionMetadata.TYPE -> records.add(new ConnectionMetadata(id,
                        textOrNull(entry.path("fromAnchor")),
                        textOrNull(entry.path("toAnchor")),
                        textOrNull(entry.path("style")),
                        textOrNull(entry.path("color")),
                        textOrNull(entry.path("label"))));
                case GroupMetadata.TYPE -> records.add(new GroupMetadata(id,
                        textOrNull(entry.path("color"))));
                default -> records.add(new ForeignExtension(id, type));
            }
        }
        return records;
    }

    // ========================================================================
    // Values
    // ========================================================================

    /**
     * Normalizes the closed set of label shapes to a {@link LanguageMap}.
     */
    static LanguageMap languageMap(JsonNode node)
    {
        if (node.isTextual()) {
            return node.asText().isEmpty()
                    ? LanguageMap.empty()
                    : LanguageMap.of(LanguageMap.NO_LANGUAGE, node.asText());
        }
        if (node.isArray()) {
            LanguageMap merged = LanguageMap.empty();
            for (JsonNode element : node) {
                merged = merged.merge(languageMap(element));
            }
            return merged;
        }
        if (!node.isObject()) {
            return LanguageMap.empty();
        }

        Map<String, List<String>> values = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            List<String> strings = new ArrayList<>();
            for (JsonNode value : elements(field.getValue())) {
                if (value.isTextual()) {
                    strings.add(value.asText());
                }
            }
            values.put(field.getKey(), strings);
        }
        return LanguageMap.of(values);
    }

    /**
     * Returns the node's elements if it is an array, the node itself if it is
     * any other present value, and nothing if it is missing or null.
     */
    static List<JsonNode> elements(JsonNode node)
    {
        if (node == null || node.isMissingNode() || node.isNull()) {
            return List.of();
        }
        if (!node.isArray()) {
            return List.of(node);
        }
        List<JsonNode> out = new ArrayList<>(node.size());
        node.forEach(out::add);
        return out;
    }

    private static boolean isTypeOrUntyped(JsonNode node, String type)
    {
        JsonNode t = node.path("type");
        return t.isMissingNode() || type.equals(t.asText());
    }

    private static String text(JsonNode node)
    {
        return node.isTextual() ? node.asText() : "";
    }

    private static String textOrNull(JsonNode node)
    {
        return node.isTextual() ? node.asText() : null;
    }

    private static String firstText(JsonNode node)
    {
        for (JsonNode element : elements(node)) {
            if (element.isTextual()) {
                return element.asText();
            }
        }
        return "";
    }

    private static Double number(JsonNode node)
    {
        return node.isNumber() ? node.asDouble() : null;
    }
}
