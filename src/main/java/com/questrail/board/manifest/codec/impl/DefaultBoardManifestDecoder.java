package com.questrail.board.manifest.codec.impl;

import com.questrail.board.api.BoardGroup;
import com.questrail.board.api.BoardItem;
import com.questrail.board.api.BoardState;
import com.questrail.board.api.Connection;
import com.questrail.board.api.NoteLabels;
import com.questrail.board.api.Rect;
import com.questrail.board.api.Viewport;
import com.questrail.board.manifest.codec.BoardManifestDecoder;
import com.questrail.board.manifest.config.BoardCodecConfig;
import com.questrail.board.manifest.config.LabelPolicy;
import com.questrail.board.manifest.model.Annotation;
import com.questrail.board.manifest.model.AnnotationPage;
import com.questrail.board.manifest.model.Canvas;
import com.questrail.board.manifest.model.LanguageMap;
import com.questrail.board.manifest.model.Manifest;
import com.questrail.board.manifest.model.Motivation;
import com.questrail.board.manifest.model.Range;
import com.questrail.board.manifest.model.SpecificResource;
import com.questrail.board.manifest.model.TextualBody;
import com.questrail.board.manifest.observability.AnnotationSkippedEvent;
import com.questrail.board.manifest.observability.BoardCodecObservabilitySink;
import com.questrail.board.manifest.observability.CodecPassCompletedEvent;
import com.questrail.board.manifest.observability.UnresolvedReferenceEvent;
import com.questrail.board.mapping.BoardIdentifierIndex;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * DefaultBoardManifestDecoder
 * -----------------------------------------------------------------------------
 * Concrete implementation of {@link BoardManifestDecoder}.
 *
 * <p>This decoder performs the following steps, in order:</p>
 * <ol>
 *   <li>Viewport from the root extension records (default {@code 0,0,1})</li>
 *   <li>Locate the first canvas; without one, return an empty board</li>
 *   <li>Painting pages: one item per annotation with a parsable selector</li>
 *   <li>Supplementing pages, commenting annotations: one note each</li>
 *   <li>Supplementing pages, linking annotations: one connection each,
 *       endpoints resolved against every item decoded so far</li>
 *   <li>Structures: one group per range</li>
 * </ol>
 *
 * <p>Notes are decoded before connections so that a connection ending on a
 * note resolves like any other. Nothing here throws because of manifest
 * content; each degradation is reported to the observability sink and the
 * decode continues.</p>
 */
public final class DefaultBoardManifestDecoder implements BoardManifestDecoder
{
    static final String ITEM_RESOURCE_TYPE = "Canvas";
    static final String NOTE_RESOURCE_TYPE = "Text";

    private final LabelPolicy labelPolicy;
    private final BoardCodecObservabilitySink sink;
    private final RangeGroupMapper groups;

    public DefaultBoardManifestDecoder()
    {
        this(BoardCodecConfig.defaults());
    }

    public DefaultBoardManifestDecoder(BoardCodecConfig config)
    {
        Objects.requireNonNull(config, "config");
        this.labelPolicy = config.labelPolicy();
        this.sink = config.observabilitySink();
        this.groups = new RangeGroupMapper(labelPolicy, sink);
    }

    @Override
    public BoardState decode(Manifest manifest)
    {
        Objects.requireNonNull(manifest, "manifest");

        // 1) Viewport
        final Viewport viewport = ExtensionRecords.readViewport(manifest.service());

        // 2) Surface canvas; the only short-circuit
        Optional<Canvas> surface = manifest.firstCanvas();
        if (surface.isEmpty()) {
            sink.onPassCompleted(new CodecPassCompletedEvent(
                    CodecPassCompletedEvent.Direction.DECODE, manifest.id(), 0, 0, 0));
            return BoardState.empty(viewport);
        }
        final Canvas canvas = surface.get();
        final BoardIdentifierIndex index = new BoardIdentifierIndex();

        // 3) Items
        List<BoardItem> items = new ArrayList<>();
        for (AnnotationPage page : canvas.items()) {
            for (Annotation annotation : page.items()) {
                decodeItem(annotation).ifPresent(item -> {
                    items.add(item);
                    index.register(item);
                });
            }
        }

        // 4) Notes
        for (AnnotationPage page : canvas.annotations()) {
            for (Annotation annotation : page.items()) {
                Optional<Motivation> motivation = annotation.knownMotivation();
                if (motivation.isEmpty() || motivation.get() == Motivation.PAINTING) {
                    sink.onAnnotationSkipped(new AnnotationSkippedEvent(
                            annotation.id(), AnnotationSkippedEvent.Reason.UNSUPPORTED_MOTIVATION));
                    continue;
                }
                if (motivation.get() == Motivation.COMMENTING) {
                    decodeNote(annotation).ifPresent(note -> {
                        items.add(note);
                        index.register(note);
                    });
                }
            }
        }

        // 5) Connections
        List<Connection> connections = new ArrayList<>();
        for (AnnotationPage page : canvas.annotations()) {
            for (Annotation annotation : page.items()) {
                if (annotation.knownMotivation().orElse(null) == Motivation.LINKING) {
                    decodeConnection(annotation, index).ifPresent(connections::add);
                }
            }
        }

        // 6) Groups
        List<BoardGroup> decodedGroups = new ArrayList<>();
        for (Range range : manifest.structures()) {
            groups.toGroup(range, index).ifPresent(decodedGroups::add);
        }

        sink.onPassCompleted(new CodecPassCompletedEvent(
                CodecPassCompletedEvent.Direction.DECODE,
                manifest.id(),
                items.size(),
                connections.size(),
                decodedGroups.size()));

        return new BoardState(items, connections, decodedGroups, viewport);
    }

    // ========================================================================
    // Items
    // ========================================================================

    private Optional<BoardItem> decodeItem(Annotation annotation)
    {
        Optional<Rect> rect = placement(annotation);
        if (rect.isEmpty()) {
            return Optional.empty();
        }

        // A painting body without a resource reference degrades to an empty one.
        String source = "";
        LanguageMap bodyLabel = LanguageMap.empty();
        if (annotation.body() instanceof SpecificResource resource) {
            source = resource.source();
            bodyLabel = resource.label();
        }

        String fallback = source.isEmpty() ? annotation.id() : source;
        String label = labelPolicy.read(bodyLabel).orElse(fallback);

        Rect r = rect.get();
        return Optional.of(BoardItem.resource(
                annotation.id(), source, r.x(), r.y(), r.w(), r.h(), ITEM_RESOURCE_TYPE, label));
    }

    private Optional<BoardItem> decodeNote(Annotation annotation)
    {
        Optional<Rect> rect = placement(annotation);
        if (rect.isEmpty()) {
            return Optional.empty();
        }

        String text = (annotation.body() instanceof TextualBody body) ? body.value() : "";
        if (text.isEmpty()) {
            sink.onAnnotationSkipped(new AnnotationSkippedEvent(
                    annotation.id(), AnnotationSkippedEvent.Reason.EMPTY_NOTE));
            return Optional.empty();
        }

        Rect r = rect.get();
        return Optional.of(new BoardItem(
                annotation.id(),
                annotation.id(),
                r.x(), r.y(), r.w(), r.h(),
                NOTE_RESOURCE_TYPE,
                NoteLabels.labelFor(text),
                text,
                true));
    }

    private Optional<Rect> placement(Annotation annotation)
    {
        Optional<Rect> rect = FragmentSelectors.decodeRect(annotation.target());
        if (rect.isEmpty()) {
            sink.onAnnotationSkipped(new AnnotationSkippedEvent(
                    annotation.id(), AnnotationSkippedEvent.Reason.UNPARSABLE_SELECTOR));
            return Optional.empty();
        }
        if (!rect.get().hasPositiveSize()) {
            sink.onAnnotationSkipped(new AnnotationSkippedEvent(
                    annotation.id(), AnnotationSkippedEvent.Reason.DEGENERATE_SIZE));
            return Optional.empty();
        }
        return rect;
    }

    // ========================================================================
    // Connections
    // ========================================================================

    private Optional<Connection> decodeConnection(Annotation annotation, BoardIdentifierIndex index)
    {
        String toResource = "";
        LanguageMap typeLabel = LanguageMap.empty();
        if (annotation.body() instanceof SpecificResource resource) {
            toResource = resource.source();
            typeLabel = resource.label();
        }
        String fromResource = annotation.target();

        if (toResource.isEmpty() || fromResource.isEmpty()) {
            sink.onAnnotationSkipped(new AnnotationSkippedEvent(
                    annotation.id(), AnnotationSkippedEvent.Reason.MISSING_ENDPOINT));
            return Optional.empty();
        }

        // The type label is a token rather than prose: any language will do.
        final LanguageMap token = typeLabel;
        String typeToken = labelPolicy.read(token).or(token::anyValue).orElse(null);

        Connection connection = Connection.of(
                annotation.id(),
                resolve(annotation.id(), fromResource, index),
                resolve(annotation.id(), toResource, index),
                ConnectionTypeLabels.typeOf(typeToken));

        return Optional.of(ExtensionRecords.applyConnectionMetadata(connection, annotation.service()));
    }

    private String resolve(String ownerId, String resourceId, BoardIdentifierIndex index)
    {
        if (!index.containsResource(resourceId)) {
            sink.onReferenceUnresolved(new UnresolvedReferenceEvent(
                    ownerId, resourceId, UnresolvedReferenceEvent.Outcome.KEPT_RAW));
        }
        return index.toSessionId(resourceId);
    }
}
