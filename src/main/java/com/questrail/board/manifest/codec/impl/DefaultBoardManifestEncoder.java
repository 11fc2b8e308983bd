package com.questrail.board.manifest.codec.impl;

import com.questrail.board.api.BoardGroup;
import com.questrail.board.api.BoardItem;
import com.questrail.board.api.BoardState;
import com.questrail.board.api.Connection;
import com.questrail.board.api.Rect;
import com.questrail.board.manifest.codec.BoardManifestEncoder;
import com.questrail.board.manifest.config.BoardCodecConfig;
import com.questrail.board.manifest.config.EncodeOptions;
import com.questrail.board.manifest.config.LabelPolicy;
import com.questrail.board.manifest.model.Annotation;
import com.questrail.board.manifest.model.AnnotationPage;
import com.questrail.board.manifest.model.Canvas;
import com.questrail.board.manifest.model.ExtensionRecord;
import com.questrail.board.manifest.model.LanguageMap;
import com.questrail.board.manifest.model.Manifest;
import com.questrail.board.manifest.model.Range;
import com.questrail.board.manifest.model.SpecificResource;
import com.questrail.board.manifest.model.TextualBody;
import com.questrail.board.manifest.observability.BoardCodecObservabilitySink;
import com.questrail.board.manifest.observability.CodecPassCompletedEvent;
import com.questrail.board.manifest.observability.ConnectionDroppedEvent;
import com.questrail.board.manifest.observability.PlacementAdjustedEvent;
import com.questrail.board.mapping.BoardIdentifierIndex;
import com.questrail.board.mapping.IdentifierIndex;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * DefaultBoardManifestEncoder
 * -----------------------------------------------------------------------------
 * Concrete implementation of {@link BoardManifestEncoder}.
 *
 * <p>The encoder performs the following steps, in order:</p>
 * <ol>
 *   <li>Derive the surface canvas id and its page ids from the document id</li>
 *   <li>Map each item to a painting annotation; an item the selector cannot
 *       place exactly (negative position, sub-pixel size) is reported</li>
 *   <li>Map each note to a commenting annotation</li>
 *   <li>Map each connection to a linking annotation, resolving endpoints to
 *       resource ids and dropping connections that cannot be resolved</li>
 *   <li>Assemble the surface canvas; the supplementing page is attached only
 *       when it has annotations</li>
 *   <li>Assemble the manifest: label, surface, pass-through options, root
 *       extension records and, if there are groups, structures</li>
 * </ol>
 *
 * <p>Derived ids:</p>
 * <ul>
 *   <li>surface: {@code <documentId>/surface}</li>
 *   <li>painting page: {@code <surfaceId>/items/painting}</li>
 *   <li>supplementing page: {@code <surfaceId>/annotations/supplementing}</li>
 *   <li>annotations reuse the item or connection id</li>
 * </ul>
 */
public final class DefaultBoardManifestEncoder implements BoardManifestEncoder
{
    static final String SURFACE_SUFFIX = "/surface";
    static final String PAINTING_PAGE_SUFFIX = "/items/painting";
    static final String SUPPLEMENTING_PAGE_SUFFIX = "/annotations/supplementing";
    static final String SURFACE_LABEL_SUFFIX = " - Board Surface";

    private final LabelPolicy labelPolicy;
    private final BoardCodecObservabilitySink sink;
    private final RangeGroupMapper groups;

    public DefaultBoardManifestEncoder()
    {
        this(BoardCodecConfig.defaults());
    }

    public DefaultBoardManifestEncoder(BoardCodecConfig config)
    {
        Objects.requireNonNull(config, "config");
        this.labelPolicy = config.labelPolicy();
        this.sink = config.observabilitySink();
        this.groups = new RangeGroupMapper(labelPolicy, sink);
    }

    /**
     * @return the id of the surface canvas of a board manifest
     */
    public static String surfaceId(String documentId)
    {
        return documentId + SURFACE_SUFFIX;
    }

    @Override
    public Manifest encode(BoardState state, String documentId, String title, EncodeOptions options)
    {
        Objects.requireNonNull(state, "state");
        Objects.requireNonNull(documentId, "documentId");
        Objects.requireNonNull(title, "title");
        Objects.requireNonNull(options, "options");

        // 1) Derived ids
        final String surfaceId = surfaceId(documentId);
        final String paintingPageId = surfaceId + PAINTING_PAGE_SUFFIX;
        final String supplementingPageId = surfaceId + SUPPLEMENTING_PAGE_SUFFIX;

        final IdentifierIndex index = BoardIdentifierIndex.of(state.items());

        // 2) + 3) Items and notes
        List<Annotation> painting = new ArrayList<>();
        List<Annotation> notes = new ArrayList<>();
        for (BoardItem item : state.items()) {
            if (item.note()) {
                notes.add(encodeNote(item, surfaceId));
            } else {
                painting.add(encodeItem(item, surfaceId));
            }
        }

        // 4) Connections
        List<Annotation> links = new ArrayList<>();
        for (Connection connection : state.connections()) {
            encodeConnection(connection, index).ifPresent(links::add);
        }

        // 5) Surface canvas; connections first, then notes
        List<Annotation> supplementing = new ArrayList<>(links.size() + notes.size());
        supplementing.addAll(links);
        supplementing.addAll(notes);

        List<AnnotationPage> supplementingPages = supplementing.isEmpty()
                ? List.of()
                : List.of(new AnnotationPage(supplementingPageId, supplementing));

        Canvas surface = new Canvas(
                surfaceId,
                labelPolicy.write(title + SURFACE_LABEL_SUFFIX),
                Canvas.SURFACE_WIDTH,
                Canvas.SURFACE_HEIGHT,
                List.of(new AnnotationPage(paintingPageId, painting)),
                supplementingPages);

        // 6) Manifest
        List<Range> structures = new ArrayList<>(state.groups().size());
        for (BoardGroup group : state.groups()) {
            structures.add(groups.toRange(documentId, group, index));
        }

        List<ExtensionRecord> service = ExtensionRecords.rootRecords(documentId, state.viewport());

        Manifest manifest = new Manifest(
                documentId,
                labelPolicy.write(title),
                List.of(surface),
                options.behavior(),
                options.viewingDirection(),
                structures,
                service);

        sink.onPassCompleted(new CodecPassCompletedEvent(
                CodecPassCompletedEvent.Direction.ENCODE,
                documentId,
                painting.size() + notes.size(),
                links.size(),
                structures.size()));

        return manifest;
    }

    private Annotation encodeItem(BoardItem item, String surfaceId)
    {
        LanguageMap label = item.label().isEmpty() ? LanguageMap.empty() : labelPolicy.write(item.label());
        return new Annotation(
                item.id(),
                Motivations.forItem(item),
                new SpecificResource(item.resourceId(), label),
                placement(item, surfaceId));
    }

    private Annotation encodeNote(BoardItem item, String surfaceId)
    {
        return new Annotation(
                item.id(),
                Motivations.forItem(item),
                TextualBody.plain(item.annotation()),
                placement(item, surfaceId));
    }

    private String placement(BoardItem item, String surfaceId)
    {
        Rect bounds = item.bounds();
        if (FragmentSelectors.isAdjusted(bounds)) {
            sink.onPlacementAdjusted(new PlacementAdjustedEvent(
                    item.id(), bounds, FragmentSelectors.encodeRect(bounds)));
        }
        return FragmentSelectors.target(surfaceId, bounds);
    }

    private Optional<Annotation> encodeConnection(Connection connection, IdentifierIndex index)
    {
        if (!index.containsSession(connection.fromId()) || !index.containsSession(connection.toId())) {
            sink.onConnectionDropped(new ConnectionDroppedEvent(
                    connection.id(), ConnectionDroppedEvent.Reason.DANGLING_ENDPOINT));
            return Optional.empty();
        }
        if (connection.isSelfReferential()) {
            sink.onConnectionDropped(new ConnectionDroppedEvent(
                    connection.id(), ConnectionDroppedEvent.Reason.SELF_REFERENCE));
            return Optional.empty();
        }

        SpecificResource body = new SpecificResource(
                index.toResourceId(connection.toId()),
                labelPolicy.write(ConnectionTypeLabels.labelOf(connection.type())));

        Annotation annotation = new Annotation(
                connection.id(),
                Motivations.forConnection(),
                body,
                index.toResourceId(connection.fromId()));

        return Optional.of(ExtensionRecords.connectionMetadata(connection)
                .map(meta -> annotation.withService(List.of(meta)))
                .orElse(annotation));
    }
}
