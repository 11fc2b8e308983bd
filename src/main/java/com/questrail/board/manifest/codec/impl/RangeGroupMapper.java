package com.questrail.board.manifest.codec.impl;

import com.questrail.board.api.BoardGroup;
import com.questrail.board.manifest.config.LabelPolicy;
import com.questrail.board.manifest.model.ExtensionRecord;
import com.questrail.board.manifest.model.Range;
import com.questrail.board.manifest.model.RangeMember;
import com.questrail.board.manifest.observability.BoardCodecObservabilitySink;
import com.questrail.board.manifest.observability.UnresolvedReferenceEvent;
import com.questrail.board.mapping.IdentifierIndex;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * RangeGroupMapper
 * -----------------------------------------------------------------------------
 * Converts board groups to structural ranges and back.
 *
 * <ul>
 *   <li>Range id: {@code <documentId>/range/<groupId>}, so re-encoding a board
 *       yields the same ids</li>
 *   <li>Members are written as resource ids; members whose item is no longer
 *       on the board are left out and the group keeps the rest</li>
 *   <li>On decode, only entries of type {@code Range} become groups, and
 *       members that resolve to no decoded item are dropped</li>
 * </ul>
 */
public final class RangeGroupMapper
{
    static final String RANGE_SEGMENT = "/range/";
    static final String DEFAULT_GROUP_LABEL = "Group";

    private final LabelPolicy labelPolicy;
    private final BoardCodecObservabilitySink sink;

    public RangeGroupMapper(LabelPolicy labelPolicy, BoardCodecObservabilitySink sink)
    {
        this.labelPolicy = Objects.requireNonNull(labelPolicy, "labelPolicy");
        this.sink = Objects.requireNonNull(sink, "sink");
    }

    public static String rangeId(String documentId, String groupId)
    {
        return documentId + RANGE_SEGMENT + groupId;
    }

    /**
     * Recovers a group id from a range id: the part after the last
     * {@code /range/}, or the whole id if there is none.
     */
    public static String groupId(String rangeId)
    {
        int at = rangeId.lastIndexOf(RANGE_SEGMENT);
        if (at < 0) {
            return rangeId;
        }
        String suffix = rangeId.substring(at + RANGE_SEGMENT.length());
        return suffix.isEmpty() ? rangeId : suffix;
    }

    public Range toRange(String documentId, BoardGroup group, IdentifierIndex index)
    {
        String rangeId = rangeId(documentId, group.id());

        List<RangeMember> members = new ArrayList<>(group.itemIds().size());
        for (String itemId : group.itemIds()) {
            if (!index.containsSession(itemId)) {
                sink.onReferenceUnresolved(new UnresolvedReferenceEvent(
                        group.id(), itemId, UnresolvedReferenceEvent.Outcome.DROPPED));
                continue;
            }
            members.add(RangeMember.canvas(index.toResourceId(itemId)));
        }

        List<ExtensionRecord> service = new ArrayList<>(1);
        ExtensionRecords.groupMetadata(rangeId, group).ifPresent(service::add);

        return new Range(rangeId, Range.TYPE, labelPolicy.write(group.label()), members, service);
    }

    /**
     * @return the group, or {@link Optional#empty()} if the entry is not a range
     */
    public Optional<BoardGroup> toGroup(Range range, IdentifierIndex index)
    {
        if (!range.isRange()) {
            return Optional.empty();
        }
        String id = groupId(range.id());

        List<String> itemIds = new ArrayList<>(range.items().size());
        for (RangeMember member : range.items()) {
            if (!index.containsResource(member.id())) {
                sink.onReferenceUnresolved(new UnresolvedReferenceEvent(
                        id, member.id(), UnresolvedReferenceEvent.Outcome.DROPPED));
                continue;
            }
            itemIds.add(index.toSessionId(member.id()));
        }

        String label = labelPolicy.read(range.label()).orElse(DEFAULT_GROUP_LABEL);
        String color = ExtensionRecords.readGroupColor(range.service()).orElse(null);
        return Optional.of(new BoardGroup(id, label, itemIds, color));
    }
}
