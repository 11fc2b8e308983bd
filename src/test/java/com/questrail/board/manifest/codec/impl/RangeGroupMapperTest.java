package com.questrail.board.manifest.codec.impl;

import com.questrail.board.api.BoardGroup;
import com.questrail.board.api.BoardItem;
import com.questrail.board.manifest.config.LabelPolicy;
import com.questrail.board.manifest.model.GroupMetadata;
import com.questrail.board.manifest.model.LanguageMap;
import com.questrail.board.manifest.model.Range;
import com.questrail.board.manifest.model.RangeMember;
import com.questrail.board.manifest.observability.RecordingObservabilitySink;
import com.questrail.board.manifest.observability.UnresolvedReferenceEvent;
import com.questrail.board.mapping.BoardIdentifierIndex;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class RangeGroupMapperTest
{
    private static final String DOC = "https://example.org/board/1";

    private final RecordingObservabilitySink sink = new RecordingObservabilitySink();
    private final RangeGroupMapper mapper = new RangeGroupMapper(LabelPolicy.defaults(), sink);

    private final BoardIdentifierIndex index = BoardIdentifierIndex.of(List.of(
            BoardItem.resource("i1", "https://example.org/canvas/1", 0, 0, 10, 10, "Canvas", "One"),
            BoardItem.resource("i2", "https://example.org/canvas/2", 20, 0, 10, 10, "Canvas", "Two")));

    @Test
    void rangeIdRoundTripsThroughGroupId()
    {
        String rangeId = RangeGroupMapper.rangeId(DOC, "g1");
        assertEquals(DOC + "/range/g1", rangeId);
        assertEquals("g1", RangeGroupMapper.groupId(rangeId));
    }

    @Test
    void groupIdUsesLastRangeSegmentOrWholeId()
    {
        assertEquals("g", RangeGroupMapper.groupId("https://x/range/a/range/g"));
        assertEquals("https://x/toc/1", RangeGroupMapper.groupId("https://x/toc/1"));
        assertEquals("https://x/range/", RangeGroupMapper.groupId("https://x/range/"));
    }

    @Test
    void toRangeWritesResourceIdsAndColor()
    {
        BoardGroup group = new BoardGroup("g1", "Sources", List.of("i2", "i1"), "#123456");

        Range range = mapper.toRange(DOC, group, index);

        assertEquals(DOC + "/range/g1", range.id());
        assertTrue(range.isRange());
        assertEquals(LanguageMap.of("en", "Sources"), range.label());
        assertEquals(List.of(
                RangeMember.canvas("https://example.org/canvas/2"),
                RangeMember.canvas("https://example.org/canvas/1")), range.items());
        assertEquals(List.of(new GroupMetadata(DOC + "/range/g1/meta", "#123456")), range.service());
    }

    @Test
    void toRangeDropsMembersNoLongerOnTheBoard()
    {
        Range range = mapper.toRange(DOC, BoardGroup.of("g1", "G", List.of("i1", "gone")), index);

        assertEquals(1, range.items().size());
        assertTrue(range.service().isEmpty());
        UnresolvedReferenceEvent event = sink.eventsOfType(UnresolvedReferenceEvent.class).get(0);
        assertEquals("gone", event.resourceId());
        assertEquals(UnresolvedReferenceEvent.Outcome.DROPPED, event.outcome());
    }

    @Test
    void toGroupResolvesMembersAndDefaultsLabel()
    {
        Range range = new Range(DOC + "/range/g9", Range.TYPE, LanguageMap.of("de", "Quellen"),
                List.of(RangeMember.canvas("https://example.org/canvas/1"),
                        RangeMember.canvas("https://example.org/canvas/404")),
                List.of());

        BoardGroup group = mapper.toGroup(range, index).orElseThrow();

        assertEquals("g9", group.id());
        assertEquals("Group", group.label());
        assertEquals(List.of("i1"), group.itemIds());
        assertNull(group.color());
        assertEquals(1, sink.eventsOfType(UnresolvedReferenceEvent.class).size());
    }

    @Test
    void nonRangeStructuresAreIgnored()
    {
        Range other = new Range(DOC + "/toc", "Collection", null, null, null);
        assertTrue(mapper.toGroup(other, index).isEmpty());
    }
}
