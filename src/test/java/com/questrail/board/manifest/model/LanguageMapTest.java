package com.questrail.board.manifest.model;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class LanguageMapTest
{
    @Test
    void lookupIsExactPerLanguage()
    {
        LanguageMap map = LanguageMap.of("de", "Tafel");

        assertEquals("Tafel", map.get("de").orElseThrow());
        assertTrue(map.get("en").isEmpty());
        assertTrue(map.firstOf(List.of("en", "fr")).isEmpty());
        assertEquals("Tafel", map.firstOf(List.of("en", "de")).orElseThrow());
    }

    @Test
    void anyValueFollowsInsertionOrder()
    {
        Map<String, List<String>> values = new LinkedHashMap<>();
        values.put("fr", List.of("Tableau"));
        values.put("en", List.of("Board"));

        assertEquals("Tableau", LanguageMap.of(values).anyValue().orElseThrow());
        assertTrue(LanguageMap.empty().anyValue().isEmpty());
    }

    @Test
    void emptyValueListsAreDropped()
    {
        Map<String, List<String>> values = new LinkedHashMap<>();
        values.put("en", List.of());

        assertTrue(LanguageMap.of(values).isEmpty());
        assertSame(LanguageMap.empty(), LanguageMap.of(values));
    }

    @Test
    void mergeAppendsPerLanguage()
    {
        LanguageMap merged = LanguageMap.of("en", "A")
                .merge(LanguageMap.of("en", "B"))
                .merge(LanguageMap.of("none", "C"));

        assertEquals(List.of("A", "B"), merged.asMap().get("en"));
        assertEquals(List.of("C"), merged.asMap().get("none"));
        assertEquals(merged, merged.merge(LanguageMap.empty()));
    }
}
