package com.questrail.board.manifest.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * LanguageMap
 * -----------------------------------------------------------------------------
 * A localized text value: language tag -> list of strings, e.g.
 * {@code {"en": ["Board"]}}.
 *
 * <p>This is the single canonical shape used throughout the document model.
 * The looser shapes found in hand-written manifests (a bare string, a single
 * string per language, an array of maps) are normalized into a
 * {@code LanguageMap} by the JSON reader, so nothing downstream re-checks shape.</p>
 *
 * <p>Lookups never fall back across languages on their own. Which languages to
 * try, and whether any language will do, is decided by the caller.</p>
 */
public final class LanguageMap
{
    /** Language key for values that have no language. */
    public static final String NO_LANGUAGE = "none";

    private static final LanguageMap EMPTY = new LanguageMap(Map.of());

    private final Map<String, List<String>> values;

    private LanguageMap(Map<String, List<String>> values) {
        this.values = values;
    }

    public static LanguageMap empty() {
        return EMPTY;
    }

    /**
     * Creates a map holding a single value in a single language.
     */
    public static LanguageMap of(String language, String value) {
        Objects.requireNonNull(language, "language");
        Objects.requireNonNull(value, "value");
        return new LanguageMap(Map.of(language, List.of(value)));
    }

    /**
     * Creates a map from language -> values entries. Entries with no values are
     * dropped and iteration order is kept.
     */
    public static LanguageMap of(Map<String, List<String>> values) {
        Objects.requireNonNull(values, "values");
        Map<String, List<String>> copy = new LinkedHashMap<>();
        values.forEach((language, strings) -> {
            if (language != null && strings != null && !strings.isEmpty()) {
                copy.put(language, List.copyOf(strings));
            }
        });
        return copy.isEmpty() ? EMPTY : new LanguageMap(Collections.unmodifiableMap(copy));
    }

    /**
     * Returns a map holding the values of both maps. Values of {@code other}
     * are appended after this map's values for the same language.
     */
    public LanguageMap merge(LanguageMap other) {
        Objects.requireNonNull(other, "other");
        if (other.isEmpty()) {
            return this;
        }
        if (isEmpty()) {
            return other;
        }
        Map<String, List<String>> merged = new LinkedHashMap<>();
        values.forEach((language, strings) -> merged.put(language, new ArrayList<>(strings)));
        other.values.forEach((language, strings) ->
                merged.computeIfAbsent(language, k -> new ArrayList<>()).addAll(strings));
        return of(merged);
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    /**
     * Returns the first value recorded for exactly this language.
     */
    public Optional<String> get(String language) {
        List<String> strings = values.get(language);
        if (strings == null || strings.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(strings.get(0));
    }

    /**
     * Returns the first value of the first language in {@code languages} that
     * has one.
     */
    public Optional<String> firstOf(List<String> languages) {
        for (String language : languages) {
            Optional<String> value = get(language);
            if (value.isPresent()) {
                return value;
            }
        }
        return Optional.empty();
    }

    /**
     * Returns the first value of whichever language was recorded first.
     */
    public Optional<String> anyValue() {
        for (List<String> strings : values.values()) {
            if (!strings.isEmpty()) {
                return Optional.of(strings.get(0));
            }
        }
        return Optional.empty();
    }

    /**
     * Returns an unmodifiable language -> values view.
     */
    public Map<String, List<String>> asMap() {
        return values;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof LanguageMap that)) return false;
        return values.equals(that.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "LanguageMap" + values;
    }
}
