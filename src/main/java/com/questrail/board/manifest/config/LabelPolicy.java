package com.questrail.board.manifest.config;

import com.questrail.board.manifest.model.LanguageMap;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Localization policy for labels.
 *
 * @param writeLanguage  language tag used for every label the encoder writes
 * @param readLanguages  languages consulted, in order, when the decoder reads a label
 * @param anyLanguage    whether the decoder may fall back to a value in any
 *                       other language once {@code readLanguages} are exhausted
 */
public record LabelPolicy(
    String writeLanguage,
    List<String> readLanguages,
    boolean anyLanguage
) {
    public LabelPolicy {
        Objects.requireNonNull(writeLanguage, "writeLanguage");
        readLanguages = List.copyOf(Objects.requireNonNull(readLanguages, "readLanguages"));
    }

    /**
     * Writes and reads English only.
     */
    public static LabelPolicy defaults() {
        return strict("en");
    }

    /**
     * Writes and reads exactly one language, without fallback.
     */
    public static LabelPolicy strict(String language) {
        return new LabelPolicy(language, List.of(language), false);
    }

    /**
     * Resolves a label according to this policy.
     */
    public Optional<String> read(LanguageMap label) {
        Optional<String> value = label.firstOf(readLanguages);
        if (value.isPresent() || !anyLanguage) {
            return value;
        }
        return label.anyValue();
    }

    /**
     * Wraps a string in a single-language map using {@link #writeLanguage()}.
     */
    public LanguageMap write(String value) {
        return LanguageMap.of(writeLanguage, value);
    }
}
