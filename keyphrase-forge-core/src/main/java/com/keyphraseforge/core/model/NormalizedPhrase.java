package com.keyphraseforge.core.model;

import java.util.Locale;
import java.util.Objects;

/**
 * A candidate phrase in canonical, comparable form.
 *
 * @param canonicalText canonical text (whitespace collapsed, lowercased except acronyms and identifiers)
 * @param originalText text as extracted
 * @param sourceDocumentId id of the source document
 * @param category category of the source document
 */
public record NormalizedPhrase(
    String canonicalText,
    String originalText,
    String sourceDocumentId,
    String category
) {
    /**
     * Compact constructor with validation.
     */
    public NormalizedPhrase {
        Objects.requireNonNull(canonicalText, "canonicalText must not be null");
        Objects.requireNonNull(originalText, "originalText must not be null");
        Objects.requireNonNull(sourceDocumentId, "sourceDocumentId must not be null");
        Objects.requireNonNull(category, "category must not be null");
    }

    /**
     * Returns the case-folded form used for similarity comparisons.
     *
     * @return lowercase canonical text
     */
    public String matchKey() {
        return canonicalText.toLowerCase(Locale.ROOT);
    }

    /**
     * Returns the number of whitespace-separated words.
     *
     * @return word count
     */
    public int wordCount() {
        return canonicalText.isEmpty() ? 0 : canonicalText.split(" ").length;
    }
}
