package com.keyphraseforge.core.model;

import java.util.Objects;

/**
 * A raw candidate phrase returned by the extraction step for one document.
 *
 * @param text phrase text exactly as extracted
 * @param sourceDocumentId id of the document it was extracted from
 * @param category category of the source document
 */
public record CandidatePhrase(
    String text,
    String sourceDocumentId,
    String category
) {
    /**
     * Compact constructor with validation.
     */
    public CandidatePhrase {
        Objects.requireNonNull(text, "text must not be null");
        Objects.requireNonNull(sourceDocumentId, "sourceDocumentId must not be null");
        Objects.requireNonNull(category, "category must not be null");
    }

    /**
     * Creates a candidate for the given document.
     *
     * @param text phrase text
     * @param document source document
     * @return candidate phrase
     */
    public static CandidatePhrase of(String text, Document document) {
        return new CandidatePhrase(text, document.id(), document.category());
    }
}
