package com.keyphraseforge.core.model;

import java.util.Objects;

/**
 * A keyphrase in the final ranked output.
 *
 * @param text representative text of the cluster
 * @param category dominant category of the cluster
 * @param score ranking score
 */
public record RankedKeyphrase(
    String text,
    String category,
    double score
) {
    /**
     * Compact constructor with validation.
     */
    public RankedKeyphrase {
        Objects.requireNonNull(text, "text must not be null");
        Objects.requireNonNull(category, "category must not be null");
    }
}
