package com.keyphraseforge.core.model;

import java.util.Objects;

/**
 * Soft quota for one category.
 *
 * @param category category name
 * @param softTarget number of clusters admitted without penalty
 * @param overflowMargin clusters admitted above the soft target before rejection becomes possible
 */
public record CategoryQuota(
    String category,
    int softTarget,
    int overflowMargin
) {
    /**
     * Compact constructor with validation.
     */
    public CategoryQuota {
        Objects.requireNonNull(category, "category must not be null");
        if (softTarget < 0) {
            throw new IllegalArgumentException("softTarget must not be negative");
        }
        if (overflowMargin < 0) {
            throw new IllegalArgumentException("overflowMargin must not be negative");
        }
    }

    /**
     * Returns the count at which the category is exhausted.
     *
     * @return soft target plus overflow margin
     */
    public int hardLimit() {
        return softTarget + overflowMargin;
    }
}
