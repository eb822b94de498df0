package com.keyphraseforge.core.merge;

import java.util.Objects;

/**
 * A cluster an incoming phrase belongs to.
 *
 * @param clusterId matching cluster
 * @param rule rule that matched
 * @param promotes whether the incoming phrase replaces the representative (it is more specific)
 */
public record Match(
    int clusterId,
    MatchRule rule,
    boolean promotes
) {
    /**
     * Compact constructor with validation.
     */
    public Match {
        Objects.requireNonNull(rule, "rule must not be null");
    }
}
