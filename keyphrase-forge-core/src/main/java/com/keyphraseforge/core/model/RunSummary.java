package com.keyphraseforge.core.model;

import java.util.Map;

/**
 * Completion summary of a run.
 *
 * <p>A difference between {@code admittedCount} and {@code globalTarget} is reported
 * but is not an error.
 *
 * @param admittedCount number of keyphrases in the output
 * @param globalTarget configured target size
 * @param categories output keyphrases per category
 */
public record RunSummary(
    int admittedCount,
    int globalTarget,
    Map<String, Integer> categories
) {
    /**
     * Compact constructor with defaults.
     */
    public RunSummary {
        if (categories == null) {
            categories = Map.of();
        }
    }

    /**
     * Returns how many keyphrases short of the target the run ended.
     *
     * @return shortfall, or 0 when the target was reached
     */
    public int shortfall() {
        return Math.max(0, globalTarget - admittedCount);
    }

    /**
     * Returns whether the output size differs from the target.
     *
     * @return true if the target was not met exactly
     */
    public boolean hasDiscrepancy() {
        return admittedCount != globalTarget;
    }
}
