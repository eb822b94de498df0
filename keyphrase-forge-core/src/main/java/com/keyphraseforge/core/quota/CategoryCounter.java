package com.keyphraseforge.core.quota;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Running count of admitted clusters per category and in total.
 *
 * <p>Created at run start and discarded at run end. Only the owning aggregator increments it;
 * it is not thread-safe.
 */
public class CategoryCounter {

    private final Map<String, Integer> counts = new LinkedHashMap<>();
    private int total;

    public int count(String category) {
        return counts.getOrDefault(category, 0);
    }

    public int total() {
        return total;
    }

    void increment(String category) {
        counts.merge(category, 1, Integer::sum);
        total++;
    }

    /**
     * Returns the per-category counts in first-admission order.
     *
     * @return unmodifiable view of counts
     */
    public Map<String, Integer> counts() {
        return Collections.unmodifiableMap(counts);
    }
}
