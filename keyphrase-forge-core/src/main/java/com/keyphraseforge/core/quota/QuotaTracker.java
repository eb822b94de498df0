package com.keyphraseforge.core.quota;

import com.keyphraseforge.core.model.CategoryQuota;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;

/**
 * Decides whether a new cluster may be admitted for a category.
 *
 * <p>Quotas are soft and evaluated per cluster, not per phrase occurrence:
 * <ul>
 *   <li>below the soft target: {@link QuotaDecision#ADMIT}</li>
 *   <li>within the overflow margin: {@link QuotaDecision#ADMIT_OVER_QUOTA}</li>
 *   <li>past the margin: {@link QuotaDecision#REJECT} only while the corpus-wide total is at or
 *       above the global target, otherwise still {@link QuotaDecision#ADMIT_OVER_QUOTA}</li>
 * </ul>
 *
 * <p>A category without a quota entry is treated as having a soft target of zero.
 */
public class QuotaTracker {

    private static final Logger log = LoggerFactory.getLogger(QuotaTracker.class);

    private final Map<String, CategoryQuota> quotas;
    private final int globalTarget;
    private final CategoryCounter counter;

    /**
     * @param quotas read-only quota table by category
     * @param globalTarget corpus-wide target size
     * @param counter run-scoped counter shared with the aggregator
     */
    public QuotaTracker(Map<String, CategoryQuota> quotas, int globalTarget, CategoryCounter counter) {
        this.quotas = Map.copyOf(Objects.requireNonNull(quotas, "quotas must not be null"));
        this.globalTarget = globalTarget;
        this.counter = Objects.requireNonNull(counter, "counter must not be null");
    }

    /**
     * Decides admission for a new cluster in a category.
     *
     * @param category category of the founding phrase
     * @return admission decision
     */
    public QuotaDecision shouldAdmit(String category) {
        CategoryQuota quota = quotas.getOrDefault(category, new CategoryQuota(category, 0, 0));
        int current = counter.count(category);

        if (current < quota.softTarget()) {
            return QuotaDecision.ADMIT;
        }
        if (current < quota.hardLimit()) {
            return QuotaDecision.ADMIT_OVER_QUOTA;
        }
        if (counter.total() >= globalTarget) {
            log.debug("Category {} exhausted ({} >= {}) and global budget spent ({} >= {})",
                category, current, quota.hardLimit(), counter.total(), globalTarget);
            return QuotaDecision.REJECT;
        }
        return QuotaDecision.ADMIT_OVER_QUOTA;
    }

    /**
     * Records the admission of a new cluster.
     *
     * @param category category whose quota the cluster consumes
     */
    public void record(String category) {
        counter.increment(category);
    }

    public CategoryCounter counter() {
        return counter;
    }
}
