package com.keyphraseforge.core.quota;

/**
 * Admission decision for a new cluster.
 */
public enum QuotaDecision {
    /** The category is below its soft target */
    ADMIT,
    /** Allowed, but flagged so the ranker can deprioritize it */
    ADMIT_OVER_QUOTA,
    /** The category is past its overflow margin and the global budget is exhausted */
    REJECT
}
