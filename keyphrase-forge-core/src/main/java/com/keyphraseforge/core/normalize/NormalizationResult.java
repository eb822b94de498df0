package com.keyphraseforge.core.normalize;

import com.keyphraseforge.core.model.AuditReason;
import com.keyphraseforge.core.model.NormalizedPhrase;

/**
 * Result of normalizing one candidate phrase: either the normalized phrase or a rejection.
 *
 * @param phrase normalized phrase, or null when rejected
 * @param rejection rejection reason, or null when accepted
 * @param detail explanation of the rejection
 */
public record NormalizationResult(
    NormalizedPhrase phrase,
    AuditReason rejection,
    String detail
) {
    /**
     * Creates an accepted result.
     *
     * @param phrase normalized phrase
     * @return accepted result
     */
    public static NormalizationResult accepted(NormalizedPhrase phrase) {
        return new NormalizationResult(phrase, null, null);
    }

    /**
     * Creates a rejected result.
     *
     * @param reason rejection reason
     * @param detail explanation
     * @return rejected result
     */
    public static NormalizationResult rejected(AuditReason reason, String detail) {
        return new NormalizationResult(null, reason, detail);
    }

    /**
     * Returns true if the phrase passed normalization.
     *
     * @return true when accepted
     */
    public boolean isAccepted() {
        return phrase != null;
    }
}
