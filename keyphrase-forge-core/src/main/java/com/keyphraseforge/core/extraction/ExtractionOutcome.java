package com.keyphraseforge.core.extraction;

import com.keyphraseforge.core.model.CandidatePhrase;
import com.keyphraseforge.core.model.ExtractionStatus;

import java.util.List;
import java.util.Objects;

/**
 * Result of extracting one document, including failures.
 *
 * @param documentId document id
 * @param status whether extraction succeeded, degraded after retries, or was skipped
 * @param phrases extracted candidates (empty unless successful)
 * @param reason failure description, or null on success
 * @param attempts number of calls made
 */
public record ExtractionOutcome(
    String documentId,
    ExtractionStatus status,
    List<CandidatePhrase> phrases,
    String reason,
    int attempts
) {
    /**
     * Compact constructor with validation.
     */
    public ExtractionOutcome {
        Objects.requireNonNull(documentId, "documentId must not be null");
        Objects.requireNonNull(status, "status must not be null");
        phrases = phrases == null ? List.of() : List.copyOf(phrases);
    }

    public static ExtractionOutcome success(String documentId, List<CandidatePhrase> phrases, int attempts) {
        return new ExtractionOutcome(documentId, ExtractionStatus.SUCCESS, phrases, null, attempts);
    }

    public static ExtractionOutcome degraded(String documentId, String reason, int attempts) {
        return new ExtractionOutcome(documentId, ExtractionStatus.DEGRADED, List.of(), reason, attempts);
    }

    public static ExtractionOutcome skipped(String documentId, String reason) {
        return new ExtractionOutcome(documentId, ExtractionStatus.SKIPPED, List.of(), reason, 0);
    }

    public boolean isSuccess() {
        return status == ExtractionStatus.SUCCESS;
    }
}
