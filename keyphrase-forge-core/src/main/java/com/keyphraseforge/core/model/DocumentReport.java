package com.keyphraseforge.core.model;

import java.util.Objects;

/**
 * Per-document processing record.
 *
 * @param documentId document id
 * @param category document category
 * @param status extraction status
 * @param attempts extraction attempts made
 * @param candidates candidate phrases returned
 * @param created candidates that started a new cluster
 * @param merged candidates folded into an existing cluster
 * @param dropped candidates rejected, excluded or refused by quota
 */
public record DocumentReport(
    String documentId,
    String category,
    ExtractionStatus status,
    int attempts,
    int candidates,
    int created,
    int merged,
    int dropped
) {
    /**
     * Compact constructor with validation.
     */
    public DocumentReport {
        Objects.requireNonNull(documentId, "documentId must not be null");
        Objects.requireNonNull(status, "status must not be null");
    }
}
