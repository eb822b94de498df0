package com.keyphraseforge.core.aggregate;

/**
 * What happened to one document's candidates during ingestion.
 *
 * @param candidates candidates received
 * @param created candidates that started a new cluster
 * @param merged candidates folded into an existing cluster
 * @param dropped candidates rejected, excluded or refused by quota
 */
public record IngestResult(
    int candidates,
    int created,
    int merged,
    int dropped
) {
    public static IngestResult empty() {
        return new IngestResult(0, 0, 0, 0);
    }
}
