package com.keyphraseforge.core.model;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Counters collected over a run.
 *
 * @param documentsTotal documents supplied
 * @param documentsDegraded documents whose extraction failed after retries
 * @param documentsSkipped documents not processed because the run was cancelled
 * @param candidatesExtracted candidate phrases returned by extraction
 * @param candidatesRejected candidates dropped by validation, exclusion or quota
 * @param clustersFormed clusters in the set handed to the ranker
 * @param candidatesByCategory candidates extracted per category
 * @param cancelled whether the run was cancelled
 */
public record RunStatistics(
    int documentsTotal,
    int documentsDegraded,
    int documentsSkipped,
    int candidatesExtracted,
    int candidatesRejected,
    int clustersFormed,
    Map<String, Integer> candidatesByCategory,
    boolean cancelled
) {
    /**
     * Compact constructor with defaults.
     */
    public RunStatistics {
        if (candidatesByCategory == null) {
            candidatesByCategory = Map.of();
        }
    }

    /**
     * Builder for collecting statistics incrementally.
     */
    public static class Builder {
        private int documentsTotal = 0;
        private int documentsDegraded = 0;
        private int documentsSkipped = 0;
        private int candidatesExtracted = 0;
        private int candidatesRejected = 0;
        private int clustersFormed = 0;
        private final Map<String, Integer> candidatesByCategory = new LinkedHashMap<>();
        private boolean cancelled = false;

        public Builder documentsTotal(int count) {
            this.documentsTotal = count;
            return this;
        }

        public Builder incrementDocumentsDegraded() {
            this.documentsDegraded++;
            return this;
        }

        public Builder incrementDocumentsSkipped() {
            this.documentsSkipped++;
            return this;
        }

        public Builder addCandidates(String category, int count) {
            this.candidatesExtracted += count;
            candidatesByCategory.merge(category, count, Integer::sum);
            return this;
        }

        public Builder addRejected(int count) {
            this.candidatesRejected += count;
            return this;
        }

        public Builder clustersFormed(int count) {
            this.clustersFormed = count;
            return this;
        }

        public Builder cancelled(boolean cancelled) {
            this.cancelled = cancelled;
            return this;
        }

        public RunStatistics build() {
            return new RunStatistics(
                documentsTotal,
                documentsDegraded,
                documentsSkipped,
                candidatesExtracted,
                candidatesRejected,
                clustersFormed,
                java.util.Collections.unmodifiableMap(new LinkedHashMap<>(candidatesByCategory)),
                cancelled
            );
        }
    }
}
