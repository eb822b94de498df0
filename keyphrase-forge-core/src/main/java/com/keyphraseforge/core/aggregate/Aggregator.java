package com.keyphraseforge.core.aggregate;

import com.keyphraseforge.core.config.PipelineConfig;
import com.keyphraseforge.core.merge.ClusterSet;
import com.keyphraseforge.core.merge.KeyphraseCluster;
import com.keyphraseforge.core.merge.Match;
import com.keyphraseforge.core.merge.MergeOutcome;
import com.keyphraseforge.core.merge.SimilarityMerger;
import com.keyphraseforge.core.model.AuditReason;
import com.keyphraseforge.core.model.CandidatePhrase;
import com.keyphraseforge.core.model.Document;
import com.keyphraseforge.core.normalize.NormalizationResult;
import com.keyphraseforge.core.normalize.Normalizer;
import com.keyphraseforge.core.quota.CategoryCounter;
import com.keyphraseforge.core.quota.QuotaDecision;
import com.keyphraseforge.core.quota.QuotaTracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Owns the live cluster set for one run and feeds every candidate through
 * normalization, similarity admission and the quota check.
 *
 * <p>Candidates that match an existing cluster are merged without consuming quota; only a
 * candidate that would start a new cluster is checked against its category's quota. Every
 * dropped candidate is written to the {@link AuditLog} and never reaches the cluster set.
 *
 * <p>Phrases admitted from the common category are remembered; the same term extracted later
 * from any other category is excluded. Documents must therefore be ingested common-first.
 *
 * <p>Single writer: callers serialize {@link #ingest} calls.
 */
public class Aggregator {

    private static final Logger log = LoggerFactory.getLogger(Aggregator.class);

    private final PipelineConfig config;
    private final Normalizer normalizer;
    private final SimilarityMerger merger;
    private final QuotaTracker quotaTracker;
    private final ClusterSet clusters = new ClusterSet();
    private final AuditLog auditLog = new AuditLog();
    private final Set<String> commonTerms = new HashSet<>();

    public Aggregator(PipelineConfig config) {
        this(config, config.globalTarget());
    }

    /**
     * @param config validated pipeline configuration
     * @param globalTarget target size used for the quota's global budget
     */
    public Aggregator(PipelineConfig config, int globalTarget) {
        this.config = config;
        this.normalizer = new Normalizer(config);
        this.merger = new SimilarityMerger(config, normalizer);
        this.quotaTracker = new QuotaTracker(config.quotas(), globalTarget, new CategoryCounter());
    }

    /**
     * Ingests the candidates extracted from one document.
     *
     * @param document source document
     * @param candidates candidates in extraction order
     * @return per-document counts
     */
    public IngestResult ingest(Document document, List<CandidatePhrase> candidates) {
        boolean common = config.isCommon(document.category());
        int created = 0;
        int merged = 0;
        int dropped = 0;

        for (CandidatePhrase candidate : candidates) {
            String key = normalizer.canonicalize(candidate.text()).toLowerCase(Locale.ROOT);
            if (!common && commonTerms.contains(key)) {
                audit(candidate, AuditReason.EXCLUDED_COMMON_TERM, "already listed under common terms");
                dropped++;
                continue;
            }

            NormalizationResult result = normalizer.normalize(candidate);
            if (!result.isAccepted()) {
                audit(candidate, result.rejection(), result.detail());
                dropped++;
                continue;
            }

            Optional<Match> match = merger.findMatch(clusters, result.phrase());
            if (match.isPresent()) {
                MergeOutcome outcome = merger.merge(clusters, result.phrase(), match.get());
                if (!outcome.absorbedClusterIds().isEmpty()) {
                    // quota consumed by the folded clusters stays consumed
                    log.debug("'{}' absorbed clusters {}", result.phrase().canonicalText(),
                        outcome.absorbedClusterIds());
                }
                merged++;
            } else {
                QuotaDecision decision = quotaTracker.shouldAdmit(candidate.category());
                if (decision == QuotaDecision.REJECT) {
                    audit(candidate, AuditReason.QUOTA_EXHAUSTED,
                        quotaTracker.counter().count(candidate.category()) + " clusters in category, "
                            + quotaTracker.counter().total() + " overall");
                    dropped++;
                    continue;
                }
                MergeOutcome outcome = merger.createCluster(clusters, result.phrase(),
                    decision == QuotaDecision.ADMIT_OVER_QUOTA);
                quotaTracker.record(candidate.category());
                if (outcome.paired()) {
                    log.debug("'{}' linked to its acronym counterpart", result.phrase().canonicalText());
                }
                created++;
            }

            if (common) {
                commonTerms.add(result.phrase().matchKey());
            }
        }

        log.debug("Ingested {}: {} created, {} merged, {} dropped",
            document.id(), created, merged, dropped);
        return new IngestResult(candidates.size(), created, merged, dropped);
    }

    /**
     * Records that a document's extraction failed after all retries.
     *
     * @param document degraded document
     * @param detail failure description
     */
    public void recordExtractionFailure(Document document, String detail) {
        auditLog.add(document.id(), document.id(), document.category(),
            AuditReason.EXTRACTION_FAILED, detail);
    }

    /**
     * Returns the live clusters in creation order.
     *
     * @return cluster list
     */
    public List<KeyphraseCluster> snapshot() {
        return clusters.clusters();
    }

    public AuditLog auditLog() {
        return auditLog;
    }

    public CategoryCounter counter() {
        return quotaTracker.counter();
    }

    private void audit(CandidatePhrase candidate, AuditReason reason, String detail) {
        auditLog.add(candidate.text(), candidate.sourceDocumentId(), candidate.category(), reason, detail);
    }
}
