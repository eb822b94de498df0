package com.keyphraseforge.core.rank;

import com.keyphraseforge.core.config.PipelineConfig;
import com.keyphraseforge.core.config.PipelineConfig.ScoringSettings;
import com.keyphraseforge.core.merge.KeyphraseCluster;
import com.keyphraseforge.core.model.AuditEntry;
import com.keyphraseforge.core.model.AuditReason;
import com.keyphraseforge.core.model.RankedKeyphrase;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Scores the final cluster set and cuts it to the global target.
 *
 * <p>Score of a cluster:
 * <pre>
 *   breadthWeight * distinctSourceDocuments
 *     + priorityWeight(primaryCategory)
 *     - overQuotaPenalty   (if admitted over quota)
 *     + howToBonus         (if the representative starts with a how-to prefix)
 * </pre>
 *
 * <p>Clusters are ordered by score descending, ties broken by first-seen order ascending, so
 * the same cluster set always ranks the same way. The list is truncated to the global target
 * but never padded.
 */
public class Ranker {

    private static final Logger log = LoggerFactory.getLogger(Ranker.class);

    private final PipelineConfig config;
    private final List<String> howToPrefixes;

    public Ranker(PipelineConfig config) {
        this.config = config;
        this.howToPrefixes = config.howToPrefixes().stream()
            .filter(p -> p != null && !p.isBlank())
            .map(p -> p.trim().toLowerCase(Locale.ROOT))
            .toList();
    }

    /**
     * Freezes the clusters, ranks them and keeps the top {@code globalTarget}.
     *
     * @param clusters final cluster set
     * @param globalTarget maximum output size
     * @return ranked keyphrases and the truncated remainder
     */
    public RankingResult finalizeRanking(List<KeyphraseCluster> clusters, int globalTarget) {
        List<Scored> scored = new ArrayList<>(clusters.size());
        for (KeyphraseCluster cluster : clusters) {
            cluster.freeze();
            scored.add(new Scored(cluster, score(cluster)));
        }
        scored.sort(Comparator.comparingDouble(Scored::score).reversed()
            .thenComparingLong(s -> s.cluster().firstSeenOrder()));

        int cut = Math.min(globalTarget, scored.size());
        List<RankedKeyphrase> keyphrases = scored.subList(0, cut).stream()
            .map(s -> new RankedKeyphrase(s.cluster().representativeText(),
                s.cluster().primaryCategory(), s.score()))
            .toList();

        List<AuditEntry> truncated = scored.subList(cut, scored.size()).stream()
            .map(s -> new AuditEntry(s.cluster().representativeText(), null,
                s.cluster().primaryCategory(), AuditReason.TRUNCATED,
                String.format(Locale.ROOT, "score %.2f below global target cutoff", s.score())))
            .toList();

        if (scored.size() < globalTarget) {
            log.info("Only {} keyphrases available for a target of {}", scored.size(), globalTarget);
        } else if (!truncated.isEmpty()) {
            log.info("Truncated {} clusters to meet the target of {}", truncated.size(), globalTarget);
        }
        return new RankingResult(keyphrases, truncated);
    }

    /**
     * Computes the score of a cluster.
     *
     * @param cluster cluster to score
     * @return score
     */
    public double score(KeyphraseCluster cluster) {
        ScoringSettings scoring = config.scoring();
        double score = scoring.breadthWeight() * cluster.documentCount()
            + config.priorityWeightFor(cluster.primaryCategory());
        if (cluster.isOverQuota()) {
            score -= scoring.overQuotaPenalty();
        }
        if (isHowTo(cluster.representativeText())) {
            score += scoring.howToBonus();
        }
        return score;
    }

    boolean isHowTo(String text) {
        String lower = text.toLowerCase(Locale.ROOT);
        for (String prefix : howToPrefixes) {
            if (lower.equals(prefix) || lower.startsWith(prefix + " ")) {
                return true;
            }
        }
        return false;
    }

    private record Scored(KeyphraseCluster cluster, double score) {}
}
