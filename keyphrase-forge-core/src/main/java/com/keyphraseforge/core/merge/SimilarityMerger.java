package com.keyphraseforge.core.merge;

import com.keyphraseforge.core.config.PipelineConfig;
import com.keyphraseforge.core.config.PipelineConfig.AcronymEntry;
import com.keyphraseforge.core.model.NormalizedPhrase;
import com.keyphraseforge.core.normalize.Normalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Detects exact and near-duplicate phrases and decides which variant represents a cluster.
 *
 * <p>Rules are evaluated in order and the first match wins:
 * <ol>
 *   <li><b>Exact:</b> the canonical text equals that of a phrase already in a cluster.</li>
 *   <li><b>Plural:</b> the canonical texts are equal after stripping a trailing "s"/"es"
 *       (stem of at least three characters).</li>
 *   <li><b>Containment:</b> one phrase is a whitespace-bounded run of words inside a cluster's
 *       representative, or contains it. The longer phrase represents the cluster; a shorter
 *       phrase is only ever folded in and is never promoted back.</li>
 * </ol>
 *
 * <p>When a promotion makes a representative contain the representatives of other clusters,
 * those clusters are folded into the promoted one, so no surviving representative is a word run
 * inside another.
 *
 * <p>A phrase matching none of the rules starts a new cluster. If the acronym table maps it to
 * an existing cluster's full name (or the reverse), both clusters survive and are linked as a pair.
 *
 * <p>Comparisons use the case-folded canonical text. Equally specific collisions keep the
 * representative that was seen first. Admission never fails.
 */
public class SimilarityMerger {

    private static final Logger log = LoggerFactory.getLogger(SimilarityMerger.class);

    private final PipelineConfig config;
    private final Map<String, String> counterpartKeys = new HashMap<>();

    public SimilarityMerger(PipelineConfig config, Normalizer normalizer) {
        this.config = config;
        for (AcronymEntry entry : config.acronyms()) {
            if (entry.fullName() == null || entry.fullName().isBlank()) {
                continue;
            }
            String acronymKey = normalizer.canonicalize(entry.acronym()).toLowerCase(Locale.ROOT);
            String fullNameKey = normalizer.canonicalize(entry.fullName()).toLowerCase(Locale.ROOT);
            counterpartKeys.putIfAbsent(acronymKey, fullNameKey);
            counterpartKeys.putIfAbsent(fullNameKey, acronymKey);
        }
    }

    /**
     * Admits a phrase: folds it into the matching cluster or starts a new one.
     *
     * @param clusters cluster set to update
     * @param phrase normalized phrase
     * @return the affected cluster and how it was affected
     */
    public MergeOutcome admit(ClusterSet clusters, NormalizedPhrase phrase) {
        Optional<Match> match = findMatch(clusters, phrase);
        if (match.isPresent()) {
            return merge(clusters, phrase, match.get());
        }
        return createCluster(clusters, phrase, false);
    }

    /**
     * Finds the cluster a phrase belongs to without changing anything.
     *
     * @param clusters cluster set to search
     * @param phrase normalized phrase
     * @return the match, or empty if the phrase would start a new cluster
     */
    public Optional<Match> findMatch(ClusterSet clusters, NormalizedPhrase phrase) {
        String key = phrase.matchKey();

        Optional<Integer> exact = clusters.findExact(key);
        if (exact.isPresent()) {
            return Optional.of(new Match(exact.get(), MatchRule.EXACT, false));
        }

        Optional<Integer> plural = clusters.findPlural(key);
        if (plural.isPresent()) {
            return Optional.of(new Match(plural.get(), MatchRule.PLURAL, false));
        }

        for (KeyphraseCluster cluster : clusters.clusters()) {
            String representativeKey = cluster.representative().matchKey();
            boolean contained = PhraseForms.containedIn(key, representativeKey);
            boolean contains = !contained && PhraseForms.containedIn(representativeKey, key);
            if ((contained || contains) && containmentAllowed(cluster, phrase)) {
                return Optional.of(new Match(cluster.id(), MatchRule.CONTAINMENT, contains));
            }
        }

        return Optional.empty();
    }

    /**
     * Folds a phrase into the cluster found by {@link #findMatch}.
     *
     * @param clusters cluster set
     * @param phrase normalized phrase
     * @param match match for the phrase
     * @return merge outcome
     */
    public MergeOutcome merge(ClusterSet clusters, NormalizedPhrase phrase, Match match) {
        clusters.nextSequence();
        KeyphraseCluster cluster = clusters.get(match.clusterId());
        if (match.promotes()) {
            log.debug("'{}' is more specific than '{}', promoting it", phrase.canonicalText(),
                cluster.representativeText());
            cluster.promote(phrase);
        } else {
            log.debug("'{}' merged into '{}' ({})", phrase.canonicalText(),
                cluster.representativeText(), match.rule());
            cluster.absorb(phrase);
        }
        clusters.index(phrase.matchKey(), cluster.id());
        List<Integer> absorbed = match.promotes() ? foldSubsumed(clusters, cluster, phrase) : List.of();
        return new MergeOutcome(cluster.id(), match.rule(), match.promotes(), false, absorbed);
    }

    /**
     * Starts a new cluster for a phrase that matched no rule, linking acronym/full-name pairs.
     *
     * @param clusters cluster set
     * @param phrase normalized phrase
     * @param overQuota whether the cluster is admitted above its category's soft target
     * @return merge outcome
     */
    public MergeOutcome createCluster(ClusterSet clusters, NormalizedPhrase phrase, boolean overQuota) {
        KeyphraseCluster cluster = clusters.create(phrase, clusters.nextSequence(), overQuota);
        log.debug("New cluster {} for '{}'", cluster.id(), phrase.canonicalText());

        boolean paired = false;
        String counterpart = counterpartKeys.get(phrase.matchKey());
        if (counterpart != null) {
            Optional<Integer> other = clusters.findExact(counterpart);
            if (other.isPresent() && other.get() != cluster.id()) {
                KeyphraseCluster otherCluster = clusters.get(other.get());
                cluster.pairWith(otherCluster.id());
                otherCluster.pairWith(cluster.id());
                paired = true;
                log.debug("Paired '{}' with '{}'", phrase.canonicalText(), otherCluster.representativeText());
            }
        }
        return new MergeOutcome(cluster.id(), MatchRule.NONE, false, paired, List.of());
    }

    private List<Integer> foldSubsumed(ClusterSet clusters, KeyphraseCluster survivor, NormalizedPhrase phrase) {
        List<Integer> absorbed = new ArrayList<>();
        for (KeyphraseCluster other : clusters.clusters()) {
            if (other.id() == survivor.id()
                || !PhraseForms.containedIn(other.representative().matchKey(), phrase.matchKey())
                || !containmentAllowed(other, phrase)) {
                continue;
            }
            log.debug("'{}' now contains '{}', folding cluster {} into {}", phrase.canonicalText(),
                other.representativeText(), other.id(), survivor.id());
            clusters.fold(survivor.id(), other.id());
            absorbed.add(other.id());
        }
        return absorbed;
    }

    private boolean containmentAllowed(KeyphraseCluster cluster, NormalizedPhrase phrase) {
        if (!config.merge().restrictContainmentToRelatedCategories()) {
            return true;
        }
        String clusterCategory = cluster.primaryCategory();
        return config.findCategory(clusterCategory)
            .map(c -> c.isRelatedTo(phrase.category()))
            .orElse(clusterCategory.equalsIgnoreCase(phrase.category()));
    }
}
