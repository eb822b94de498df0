package com.keyphraseforge.core.merge;

import com.keyphraseforge.core.model.NormalizedPhrase;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * The unit of deduplication: all phrase variants considered the same search term.
 *
 * <p>Clusters are only mutated by {@link SimilarityMerger} through package-private methods.
 * Once {@link #freeze()} has been called (by the ranker's final pass) every mutation fails.
 */
public class KeyphraseCluster {

    private final int id;
    private long firstSeenOrder;
    private final String originCategory;
    private final boolean overQuota;

    private NormalizedPhrase representative;
    private final Set<String> variants = new LinkedHashSet<>();
    private final Set<String> memberKeys = new LinkedHashSet<>();
    private final Map<String, Integer> categoryVotes = new LinkedHashMap<>();
    private final Set<String> sourceDocumentIds = new LinkedHashSet<>();
    private final Set<Integer> pairedClusterIds = new TreeSet<>();
    private boolean frozen;

    KeyphraseCluster(int id, long firstSeenOrder, NormalizedPhrase founder, boolean overQuota) {
        this.id = id;
        this.firstSeenOrder = firstSeenOrder;
        this.originCategory = founder.category();
        this.overQuota = overQuota;
        this.representative = founder;
        record(founder);
    }

    public int id() {
        return id;
    }

    /**
     * Returns the admission sequence number of the phrase that founded this cluster, or of the
     * earliest founder among clusters folded into it.
     *
     * @return first-seen order (lower is earlier)
     */
    public long firstSeenOrder() {
        return firstSeenOrder;
    }

    public NormalizedPhrase representative() {
        return representative;
    }

    /**
     * Returns the representative's canonical text, the text shown in the output.
     *
     * @return representative text
     */
    public String representativeText() {
        return representative.canonicalText();
    }

    /**
     * Returns the original texts of every phrase folded into this cluster, in arrival order.
     *
     * @return variant set
     */
    public Set<String> variants() {
        return Collections.unmodifiableSet(variants);
    }

    /**
     * Returns the case-folded canonical forms of every member phrase.
     *
     * @return member keys
     */
    public Set<String> memberKeys() {
        return Collections.unmodifiableSet(memberKeys);
    }

    public Map<String, Integer> categoryVotes() {
        return Collections.unmodifiableMap(categoryVotes);
    }

    public Set<String> sourceDocumentIds() {
        return Collections.unmodifiableSet(sourceDocumentIds);
    }

    public Set<Integer> pairedClusterIds() {
        return Collections.unmodifiableSet(pairedClusterIds);
    }

    public boolean isPaired() {
        return !pairedClusterIds.isEmpty();
    }

    /**
     * Returns whether the cluster was admitted above its category's soft target.
     *
     * @return true if admitted over quota
     */
    public boolean isOverQuota() {
        return overQuota;
    }

    /**
     * Returns the category whose quota this cluster consumed.
     *
     * @return category of the founding phrase
     */
    public String originCategory() {
        return originCategory;
    }

    /**
     * Returns the category with the most votes; ties go to the category voted first.
     *
     * @return dominant category
     */
    public String primaryCategory() {
        String best = originCategory;
        int bestVotes = -1;
        for (Map.Entry<String, Integer> entry : categoryVotes.entrySet()) {
            if (entry.getValue() > bestVotes) {
                best = entry.getKey();
                bestVotes = entry.getValue();
            }
        }
        return best;
    }

    /**
     * Returns the number of distinct documents that produced a member phrase.
     *
     * @return distinct source document count
     */
    public int documentCount() {
        return sourceDocumentIds.size();
    }

    /**
     * Returns the total number of votes across categories (one per admitted phrase occurrence).
     *
     * @return occurrence count
     */
    public int occurrences() {
        return categoryVotes.values().stream().mapToInt(Integer::intValue).sum();
    }

    public boolean isFrozen() {
        return frozen;
    }

    /**
     * Freezes the cluster; later mutation attempts fail.
     */
    public void freeze() {
        this.frozen = true;
    }

    void absorb(NormalizedPhrase phrase) {
        checkMutable();
        record(phrase);
    }

    void promote(NormalizedPhrase phrase) {
        checkMutable();
        record(phrase);
        this.representative = phrase;
    }

    void absorbCluster(KeyphraseCluster other) {
        checkMutable();
        other.checkMutable();
        variants.addAll(other.variants);
        memberKeys.addAll(other.memberKeys);
        other.categoryVotes.forEach((category, votes) -> categoryVotes.merge(category, votes, Integer::sum));
        sourceDocumentIds.addAll(other.sourceDocumentIds);
        firstSeenOrder = Math.min(firstSeenOrder, other.firstSeenOrder);
    }

    void unpair(int otherClusterId) {
        checkMutable();
        pairedClusterIds.remove(otherClusterId);
    }

    void pairWith(int otherClusterId) {
        checkMutable();
        if (otherClusterId != id) {
            pairedClusterIds.add(otherClusterId);
        }
    }

    private void record(NormalizedPhrase phrase) {
        variants.add(phrase.originalText());
        memberKeys.add(phrase.matchKey());
        categoryVotes.merge(phrase.category(), 1, Integer::sum);
        if (!phrase.sourceDocumentId().isEmpty()) {
            sourceDocumentIds.add(phrase.sourceDocumentId());
        }
    }

    private void checkMutable() {
        if (frozen) {
            throw new IllegalStateException("Cluster " + id + " is frozen");
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof KeyphraseCluster)) {
            return false;
        }
        return id == ((KeyphraseCluster) o).id;
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "KeyphraseCluster{id=" + id + ", representative='" + representativeText()
            + "', variants=" + variants + ", votes=" + categoryVotes + "}";
    }
}
