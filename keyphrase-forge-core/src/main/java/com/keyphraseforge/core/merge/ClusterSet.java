package com.keyphraseforge.core.merge;

import com.keyphraseforge.core.model.NormalizedPhrase;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Corpus-wide set of keyphrase clusters, in creation order.
 *
 * <p>Maintains lookup indexes for the exact and plural rules so that those rules do not
 * need to scan every cluster. Not thread-safe: a single writer owns the set for a run.
 */
public class ClusterSet {

    private final Map<Integer, KeyphraseCluster> clusters = new LinkedHashMap<>();
    private final Map<String, Integer> exactIndex = new HashMap<>();
    private final Map<String, Integer> pluralIndex = new HashMap<>();
    private int nextId = 0;
    private long sequence = 0;

    public int size() {
        return clusters.size();
    }

    public boolean isEmpty() {
        return clusters.isEmpty();
    }

    public KeyphraseCluster get(int clusterId) {
        KeyphraseCluster cluster = clusters.get(clusterId);
        if (cluster == null) {
            throw new IllegalArgumentException("Unknown cluster: " + clusterId);
        }
        return cluster;
    }

    /**
     * Returns all clusters in creation order.
     *
     * @return unmodifiable snapshot list
     */
    public List<KeyphraseCluster> clusters() {
        return Collections.unmodifiableList(new ArrayList<>(clusters.values()));
    }

    /**
     * Finds the cluster holding a phrase with exactly this case-folded canonical text.
     *
     * @param key case-folded canonical text
     * @return cluster id, if any
     */
    public Optional<Integer> findExact(String key) {
        return Optional.ofNullable(exactIndex.get(key));
    }

    /**
     * Finds the earliest cluster sharing a plural/singular form with the given key.
     *
     * @param key case-folded canonical text
     * @return cluster id, if any
     */
    public Optional<Integer> findPlural(String key) {
        Integer best = null;
        for (String form : PhraseForms.pluralForms(key)) {
            Integer candidate = pluralIndex.get(form);
            if (candidate != null && (best == null || candidate < best)) {
                best = candidate;
            }
        }
        return Optional.ofNullable(best);
    }

    long nextSequence() {
        return sequence++;
    }

    KeyphraseCluster create(NormalizedPhrase founder, long firstSeenOrder, boolean overQuota) {
        KeyphraseCluster cluster = new KeyphraseCluster(nextId++, firstSeenOrder, founder, overQuota);
        clusters.put(cluster.id(), cluster);
        index(founder.matchKey(), cluster.id());
        return cluster;
    }

    /**
     * Folds one cluster into another: the absorbed cluster's members, votes and pairings move to
     * the survivor, and index entries that pointed at it are redirected.
     *
     * @param survivorId cluster that remains
     * @param absorbedId cluster that is removed
     */
    void fold(int survivorId, int absorbedId) {
        KeyphraseCluster survivor = get(survivorId);
        KeyphraseCluster absorbed = get(absorbedId);
        if (survivorId == absorbedId) {
            throw new IllegalArgumentException("Cannot fold cluster " + survivorId + " into itself");
        }
        survivor.absorbCluster(absorbed);
        for (Integer pairedId : absorbed.pairedClusterIds()) {
            KeyphraseCluster partner = clusters.get(pairedId);
            if (partner == null) {
                continue;
            }
            partner.unpair(absorbedId);
            if (pairedId != survivorId) {
                partner.pairWith(survivorId);
                survivor.pairWith(pairedId);
            }
        }
        survivor.unpair(absorbedId);
        clusters.remove(absorbedId);
        exactIndex.replaceAll((key, id) -> id == absorbedId ? survivorId : id);
        pluralIndex.replaceAll((key, id) -> id == absorbedId ? survivorId : id);
    }

    void index(String key, int clusterId) {
        exactIndex.putIfAbsent(key, clusterId);
        for (String form : PhraseForms.pluralForms(key)) {
            pluralIndex.putIfAbsent(form, clusterId);
        }
    }
}
