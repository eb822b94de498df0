package com.keyphraseforge.core.merge;

import java.util.List;

/**
 * Effect of admitting one phrase into a {@link ClusterSet}.
 *
 * @param clusterId affected cluster
 * @param rule rule that matched, or {@link MatchRule#NONE} for a new cluster
 * @param representativeChanged whether the phrase became the cluster's representative by promotion
 * @param paired whether a new cluster was linked to an acronym/full-name counterpart
 * @param absorbedClusterIds clusters folded into the affected one after a promotion
 */
public record MergeOutcome(
    int clusterId,
    MatchRule rule,
    boolean representativeChanged,
    boolean paired,
    List<Integer> absorbedClusterIds
) {
    public MergeOutcome {
        absorbedClusterIds = absorbedClusterIds == null ? List.of() : List.copyOf(absorbedClusterIds);
    }

    /**
     * Returns whether the phrase started a new cluster.
     *
     * @return true for a new cluster
     */
    public boolean created() {
        return rule == MatchRule.NONE;
    }
}
