package com.keyphraseforge.core.merge;

/**
 * Similarity rule that placed a phrase into a cluster, in evaluation order.
 */
public enum MatchRule {
    /** Same canonical text as a phrase already in the cluster */
    EXACT,
    /** Same canonical text once a trailing "s"/"es" is stripped */
    PLURAL,
    /** Whitespace-bounded containment; the longer phrase represents the cluster */
    CONTAINMENT,
    /** No rule matched; the phrase started a new cluster */
    NONE
}
