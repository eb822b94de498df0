package com.keyphraseforge.core.rank;

import com.keyphraseforge.core.model.AuditEntry;
import com.keyphraseforge.core.model.RankedKeyphrase;

import java.util.List;

/**
 * Output of the final ranking pass.
 *
 * @param keyphrases ranked keyphrases, best first, at most the global target
 * @param truncated audit entries for clusters cut by the global target
 */
public record RankingResult(
    List<RankedKeyphrase> keyphrases,
    List<AuditEntry> truncated
) {
    public RankingResult {
        keyphrases = keyphrases == null ? List.of() : List.copyOf(keyphrases);
        truncated = truncated == null ? List.of() : List.copyOf(truncated);
    }
}
