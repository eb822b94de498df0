package com.keyphraseforge.core.pipeline;

import com.keyphraseforge.core.model.AuditEntry;
import com.keyphraseforge.core.model.DocumentReport;
import com.keyphraseforge.core.model.RankedKeyphrase;
import com.keyphraseforge.core.model.RunStatistics;
import com.keyphraseforge.core.model.RunSummary;

import java.util.List;

/**
 * Everything a completed run produces.
 *
 * @param keyphrases ranked output, best first
 * @param auditEntries rejected, excluded, failed and truncated items
 * @param summary admitted count against the global target
 * @param statistics run counters
 * @param documentReports per-document results, in processing order
 */
public record PipelineResult(
    List<RankedKeyphrase> keyphrases,
    List<AuditEntry> auditEntries,
    RunSummary summary,
    RunStatistics statistics,
    List<DocumentReport> documentReports
) {
    public PipelineResult {
        keyphrases = keyphrases == null ? List.of() : List.copyOf(keyphrases);
        auditEntries = auditEntries == null ? List.of() : List.copyOf(auditEntries);
        documentReports = documentReports == null ? List.of() : List.copyOf(documentReports);
    }
}
