package com.keyphraseforge.core.report.impl;

import com.keyphraseforge.core.model.AuditEntry;
import com.keyphraseforge.core.model.AuditReason;
import com.keyphraseforge.core.model.DocumentReport;
import com.keyphraseforge.core.model.RankedKeyphrase;
import com.keyphraseforge.core.model.RunStatistics;
import com.keyphraseforge.core.model.RunSummary;
import com.keyphraseforge.core.pipeline.PipelineResult;
import com.keyphraseforge.core.report.ReportFile;
import com.keyphraseforge.core.report.ReportGenerator;
import com.keyphraseforge.core.report.ReportInput;

import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;

/**
 * Human-readable Markdown report of a run: summary, ranked keyphrases, per-document results
 * and the audit log.
 */
public class MarkdownReportGenerator implements ReportGenerator {

    private static final String H1 = "# ";
    private static final String H2 = "## ";
    private static final String PIPE = "|";
    private static final String NEWLINE = "\n";
    private static final String DOUBLE_NEWLINE = "\n\n";
    private static final String DASH_VALUE = "-";

    @Override
    public String getId() {
        return "markdown";
    }

    @Override
    public String getDisplayName() {
        return "Markdown Run Report";
    }

    @Override
    public String getFileExtension() {
        return "md";
    }

    @Override
    public ReportFile generate(ReportInput input) {
        PipelineResult result = input.result();
        StringBuilder sb = new StringBuilder();

        sb.append(H1).append("Keyphrase Report").append(DOUBLE_NEWLINE);
        if (!input.inputDirectory().isEmpty()) {
            sb.append("**Input:** ").append(input.inputDirectory()).append(NEWLINE);
        }
        sb.append("**Extractor:** ").append(input.extractorId()).append(DOUBLE_NEWLINE);

        appendSummary(sb, result);
        appendKeyphrases(sb, result);
        appendDocuments(sb, result);
        appendAudit(sb, result);

        return new ReportFile(fileName(), sb.toString(), "text/markdown");
    }

    private void appendSummary(StringBuilder sb, PipelineResult result) {
        RunSummary summary = result.summary();
        RunStatistics stats = result.statistics();

        sb.append(H2).append("Summary").append(DOUBLE_NEWLINE);
        appendTableRow(sb, "Metric", "Value");
        appendTableDivider(sb, 2);
        appendTableRow(sb, "Keyphrases", summary.admittedCount() + " / " + summary.globalTarget());
        appendTableRow(sb, "Documents", String.valueOf(stats.documentsTotal()));
        appendTableRow(sb, "Degraded documents", String.valueOf(stats.documentsDegraded()));
        appendTableRow(sb, "Skipped documents", String.valueOf(stats.documentsSkipped()));
        appendTableRow(sb, "Candidates extracted", String.valueOf(stats.candidatesExtracted()));
        appendTableRow(sb, "Candidates dropped", String.valueOf(stats.candidatesRejected()));
        appendTableRow(sb, "Clusters formed", String.valueOf(stats.clustersFormed()));
        sb.append(NEWLINE);

        if (summary.shortfall() > 0) {
            sb.append("> ").append(summary.shortfall())
                .append(" short of the target; the list is not padded.").append(DOUBLE_NEWLINE);
        }
        if (stats.cancelled()) {
            sb.append("> The run was cancelled; results are partial.").append(DOUBLE_NEWLINE);
        }

        appendTableRow(sb, "Category", "Keyphrases");
        appendTableDivider(sb, 2);
        summary.categories().forEach((category, count) -> appendTableRow(sb, category, String.valueOf(count)));
        sb.append(NEWLINE);
    }

    private void appendKeyphrases(StringBuilder sb, PipelineResult result) {
        sb.append(H2).append("Keyphrases").append(DOUBLE_NEWLINE);
        if (result.keyphrases().isEmpty()) {
            sb.append("No keyphrases.").append(DOUBLE_NEWLINE);
            return;
        }
        appendTableRow(sb, "#", "Keyphrase", "Category", "Score");
        appendTableDivider(sb, 4);
        int rank = 1;
        for (RankedKeyphrase keyphrase : result.keyphrases()) {
            appendTableRow(sb, String.valueOf(rank++), escapeMarkdown(keyphrase.text()),
                keyphrase.category(), String.format(Locale.ROOT, "%.2f", keyphrase.score()));
        }
        sb.append(NEWLINE);
    }

    private void appendDocuments(StringBuilder sb, PipelineResult result) {
        sb.append(H2).append("Documents").append(DOUBLE_NEWLINE);
        if (result.documentReports().isEmpty()) {
            sb.append("No documents.").append(DOUBLE_NEWLINE);
            return;
        }
        appendTableRow(sb, "Document", "Category", "Status", "Candidates", "New", "Merged", "Dropped");
        appendTableDivider(sb, 7);
        for (DocumentReport report : result.documentReports()) {
            appendTableRow(sb,
                escapeMarkdown(report.documentId()),
                report.category(),
                report.status().name(),
                String.valueOf(report.candidates()),
                String.valueOf(report.created()),
                String.valueOf(report.merged()),
                String.valueOf(report.dropped()));
        }
        sb.append(NEWLINE);
    }

    private void appendAudit(StringBuilder sb, PipelineResult result) {
        sb.append(H2).append("Audit Log").append(DOUBLE_NEWLINE);
        if (result.auditEntries().isEmpty()) {
            sb.append("Nothing was dropped.").append(DOUBLE_NEWLINE);
            return;
        }

        Map<AuditReason, Integer> counts = new EnumMap<>(AuditReason.class);
        result.auditEntries().forEach(e -> counts.merge(e.reason(), 1, Integer::sum));
        appendTableRow(sb, "Reason", "Kind", "Count");
        appendTableDivider(sb, 3);
        counts.forEach((reason, count) ->
            appendTableRow(sb, reason.name(), reason.kind().name(), String.valueOf(count)));
        sb.append(NEWLINE);

        appendTableRow(sb, "Text", "Document", "Category", "Reason", "Detail");
        appendTableDivider(sb, 5);
        for (AuditEntry entry : result.auditEntries()) {
            appendTableRow(sb,
                escapeMarkdown(entry.text()),
                entry.documentId() == null ? DASH_VALUE : escapeMarkdown(entry.documentId()),
                entry.category() == null ? DASH_VALUE : entry.category(),
                entry.reason().name(),
                entry.detail().isEmpty() ? DASH_VALUE : escapeMarkdown(entry.detail()));
        }
        sb.append(NEWLINE);
    }

    private void appendTableRow(StringBuilder sb, String... cells) {
        sb.append(PIPE);
        for (String cell : cells) {
            sb.append(' ').append(cell).append(' ').append(PIPE);
        }
        sb.append(NEWLINE);
    }

    private void appendTableDivider(StringBuilder sb, int columns) {
        sb.append(PIPE);
        for (int i = 0; i < columns; i++) {
            sb.append("---").append(PIPE);
        }
        sb.append(NEWLINE);
    }

    private String escapeMarkdown(String text) {
        if (text == null) {
            return "";
        }
        return text.replace("|", "\\|").replace("\n", " ");
    }
}
