package com.keyphraseforge.core.report.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
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

import java.util.HashMap;
import java.util.Map;

/**
 * Writes the full run as one JSON document for downstream indexing.
 *
 * <p>Top-level sections: {@code configuration}, {@code stats}, {@code keyphrases} (ranked,
 * best first), {@code by_file} (per-document results keyed by document id), {@code audit}
 * and {@code summary}.
 */
public class JsonReportGenerator implements ReportGenerator {

    private final ObjectMapper objectMapper = new ObjectMapper()
        .enable(SerializationFeature.INDENT_OUTPUT);

    @Override
    public String getId() {
        return "json";
    }

    @Override
    public String getDisplayName() {
        return "JSON Run Report";
    }

    @Override
    public String getFileExtension() {
        return "json";
    }

    @Override
    public ReportFile generate(ReportInput input) {
        PipelineResult result = input.result();
        ObjectNode root = objectMapper.createObjectNode();

        ObjectNode configuration = root.putObject("configuration");
        configuration.put("input_dir", input.inputDirectory());
        configuration.put("target_count", input.config().globalTarget());
        configuration.put("extractor", input.extractorId());

        root.set("stats", stats(result));

        ArrayNode keyphrases = root.putArray("keyphrases");
        for (RankedKeyphrase keyphrase : result.keyphrases()) {
            keyphrases.addObject()
                .put("text", keyphrase.text())
                .put("category", keyphrase.category())
                .put("score", keyphrase.score());
        }

        root.set("by_file", byFile(result));

        ArrayNode audit = root.putArray("audit");
        for (AuditEntry entry : result.auditEntries()) {
            ObjectNode node = audit.addObject();
            node.put("text", entry.text());
            node.put("document", entry.documentId());
            node.put("category", entry.category());
            node.put("reason", entry.reason().name());
            node.put("kind", entry.kind().name());
            node.put("detail", entry.detail());
        }

        RunSummary summary = result.summary();
        ObjectNode summaryNode = root.putObject("summary");
        summaryNode.put("admitted_count", summary.admittedCount());
        summaryNode.put("global_target", summary.globalTarget());
        summaryNode.put("shortfall", summary.shortfall());
        ObjectNode categories = summaryNode.putObject("categories");
        summary.categories().forEach(categories::put);

        try {
            return new ReportFile(fileName(), objectMapper.writeValueAsString(root), "application/json");
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize run report", e);
        }
    }

    private ObjectNode stats(PipelineResult result) {
        RunStatistics statistics = result.statistics();
        ObjectNode stats = objectMapper.createObjectNode();
        stats.put("total_files_processed", statistics.documentsTotal());
        stats.put("documents_degraded", statistics.documentsDegraded());
        stats.put("documents_skipped", statistics.documentsSkipped());
        stats.put("total_keyphrases_extracted", statistics.candidatesExtracted());
        stats.put("candidates_rejected", statistics.candidatesRejected());
        stats.put("clusters_formed", statistics.clustersFormed());
        stats.put("final_unique_keyphrases", result.keyphrases().size());
        stats.put("cancelled", statistics.cancelled());
        ObjectNode byType = stats.putObject("by_type");
        statistics.candidatesByCategory().forEach(byType::put);
        return stats;
    }

    private ObjectNode byFile(PipelineResult result) {
        Map<String, String> failures = new HashMap<>();
        for (AuditEntry entry : result.auditEntries()) {
            if (entry.reason() == AuditReason.EXTRACTION_FAILED && entry.documentId() != null) {
                failures.put(entry.documentId(), entry.detail());
            }
        }

        ObjectNode byFile = objectMapper.createObjectNode();
        for (DocumentReport report : result.documentReports()) {
            ObjectNode node = byFile.putObject(report.documentId());
            node.put("type", report.category());
            node.put("status", report.status().name());
            node.put("attempts", report.attempts());
            node.put("candidates", report.candidates());
            node.put("created", report.created());
            node.put("merged", report.merged());
            node.put("dropped", report.dropped());
            if (failures.containsKey(report.documentId())) {
                node.put("error", failures.get(report.documentId()));
            }
        }
        return byFile;
    }
}
