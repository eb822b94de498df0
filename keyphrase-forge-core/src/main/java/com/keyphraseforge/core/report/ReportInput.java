package com.keyphraseforge.core.report;

import com.keyphraseforge.core.config.PipelineConfig;
import com.keyphraseforge.core.pipeline.PipelineResult;

import java.util.Objects;

/**
 * Everything a report generator needs to describe one run.
 *
 * @param inputDirectory corpus directory the run read from
 * @param extractorId id of the extractor used
 * @param config run configuration
 * @param result run result
 */
public record ReportInput(
    String inputDirectory,
    String extractorId,
    PipelineConfig config,
    PipelineResult result
) {
    /**
     * Compact constructor with validation.
     */
    public ReportInput {
        Objects.requireNonNull(config, "config must not be null");
        Objects.requireNonNull(result, "result must not be null");
        if (inputDirectory == null) {
            inputDirectory = "";
        }
        if (extractorId == null) {
            extractorId = config.extraction().extractor();
        }
    }
}
