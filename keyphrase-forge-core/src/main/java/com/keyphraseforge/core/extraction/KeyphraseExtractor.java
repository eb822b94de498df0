package com.keyphraseforge.core.extraction;

import com.keyphraseforge.core.config.PipelineConfig;
import com.keyphraseforge.core.model.CandidatePhrase;
import com.keyphraseforge.core.model.Document;

import java.util.List;

/**
 * Produces raw candidate phrases for one document.
 *
 * <p>Extractors are discovered via Java Service Provider Interface (SPI) and selected by
 * {@link #getId()}. Extraction is the only step of a run allowed to run concurrently, so
 * implementations must be safe to call from several worker threads at once.
 *
 * <p><b>Registration:</b> Register implementations in
 * {@code META-INF/services/com.keyphraseforge.core.extraction.KeyphraseExtractor}
 *
 * @see RetryingExtraction
 */
public interface KeyphraseExtractor {

    /**
     * Returns unique identifier for this extractor.
     *
     * <p>Referenced from configuration and the CLI {@code --extractor} option
     * (e.g., "embedded", "headings").
     *
     * @return unique extractor identifier
     */
    String getId();

    /**
     * Returns human-readable display name for this extractor.
     *
     * @return display name
     */
    String getDisplayName();

    /**
     * Applies run configuration before the first call. The default does nothing.
     *
     * @param config validated pipeline configuration
     */
    default void configure(PipelineConfig config) {
    }

    /**
     * Extracts candidate phrases from a document.
     *
     * <p>A malformed but readable response is not a failure: implementations log a warning and
     * return an empty list. Throw {@link ExtractionException} only for failures worth retrying.
     *
     * @param document document to extract from
     * @return candidates in document order
     * @throws ExtractionException if the call failed
     */
    List<CandidatePhrase> extract(Document document) throws ExtractionException;
}
