package com.keyphraseforge.core.extraction.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.keyphraseforge.core.config.PipelineConfig;
import com.keyphraseforge.core.extraction.AbstractJsonExtractor;
import com.keyphraseforge.core.model.CandidatePhrase;
import com.keyphraseforge.core.model.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads candidates precomputed by an upstream extraction service.
 *
 * <p>The document is expected to carry the service response, for example:
 * <pre>{@code
 * {
 *   "document_name": "ach-payments.json",
 *   "type": "api_reference",
 *   "keyphrases": ["ACH payment", "ACH payments API", "same day ACH"]
 * }
 * }</pre>
 *
 * <p>The field name is configurable ({@code extraction.keyphraseField}). Content that is not
 * JSON, or a missing or non-array field, is a malformed response: a warning is logged and no
 * candidates are returned. Non-text array elements are skipped.
 */
public class EmbeddedKeyphraseExtractor extends AbstractJsonExtractor {

    private static final Logger log = LoggerFactory.getLogger(EmbeddedKeyphraseExtractor.class);

    private volatile String field = PipelineConfig.ExtractionSettings.defaults().keyphraseField();

    @Override
    public String getId() {
        return "embedded";
    }

    @Override
    public String getDisplayName() {
        return "Embedded Keyphrase List";
    }

    @Override
    public void configure(PipelineConfig config) {
        this.field = config.extraction().keyphraseField();
    }

    @Override
    public List<CandidatePhrase> extract(Document document) {
        JsonNode root;
        try {
            root = parseDocument(document);
        } catch (IOException e) {
            log.warn("Malformed extraction response for {}: {}", document.id(), e.getMessage());
            return List.of();
        }

        JsonNode phrases = root == null ? null : root.get(field);
        if (phrases == null || !phrases.isArray()) {
            log.warn("Malformed extraction response for {}: no '{}' array", document.id(), field);
            return List.of();
        }

        List<CandidatePhrase> candidates = new ArrayList<>(phrases.size());
        for (JsonNode phrase : phrases) {
            String text = getTextOrDefault(phrase, null);
            if (text != null) {
                candidates.add(CandidatePhrase.of(text, document));
            }
        }
        return candidates;
    }
}
