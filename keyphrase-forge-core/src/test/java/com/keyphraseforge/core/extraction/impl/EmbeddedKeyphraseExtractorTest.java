package com.keyphraseforge.core.extraction.impl;

import com.keyphraseforge.core.config.PipelineConfig;
import com.keyphraseforge.core.config.PipelineConfig.ExtractionSettings;
import com.keyphraseforge.core.model.CandidatePhrase;
import com.keyphraseforge.core.model.Document;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link EmbeddedKeyphraseExtractor}.
 */
class EmbeddedKeyphraseExtractorTest {

    private final EmbeddedKeyphraseExtractor extractor = new EmbeddedKeyphraseExtractor();

    @Test
    void extract_serviceResponse_returnsPhrasesInOrder() {
        Document document = new Document("api-reference/ach.json", "reference", """
            {
              "document_name": "ach.json",
              "type": "api_reference",
              "keyphrases": ["ACH payment", "same day ACH", 42, "ACH returns"]
            }
            """);

        List<CandidatePhrase> phrases = extractor.extract(document);

        assertThat(phrases).extracting(CandidatePhrase::text)
            .containsExactly("ACH payment", "same day ACH", "ACH returns");
        assertThat(phrases).allSatisfy(p -> {
            assertThat(p.sourceDocumentId()).isEqualTo("api-reference/ach.json");
            assertThat(p.category()).isEqualTo("reference");
        });
    }

    @Test
    void extract_notJson_returnsEmpty() {
        Document document = new Document("broken.json", "reference", "not json {");

        assertThat(extractor.extract(document)).isEmpty();
    }

    @Test
    void extract_missingField_returnsEmpty() {
        Document document = new Document("page.json", "guide", "{\"header\": \"Wires\"}");

        assertThat(extractor.extract(document)).isEmpty();
    }

    @Test
    void configure_customField_readsThatField() {
        PipelineConfig config = PipelineConfig.defaults()
            .withExtraction(new ExtractionSettings("embedded", 1, 1, 0L, 0L, "terms"));
        extractor.configure(config);
        Document document = new Document("page.json", "guide", "{\"terms\": [\"wire limits\"]}");

        assertThat(extractor.extract(document)).extracting(CandidatePhrase::text).containsExactly("wire limits");
    }
}
