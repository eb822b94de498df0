package com.keyphraseforge.core.extraction.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.keyphraseforge.core.extraction.AbstractJsonExtractor;
import com.keyphraseforge.core.extraction.ExtractionException;
import com.keyphraseforge.core.model.CandidatePhrase;
import com.keyphraseforge.core.model.Document;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Offline extractor that takes candidates from the headings of a documentation page.
 *
 * <p>Walks the page JSON depth-first in document order and collects the values of the
 * heading fields ({@code header}, {@code pageTitleSuffix}, {@code introductionHeader},
 * {@code useCaseHeader}, {@code sectionHeader}, {@code subSectionHeader}) and of request
 * {@code parameter} names, with HTML removed. Every use-case header also yields a
 * "how to ..." task phrase. Duplicates (ignoring case) are dropped.
 */
public class HeadingKeyphraseExtractor extends AbstractJsonExtractor {

    private static final Set<String> HEADING_FIELDS = Set.of(
        "header", "pageTitleSuffix", "introductionHeader", "useCaseHeader",
        "sectionHeader", "subSectionHeader", "parameter");

    private static final String USE_CASE_FIELD = "useCaseHeader";
    private static final int MAX_DEPTH = 10;

    @Override
    public String getId() {
        return "headings";
    }

    @Override
    public String getDisplayName() {
        return "Page Heading Extractor";
    }

    @Override
    public List<CandidatePhrase> extract(Document document) throws ExtractionException {
        JsonNode root;
        try {
            root = parseDocument(document);
        } catch (IOException e) {
            throw new ExtractionException("Document " + document.id() + " is not valid JSON", e);
        }

        Set<String> seen = new LinkedHashSet<>();
        List<CandidatePhrase> candidates = new ArrayList<>();
        collect(root, MAX_DEPTH, document, seen, candidates);
        return candidates;
    }

    private void collect(JsonNode node, int depth, Document document, Set<String> seen,
                         List<CandidatePhrase> out) {
        if (node == null || depth <= 0) {
            return;
        }
        if (node.isArray()) {
            for (JsonNode item : node) {
                collect(item, depth - 1, document, seen, out);
            }
            return;
        }
        if (!node.isObject()) {
            return;
        }

        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode value = field.getValue();
            if (HEADING_FIELDS.contains(field.getKey()) && value.isTextual()) {
                String text = stripHtml(value.asText());
                add(text, document, seen, out);
                if (USE_CASE_FIELD.equals(field.getKey()) && !text.isEmpty()) {
                    add(toHowTo(text), document, seen, out);
                }
            } else if (value.isContainerNode()) {
                collect(value, depth - 1, document, seen, out);
            }
        }
    }

    private static void add(String text, Document document, Set<String> seen, List<CandidatePhrase> out) {
        if (text.isEmpty()) {
            return;
        }
        if (seen.add(text.toLowerCase(Locale.ROOT))) {
            out.add(CandidatePhrase.of(text, document));
        }
    }

    static String toHowTo(String useCase) {
        String lower = useCase.toLowerCase(Locale.ROOT);
        if (lower.startsWith("how to ")) {
            return useCase;
        }
        return "how to " + Character.toLowerCase(useCase.charAt(0)) + useCase.substring(1);
    }
}
