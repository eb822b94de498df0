package com.keyphraseforge.core.extraction;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.keyphraseforge.core.model.Document;

import java.io.IOException;
import java.util.regex.Pattern;

/**
 * Abstract base class for extractors that read JSON documentation pages using Jackson.
 *
 * <p>Provides a shared {@link ObjectMapper} and helpers for:
 * <ul>
 *   <li>parsing a document's raw content into a {@link JsonNode} tree</li>
 *   <li>type-safe value retrieval with defaults</li>
 *   <li>stripping HTML markup from rich-text fields</li>
 * </ul>
 */
public abstract class AbstractJsonExtractor implements KeyphraseExtractor {

    private static final Pattern HTML_TAG = Pattern.compile("<[^>]+>");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    /**
     * JSON mapper for parsing documents.
     * Thread-safe and reusable across parse operations.
     */
    protected final ObjectMapper objectMapper;

    protected AbstractJsonExtractor() {
        this.objectMapper = new ObjectMapper();
    }

    /**
     * Parses a document's content into a JsonNode tree.
     *
     * @param document document to parse
     * @return root node
     * @throws IOException if the content is not valid JSON
     */
    protected JsonNode parseDocument(Document document) throws IOException {
        return objectMapper.readTree(document.rawContent());
    }

    /**
     * Safely gets a text value with a default fallback.
     *
     * @param node JsonNode to extract from
     * @param defaultValue value to return if node is null or not textual
     * @return text value or default
     */
    protected String getTextOrDefault(JsonNode node, String defaultValue) {
        if (node == null || !node.isTextual()) {
            return defaultValue;
        }
        return node.asText();
    }

    /**
     * Replaces HTML tags with spaces and collapses whitespace.
     *
     * @param text rich text, may be null
     * @return plain text, never null
     */
    protected static String stripHtml(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        String plain = HTML_TAG.matcher(text).replaceAll(" ");
        return WHITESPACE.matcher(plain).replaceAll(" ").trim();
    }
}
