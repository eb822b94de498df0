package com.keyphraseforge.core.model;

import java.util.Objects;

/**
 * A documentation page supplied to a run.
 *
 * @param id unique document identifier (relative path for file-based corpora)
 * @param category configured category name (e.g. "reference", "common")
 * @param rawContent page content as handed to the extraction step
 */
public record Document(
    String id,
    String category,
    String rawContent
) {
    /**
     * Compact constructor with validation.
     */
    public Document {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(category, "category must not be null");
        if (rawContent == null) {
            rawContent = "";
        }
    }
}
