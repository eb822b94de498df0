package com.keyphraseforge.core.report;

import java.util.Objects;

/**
 * A generated report file to be rendered.
 *
 * @param relativePath relative path for the file (e.g., "keyphrases.json")
 * @param content file content
 * @param contentType content type or format
 */
public record ReportFile(
    String relativePath,
    String content,
    String contentType
) {
    /**
     * Compact constructor with validation.
     */
    public ReportFile {
        Objects.requireNonNull(relativePath, "relativePath must not be null");
        Objects.requireNonNull(content, "content must not be null");
    }
}
