package com.keyphraseforge.core.report;

import java.util.List;
import java.util.Objects;

/**
 * Collection of report files to be rendered.
 *
 * @param files list of report files
 */
public record ReportBundle(
    List<ReportFile> files
) {
    /**
     * Compact constructor with validation.
     */
    public ReportBundle {
        Objects.requireNonNull(files, "files must not be null");
        files = List.copyOf(files);
    }
}
