package com.keyphraseforge.core.report;

/**
 * Interface for report generators that turn a run result into a file.
 *
 * <p>Generators are discovered via Java Service Provider Interface (SPI) and selected by id
 * (the CLI {@code --format} option).
 *
 * <p><b>Registration:</b> Register implementations in
 * {@code META-INF/services/com.keyphraseforge.core.report.ReportGenerator}
 *
 * @see ReportRenderer
 */
public interface ReportGenerator {

    /** Base name shared by every report file. */
    String REPORT_BASENAME = "keyphrases";

    /**
     * Returns unique identifier for this generator.
     *
     * <p>Should be lowercase (e.g., "json", "markdown").
     *
     * @return unique generator identifier
     */
    String getId();

    /**
     * Returns human-readable display name for this generator.
     *
     * @return display name
     */
    String getDisplayName();

    /**
     * Returns file extension for generated reports.
     *
     * @return file extension without leading dot
     */
    String getFileExtension();

    /**
     * Generates the report.
     *
     * <p>An empty run still produces a complete report.
     *
     * @param input run to describe
     * @return report file named {@code keyphrases.<extension>}
     */
    ReportFile generate(ReportInput input);

    /**
     * Returns the relative path of this generator's report.
     *
     * @return file name
     */
    default String fileName() {
        return REPORT_BASENAME + "." + getFileExtension();
    }
}
