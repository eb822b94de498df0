package com.keyphraseforge.core.report;

/**
 * Interface for report renderers that handle output destinations.
 *
 * <p>Renderers are discovered via Java Service Provider Interface (SPI).
 *
 * <p><b>Registration:</b> Register implementations in
 * {@code META-INF/services/com.keyphraseforge.core.report.ReportRenderer}
 *
 * @see ReportBundle
 * @see RenderContext
 */
public interface ReportRenderer {

    /**
     * Returns unique identifier for this renderer.
     *
     * <p>Should be lowercase (e.g., "filesystem").
     *
     * @return unique renderer identifier
     */
    String getId();

    /**
     * Renders the report files to the target destination.
     *
     * @param bundle report files to render
     * @param context rendering context with output directory and settings
     * @throws IllegalStateException if the files cannot be written
     */
    void render(ReportBundle bundle, RenderContext context);
}
