package com.keyphraseforge.core.report.impl;

import com.keyphraseforge.core.report.RenderContext;
import com.keyphraseforge.core.report.ReportBundle;
import com.keyphraseforge.core.report.ReportFile;
import com.keyphraseforge.core.report.ReportRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Renderer that writes report files to the filesystem.
 *
 * <p>Creates the output directory automatically and overwrites existing reports.
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * RenderContext context = new RenderContext("./output", Map.of());
 * ReportBundle bundle = new ReportBundle(List.of(
 *     new ReportFile("keyphrases.json", "{...}", "application/json")
 * ));
 *
 * new FileSystemReportRenderer().render(bundle, context);
 * // Creates: ./output/keyphrases.json
 * }</pre>
 */
public class FileSystemReportRenderer implements ReportRenderer {

    private static final Logger log = LoggerFactory.getLogger(FileSystemReportRenderer.class);

    @Override
    public String getId() {
        return "filesystem";
    }

    @Override
    public void render(ReportBundle bundle, RenderContext context) {
        Path outputDir = Paths.get(context.outputDirectory());
        log.info("Writing {} report files to {}", bundle.files().size(), outputDir);

        try {
            Files.createDirectories(outputDir);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to create output directory: " + outputDir, e);
        }

        for (ReportFile file : bundle.files()) {
            writeFile(outputDir, file);
        }
    }

    private void writeFile(Path outputDir, ReportFile file) {
        Path targetPath = outputDir.resolve(file.relativePath());
        try {
            Path parentDir = targetPath.getParent();
            if (parentDir != null) {
                Files.createDirectories(parentDir);
            }
            Files.writeString(targetPath, file.content(), StandardCharsets.UTF_8);
            log.debug("Wrote {} ({} chars)", targetPath, file.content().length());
        } catch (IOException e) {
            throw new IllegalStateException("Failed to write file: " + file.relativePath(), e);
        }
    }
}
