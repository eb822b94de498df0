package com.keyphraseforge.core.report.impl;

import com.keyphraseforge.core.report.RenderContext;
import com.keyphraseforge.core.report.ReportBundle;
import com.keyphraseforge.core.report.ReportFile;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link FileSystemReportRenderer}.
 */
class FileSystemReportRendererTest {

    @TempDir
    Path tempDir;

    private final FileSystemReportRenderer renderer = new FileSystemReportRenderer();

    @Test
    void render_createsOutputDirectoryAndWritesFiles() throws IOException {
        Path outputDir = tempDir.resolve("out/reports");
        ReportBundle bundle = new ReportBundle(List.of(
            new ReportFile("keyphrases.json", "{\"keyphrases\": []}", "application/json"),
            new ReportFile("archive/keyphrases.md", "# Keyphrase Report", "text/markdown")));

        renderer.render(bundle, new RenderContext(outputDir.toString()));

        assertThat(Files.readString(outputDir.resolve("keyphrases.json"))).isEqualTo("{\"keyphrases\": []}");
        assertThat(outputDir.resolve("archive/keyphrases.md")).hasContent("# Keyphrase Report");
    }

    @Test
    void render_existingFile_isOverwritten() throws IOException {
        Files.writeString(tempDir.resolve("keyphrases.json"), "old");

        renderer.render(new ReportBundle(List.of(new ReportFile("keyphrases.json", "new", null))),
            new RenderContext(tempDir.toString()));

        assertThat(tempDir.resolve("keyphrases.json")).hasContent("new");
    }

    @Test
    void render_outputPathIsAFile_throwsIllegalStateException() throws IOException {
        Path blocker = tempDir.resolve("blocker");
        Files.writeString(blocker, "x");

        assertThatThrownBy(() -> renderer.render(
                new ReportBundle(List.of(new ReportFile("keyphrases.json", "{}", null))),
                new RenderContext(blocker.toString())))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("Failed to create output directory");
    }
}
