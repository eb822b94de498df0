package com.keyphraseforge.core.util;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link FileUtils}.
 */
class FileUtilsTest {

    @TempDir
    Path tempDir;

    @Test
    void findFiles_matchesTopLevelAndNestedFilesSortedByPath() throws IOException {
        Files.createDirectories(tempDir.resolve("guides/wires"));
        Files.writeString(tempDir.resolve("guides/wires/limits.json"), "{}");
        Files.writeString(tempDir.resolve("guides/ach.json"), "{}");
        Files.writeString(tempDir.resolve("index.json"), "{}");
        Files.writeString(tempDir.resolve("README.md"), "# docs");

        List<Path> files = FileUtils.findFiles(tempDir, "{*.json,**/*.json}");

        assertThat(files).extracting(p -> FileUtils.relativePath(tempDir, p))
            .containsExactly("guides/ach.json", "guides/wires/limits.json", "index.json");
    }

    @Test
    void findFiles_noMatches_returnsEmpty() throws IOException {
        Files.writeString(tempDir.resolve("notes.txt"), "text");

        assertThat(FileUtils.findFiles(tempDir, "**/*.json")).isEmpty();
    }

    @Test
    void relativePath_usesForwardSlashes() {
        Path nested = tempDir.resolve("api-reference").resolve("ach.json");

        assertThat(FileUtils.relativePath(tempDir, nested)).isEqualTo("api-reference/ach.json");
    }

    @Test
    void isSameFile_comparesNormalizedPaths() {
        Path file = tempDir.resolve("out/keyphrases.json");

        assertThat(FileUtils.isSameFile(file, tempDir.resolve("out/../out/keyphrases.json"))).isTrue();
        assertThat(FileUtils.isSameFile(file, tempDir.resolve("keyphrases.json"))).isFalse();
        assertThat(FileUtils.isSameFile(file, null)).isFalse();
    }
}
