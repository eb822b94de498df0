package com.keyphraseforge.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link RunCommand}.
 */
class RunCommandTest {

    @TempDir
    Path tempDir;

    private Path corpus;
    private Path output;

    @BeforeEach
    void setUp() throws IOException {
        corpus = tempDir.resolve("docs");
        output = tempDir.resolve("out");
        write("guides/wires.json", """
            {"document_name": "wires.json", "keyphrases": ["wire transfer", "wire transfers", "documentation"]}
            """);
        write("api-reference/payees.json", """
            {"document_name": "payees.json", "keyphrases": ["payee lookup", "wire transfer"]}
            """);
        write("common/terms.json", """
            {"document_name": "terms.json", "keyphrases": ["cut-off times"]}
            """);
    }

    @Test
    void run_corpus_writesJsonAndMarkdownReports() throws IOException {
        int exitCode = new CommandLine(new RunCommand()).execute(corpus.toString(), "-o", output.toString());

        assertThat(exitCode).isZero();
        assertThat(output.resolve("keyphrases.json")).exists();
        assertThat(output.resolve("keyphrases.md")).exists();

        JsonNode report = new ObjectMapper().readTree(output.resolve("keyphrases.json").toFile());
        assertThat(report.path("stats").path("total_files_processed").asInt()).isEqualTo(3);
        assertThat(report.path("keyphrases").get(0).path("text").asText()).isEqualTo("wire transfer");
        assertThat(report.path("audit").get(0).path("reason").asText()).isEqualTo("STOPLISTED");
    }

    @Test
    void run_targetOverride_limitsOutput() throws IOException {
        int exitCode = new CommandLine(new RunCommand())
            .execute(corpus.toString(), "-o", output.toString(), "--target", "1", "--format", "json");

        assertThat(exitCode).isZero();
        assertThat(output.resolve("keyphrases.md")).doesNotExist();
        JsonNode report = new ObjectMapper().readTree(output.resolve("keyphrases.json").toFile());
        assertThat(report.path("keyphrases").size()).isEqualTo(1);
        assertThat(report.path("configuration").path("target_count").asInt()).isEqualTo(1);
    }

    @Test
    void run_defaultOutput_skipsPreviousReportOnRerun() throws IOException {
        CommandLine commandLine = new CommandLine(new RunCommand());

        assertThat(commandLine.execute(corpus.toString())).isZero();
        assertThat(new CommandLine(new RunCommand()).execute(corpus.toString())).isZero();

        JsonNode report = new ObjectMapper().readTree(corpus.resolve("keyphrases.json").toFile());
        assertThat(report.path("stats").path("total_files_processed").asInt()).isEqualTo(3);
    }

    @Test
    void run_dryRun_writesNothing() {
        int exitCode = new CommandLine(new RunCommand())
            .execute(corpus.toString(), "-o", output.toString(), "--dry-run");

        assertThat(exitCode).isZero();
        assertThat(output).doesNotExist();
    }

    @Test
    void run_invalidConfig_returnsErrorWithoutWriting() throws IOException {
        Path config = tempDir.resolve("broken.yaml");
        Files.writeString(config, "globalTarget: 0\ncategories: []\n");

        int exitCode = new CommandLine(new RunCommand())
            .execute(corpus.toString(), "-o", output.toString(), "-c", config.toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(output).doesNotExist();
    }

    @Test
    void run_unknownFormat_returnsError() {
        int exitCode = new CommandLine(new RunCommand())
            .execute(corpus.toString(), "-o", output.toString(), "--format", "pdf");

        assertThat(exitCode).isEqualTo(1);
        assertThat(output).doesNotExist();
    }

    @Test
    void run_missingCorpus_returnsError() {
        int exitCode = new CommandLine(new RunCommand()).execute(tempDir.resolve("missing").toString());

        assertThat(exitCode).isEqualTo(1);
    }

    @Test
    void run_headingExtractor_readsPageHeadings() throws IOException {
        write("guides/ach.json", """
            {"gatewayGuides": {"header": "Same Day ACH", "sectionHeader": "Returns"}}
            """);

        int exitCode = new CommandLine(new RunCommand())
            .execute(corpus.toString(), "-o", output.toString(), "--extractor", "headings", "-f", "json");

        assertThat(exitCode).isZero();
        assertThat(Files.readString(output.resolve("keyphrases.json")))
            .contains("\"same day ACH\"")
            .contains("\"returns\"")
            .contains("\"headings\"");
    }

    private void write(String relativePath, String content) throws IOException {
        Path file = corpus.resolve(relativePath);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
    }
}
