package com.keyphraseforge.core.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link ConfigLoader}.
 */
class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void load_validYaml_returnsConfig() throws IOException {
        Path configFile = tempDir.resolve("keyphrase-forge.yaml");
        Files.writeString(configFile, """
            globalTarget: 50
            commonCategory: common
            defaultCategory: guide

            categories:
              - name: reference
                softTarget: 30
                overflowMargin: 5
                priorityWeight: 3.0
                folders: [api-reference]
                markers: [APIReference]
              - name: guide
                softTarget: 15
                overflowMargin: 2
                related: [reference]
              - name: common
                softTarget: 5
                overflowMargin: 1
                wordCountRange: { min: 1, max: 4 }

            stoplist: [api, docs]

            acronyms:
              - acronym: RTP
                fullName: Real-Time Payments
              - acronym: SEPA

            scoring:
              howToBonus: 1.5

            extraction:
              extractor: headings
              workers: 2
              maxAttempts: 5
            """);

        PipelineConfig config = ConfigLoader.load(configFile);

        assertThat(config.globalTarget()).isEqualTo(50);
        assertThat(config.categoryNames()).containsExactly("reference", "guide", "common");
        assertThat(config.findCategory("reference")).hasValueSatisfying(c -> {
            assertThat(c.priorityWeight()).isEqualTo(3.0);
            assertThat(c.folders()).containsExactly("api-reference");
            assertThat(c.markers()).containsExactly("APIReference");
        });
        assertThat(config.findCategory("guide")).hasValueSatisfying(c -> {
            assertThat(c.priorityWeight()).isEqualTo(1.0);
            assertThat(c.isRelatedTo("Reference")).isTrue();
        });
        assertThat(config.wordCountRangeFor("common")).isEqualTo(new PipelineConfig.WordCountRange(1, 4));
        assertThat(config.wordCountRangeFor("guide")).isEqualTo(new PipelineConfig.WordCountRange(1, 5));
        assertThat(config.stoplist()).containsExactly("api", "docs");
        assertThat(config.acronyms()).hasSize(2);
        assertThat(config.acronyms().get(1).fullName()).isNull();
        assertThat(config.scoring().howToBonus()).isEqualTo(1.5);
        assertThat(config.scoring().breadthWeight()).isEqualTo(1.0);
        assertThat(config.extraction().extractor()).isEqualTo("headings");
        assertThat(config.extraction().workers()).isEqualTo(2);
        assertThat(config.extraction().maxAttempts()).isEqualTo(5);
        assertThat(config.extraction().keyphraseField()).isEqualTo("keyphrases");
    }

    @Test
    void load_minimalYaml_fillsDefaults() throws IOException {
        Path configFile = tempDir.resolve("keyphrase-forge.yaml");
        Files.writeString(configFile, """
            categories:
              - name: reference
                softTarget: 10
            """);

        PipelineConfig config = ConfigLoader.load(configFile);

        assertThat(config.globalTarget()).isEqualTo(PipelineConfig.DEFAULT_GLOBAL_TARGET);
        assertThat(config.howToPrefixes()).containsExactly("how to");
        assertThat(config.merge().restrictContainmentToRelatedCategories()).isTrue();
        assertThat(config.extraction()).isEqualTo(PipelineConfig.ExtractionSettings.defaults());
    }

    @Test
    void load_containmentRestrictionTurnedOff_isHonored() throws IOException {
        Path configFile = tempDir.resolve("open-merge.yaml");
        Files.writeString(configFile, """
            categories:
              - name: reference
                softTarget: 10
            merge:
              restrictContainmentToRelatedCategories: false
            """);

        PipelineConfig config = ConfigLoader.load(configFile);

        assertThat(config.merge().restrictContainmentToRelatedCategories()).isFalse();
    }

    @Test
    void load_missingFile_throwsConfigurationException() {
        Path missing = tempDir.resolve("missing.yaml");

        assertThatThrownBy(() -> ConfigLoader.load(missing))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("not found");
    }

    @Test
    void loadOrDefaults_missingFile_returnsDefaults() {
        PipelineConfig config = ConfigLoader.loadOrDefaults(tempDir.resolve("missing.yaml"));

        assertThat(config).isEqualTo(PipelineConfig.defaults());
        assertThat(config.categoryNames()).contains("reference", "common");
    }

    @Test
    void load_malformedYaml_throwsConfigurationException() throws IOException {
        Path configFile = tempDir.resolve("keyphrase-forge.yaml");
        Files.writeString(configFile, """
            categories:
              - name: reference
                softTarget: [not, a, number
            """);

        assertThatThrownBy(() -> ConfigLoader.load(configFile))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("Failed to parse");
    }

    @Test
    void load_invalidValues_reportsEveryProblem() throws IOException {
        Path configFile = tempDir.resolve("keyphrase-forge.yaml");
        Files.writeString(configFile, """
            globalTarget: 0
            categories:
              - name: reference
                softTarget: -1
              - name: guide
            extraction:
              workers: 0
            """);

        assertThatThrownBy(() -> ConfigLoader.load(configFile))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("globalTarget must be positive")
            .hasMessageContaining("negative softTarget")
            .hasMessageContaining("guide has no softTarget")
            .hasMessageContaining("extraction.workers");
    }

    @Test
    void loadOrDefaults_existingInvalidFile_doesNotFallBack() throws IOException {
        Path configFile = tempDir.resolve("keyphrase-forge.yaml");
        Files.writeString(configFile, "categories: []\n");

        assertThatThrownBy(() -> ConfigLoader.loadOrDefaults(configFile))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("at least one category");
    }
}
