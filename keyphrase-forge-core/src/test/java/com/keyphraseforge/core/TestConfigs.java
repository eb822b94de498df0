package com.keyphraseforge.core;

import com.keyphraseforge.core.config.PipelineConfig;
import com.keyphraseforge.core.config.PipelineConfig.AcronymEntry;
import com.keyphraseforge.core.config.PipelineConfig.CategoryConfig;
import com.keyphraseforge.core.config.PipelineConfig.ExtractionSettings;
import com.keyphraseforge.core.config.PipelineConfig.MergeSettings;
import com.keyphraseforge.core.config.PipelineConfig.ScoringSettings;
import com.keyphraseforge.core.config.PipelineConfig.WordCountRange;

import java.util.List;

/**
 * Small configurations shared by the core tests.
 */
public final class TestConfigs {

    private TestConfigs() {
    }

    /**
     * Three categories (reference, guide, common), word range 1-4, no retry delay.
     */
    public static PipelineConfig small() {
        return withCategories(20, List.of(
            category("reference", 10, 2, 3.0),
            category("guide", 10, 2, 2.0),
            category("common", 5, 1, 1.0)
        ));
    }

    public static PipelineConfig withCategories(int globalTarget, List<CategoryConfig> categories) {
        return build(globalTarget, categories, false);
    }

    /**
     * Same categories as {@link #small()}, with containment limited to related categories.
     */
    public static PipelineConfig restrictedContainment() {
        return build(20, small().categories(), true);
    }

    private static PipelineConfig build(int globalTarget, List<CategoryConfig> categories, boolean restricted) {
        return new PipelineConfig(
            globalTarget,
            categories,
            categories.get(0).name(),
            "common",
            new WordCountRange(1, 4),
            List.of("api", "documentation", "guide"),
            List.of(
                new AcronymEntry("ACH", "Automated Clearing House"),
                new AcronymEntry("RTP", "Real-Time Payments"),
                new AcronymEntry("SEPA", null)
            ),
            List.of("how to"),
            ScoringSettings.defaults(),
            new MergeSettings(restricted),
            new ExtractionSettings("embedded", 2, 3, 0L, 0L, "keyphrases")
        );
    }

    public static CategoryConfig category(String name, int softTarget, int margin, double weight) {
        return new CategoryConfig(name, softTarget, margin, weight, null, List.of(name), List.of(), List.of());
    }
}
