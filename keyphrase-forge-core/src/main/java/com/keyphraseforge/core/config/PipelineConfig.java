package com.keyphraseforge.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.keyphraseforge.core.model.CategoryQuota;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Root configuration for a keyphrase aggregation run.
 *
 * <p>Loaded from {@code keyphrase-forge.yaml}. Categories are plain data: each one
 * carries its soft quota, ranking weight, word-count bounds and the folder names
 * and content markers used to classify documentation pages.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * globalTarget: 300
 * commonCategory: common
 * defaultCategory: overview
 *
 * categories:
 *   - name: reference
 *     softTarget: 120
 *     overflowMargin: 15
 *     priorityWeight: 3.0
 *     folders: [api-reference]
 *     markers: [APIReference]
 *   - name: common
 *     softTarget: 20
 *     overflowMargin: 5
 *     wordCountRange: { min: 1, max: 4 }
 *
 * stoplist: [api, documentation, guide]
 *
 * acronyms:
 *   - acronym: RTP
 *     fullName: Real-Time Payments
 *
 * extraction:
 *   extractor: embedded
 *   workers: 4
 *   maxAttempts: 3
 * }</pre>
 *
 * @param globalTarget target size of the final keyphrase list
 * @param categories category definitions
 * @param defaultCategory category used when a page gives no folder or content hint
 * @param commonCategory category processed in the dedicated first pass
 * @param defaultWordCountRange word-count bounds for categories without an override
 * @param stoplist generic terms that are never admitted
 * @param acronyms acronym table (casing and acronym/full-name pairing)
 * @param howToPrefixes prefixes that mark high-intent task phrases
 * @param scoring ranking weights
 * @param merge similarity merge settings
 * @param extraction extraction call settings
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PipelineConfig(
    @JsonProperty("globalTarget") Integer globalTarget,
    @JsonProperty("categories") List<CategoryConfig> categories,
    @JsonProperty("defaultCategory") String defaultCategory,
    @JsonProperty("commonCategory") String commonCategory,
    @JsonProperty("defaultWordCountRange") WordCountRange defaultWordCountRange,
    @JsonProperty("stoplist") List<String> stoplist,
    @JsonProperty("acronyms") List<AcronymEntry> acronyms,
    @JsonProperty("howToPrefixes") List<String> howToPrefixes,
    @JsonProperty("scoring") ScoringSettings scoring,
    @JsonProperty("merge") MergeSettings merge,
    @JsonProperty("extraction") ExtractionSettings extraction
) {
    public static final int DEFAULT_GLOBAL_TARGET = 300;

    /**
     * Compact constructor filling in defaults for omitted sections.
     */
    public PipelineConfig {
        if (globalTarget == null) {
            globalTarget = DEFAULT_GLOBAL_TARGET;
        }
        if (categories == null) {
            categories = List.of();
        }
        if (defaultWordCountRange == null) {
            defaultWordCountRange = new WordCountRange(1, 5);
        }
        if (stoplist == null) {
            stoplist = List.of();
        }
        if (acronyms == null) {
            acronyms = List.of();
        }
        if (howToPrefixes == null) {
            howToPrefixes = List.of("how to");
        }
        if (scoring == null) {
            scoring = ScoringSettings.defaults();
        }
        if (merge == null) {
            merge = MergeSettings.defaults();
        }
        if (extraction == null) {
            extraction = ExtractionSettings.defaults();
        }
    }

    /**
     * Creates the default configuration for banking API documentation portals.
     *
     * <p>Soft targets split the default global target of 300 across the five
     * page categories; the common section is limited to 4-word phrases.
     *
     * @return default configuration
     */
    public static PipelineConfig defaults() {
        return new PipelineConfig(
            DEFAULT_GLOBAL_TARGET,
            List.of(
                new CategoryConfig("reference", 120, 15, 3.0, null,
                    List.of("api-reference", "api reference", "apireference", "reference"),
                    List.of("APIReference"), List.of("overview")),
                new CategoryConfig("guide", 90, 15, 2.5, null,
                    List.of("guides", "guide"), List.of("gatewayGuides"), List.of("solution")),
                new CategoryConfig("solution", 45, 10, 2.0, null,
                    List.of("solution", "solutions"), List.of(), List.of("guide")),
                new CategoryConfig("overview", 25, 5, 1.5, null,
                    List.of("api-overview", "product-overview", "productoverview", "overview"),
                    List.of(), List.of("reference")),
                new CategoryConfig("common", 20, 5, 1.0, new WordCountRange(1, 4),
                    List.of("common"), List.of(), List.of())
            ),
            "overview",
            "common",
            new WordCountRange(1, 5),
            List.of(
                "api", "apis", "documentation", "docs", "guide", "guides", "overview",
                "sandbox", "production", "validation", "bearer token", "oauth 2.0", "api key",
                "content-type", "authorization", "client-request-id",
                "400 bad request", "401 unauthorized", "postman collection", "swagger file"
            ),
            List.of(
                new AcronymEntry("ACH", "Automated Clearing House"),
                new AcronymEntry("RTP", "Real-Time Payments"),
                new AcronymEntry("UETR", "Unique End-to-End Transaction Reference"),
                new AcronymEntry("SEC", "Standard Entry Class"),
                new AcronymEntry("API", null),
                new AcronymEntry("CCD", null),
                new AcronymEntry("PPD", null),
                new AcronymEntry("CTX", null),
                new AcronymEntry("IAT", null)
            ),
            List.of("how to"),
            ScoringSettings.defaults(),
            MergeSettings.defaults(),
            ExtractionSettings.defaults()
        );
    }

    /**
     * Validates the configuration.
     *
     * @return this configuration, for chaining
     * @throws ConfigurationException describing every problem found
     */
    public PipelineConfig validate() {
        List<String> problems = new ArrayList<>();

        if (globalTarget <= 0) {
            problems.add("globalTarget must be positive, was " + globalTarget);
        }
        if (categories.isEmpty()) {
            problems.add("at least one category must be configured");
        }

        Set<String> names = new HashSet<>();
        for (int i = 0; i < categories.size(); i++) {
            CategoryConfig category = categories.get(i);
            if (category == null || category.name() == null || category.name().isBlank()) {
                problems.add("categories[" + i + "] has no name");
                continue;
            }
            String name = category.name();
            if (!names.add(name.toLowerCase(Locale.ROOT))) {
                problems.add("duplicate category: " + name);
            }
            if (category.softTarget() == null) {
                problems.add("category " + name + " has no softTarget");
            } else if (category.softTarget() < 0) {
                problems.add("category " + name + " has negative softTarget " + category.softTarget());
            }
            if (category.overflowMargin() < 0) {
                problems.add("category " + name + " has negative overflowMargin " + category.overflowMargin());
            }
            if (!Double.isFinite(category.priorityWeight())) {
                problems.add("category " + name + " has non-finite priorityWeight");
            }
            if (category.wordCountRange() != null && !category.wordCountRange().isValid()) {
                problems.add("category " + name + " has invalid wordCountRange " + category.wordCountRange());
            }
        }

        if (!defaultWordCountRange.isValid()) {
            problems.add("defaultWordCountRange is invalid: " + defaultWordCountRange);
        }
        if (defaultCategory != null && !categories.isEmpty() && findCategory(defaultCategory).isEmpty()) {
            problems.add("defaultCategory " + defaultCategory + " is not a configured category");
        }
        for (int i = 0; i < acronyms.size(); i++) {
            AcronymEntry entry = acronyms.get(i);
            if (entry == null || entry.acronym() == null || entry.acronym().isBlank()) {
                problems.add("acronyms[" + i + "] has no acronym");
            }
        }
        if (!Double.isFinite(scoring.breadthWeight())
                || !Double.isFinite(scoring.overQuotaPenalty())
                || !Double.isFinite(scoring.howToBonus())) {
            problems.add("scoring weights must be finite numbers");
        }
        if (extraction.workers() < 1) {
            problems.add("extraction.workers must be at least 1, was " + extraction.workers());
        }
        if (extraction.maxAttempts() < 1) {
            problems.add("extraction.maxAttempts must be at least 1, was " + extraction.maxAttempts());
        }
        if (extraction.initialBackoffMillis() < 0 || extraction.maxBackoffMillis() < 0) {
            problems.add("extraction backoff values must not be negative");
        }

        if (!problems.isEmpty()) {
            throw new ConfigurationException("Invalid configuration: " + String.join("; ", problems));
        }
        return this;
    }

    /**
     * Looks up a category by name (case-insensitive).
     *
     * @param name category name
     * @return the category, if configured
     */
    public Optional<CategoryConfig> findCategory(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return categories.stream()
            .filter(c -> c != null && c.name() != null && c.name().equalsIgnoreCase(name))
            .findFirst();
    }

    /**
     * Returns whether the given category is the common section.
     *
     * @param category category name
     * @return true if it names the common category
     */
    public boolean isCommon(String category) {
        return commonCategory != null && commonCategory.equalsIgnoreCase(category);
    }

    /**
     * Returns the word-count range for a category, falling back to the default range.
     *
     * @param category category name
     * @return effective word-count range
     */
    public WordCountRange wordCountRangeFor(String category) {
        return findCategory(category)
            .map(CategoryConfig::wordCountRange)
            .orElse(defaultWordCountRange);
    }

    /**
     * Returns the ranking weight for a category; unknown categories weigh nothing.
     *
     * @param category category name
     * @return priority weight
     */
    public double priorityWeightFor(String category) {
        return findCategory(category).map(CategoryConfig::priorityWeight).orElse(0.0);
    }

    /**
     * Builds the read-only quota table, keyed by category name in configuration order.
     *
     * @return quotas by category
     */
    public Map<String, CategoryQuota> quotas() {
        Map<String, CategoryQuota> quotas = new LinkedHashMap<>();
        for (CategoryConfig category : categories) {
            quotas.put(category.name(), new CategoryQuota(
                category.name(), category.softTarget(), category.overflowMargin()));
        }
        return Collections.unmodifiableMap(quotas);
    }

    /**
     * Returns the configured category names in configuration order.
     *
     * @return category names
     */
    public List<String> categoryNames() {
        return categories.stream().map(CategoryConfig::name).toList();
    }

    /**
     * Returns a copy of this configuration with a different global target.
     *
     * @param target new global target
     * @return updated configuration
     */
    public PipelineConfig withGlobalTarget(int target) {
        return new PipelineConfig(target, categories, defaultCategory, commonCategory,
            defaultWordCountRange, stoplist, acronyms, howToPrefixes, scoring, merge, extraction);
    }

    /**
     * Returns a copy of this configuration with different extraction settings.
     *
     * @param settings new extraction settings
     * @return updated configuration
     */
    public PipelineConfig withExtraction(ExtractionSettings settings) {
        return new PipelineConfig(globalTarget, categories, defaultCategory, commonCategory,
            defaultWordCountRange, stoplist, acronyms, howToPrefixes, scoring, merge, settings);
    }

    /**
     * Category definition.
     *
     * @param name category name (e.g. "reference", "guide")
     * @param softTarget soft quota of admitted clusters
     * @param overflowMargin clusters allowed above the soft target before admission is deprioritized
     * @param priorityWeight ranking weight reflecting expected search volume
     * @param wordCountRange optional word-count override
     * @param folders folder names that classify a page into this category
     * @param markers top-level JSON keys that classify a page into this category
     * @param related categories considered related for specificity merges
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record CategoryConfig(
        @JsonProperty("name") String name,
        @JsonProperty("softTarget") Integer softTarget,
        @JsonProperty("overflowMargin") int overflowMargin,
        @JsonProperty("priorityWeight") Double priorityWeight,
        @JsonProperty("wordCountRange") WordCountRange wordCountRange,
        @JsonProperty("folders") List<String> folders,
        @JsonProperty("markers") List<String> markers,
        @JsonProperty("related") List<String> related
    ) {
        public CategoryConfig {
            if (priorityWeight == null) {
                priorityWeight = 1.0;
            }
            if (folders == null) {
                folders = List.of();
            }
            if (markers == null) {
                markers = List.of();
            }
            if (related == null) {
                related = List.of();
            }
        }

        /**
         * Returns whether another category counts as related to this one.
         *
         * @param other category name
         * @return true for the same category or a listed related one
         */
        public boolean isRelatedTo(String other) {
            if (name.equalsIgnoreCase(other)) {
                return true;
            }
            return related.stream().anyMatch(r -> r.equalsIgnoreCase(other));
        }
    }

    /**
     * Inclusive word-count bounds.
     *
     * @param min minimum number of words
     * @param max maximum number of words
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record WordCountRange(
        @JsonProperty("min") int min,
        @JsonProperty("max") int max
    ) {
        public boolean isValid() {
            return min >= 1 && max >= min;
        }

        @Override
        public String toString() {
            return min + "-" + max;
        }
    }

    /**
     * Acronym table entry. A null full name registers the acronym for casing only.
     *
     * @param acronym acronym as it should be written (e.g. "RTP")
     * @param fullName expanded form (e.g. "Real-Time Payments"), optional
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record AcronymEntry(
        @JsonProperty("acronym") String acronym,
        @JsonProperty("fullName") String fullName
    ) {}

    /**
     * Ranking weights.
     *
     * @param breadthWeight weight per distinct source document
     * @param overQuotaPenalty penalty for clusters admitted over quota
     * @param howToBonus bonus for "how to" style phrases
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ScoringSettings(
        @JsonProperty("breadthWeight") Double breadthWeight,
        @JsonProperty("overQuotaPenalty") Double overQuotaPenalty,
        @JsonProperty("howToBonus") Double howToBonus
    ) {
        public ScoringSettings {
            if (breadthWeight == null) {
                breadthWeight = 1.0;
            }
            if (overQuotaPenalty == null) {
                overQuotaPenalty = 2.0;
            }
            if (howToBonus == null) {
                howToBonus = 0.5;
            }
        }

        public static ScoringSettings defaults() {
            return new ScoringSettings(1.0, 2.0, 0.5);
        }
    }

    /**
     * Similarity merge settings.
     *
     * @param restrictContainmentToRelatedCategories only fold contained phrases into clusters of
     *        the same or a related category (default true)
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record MergeSettings(
        @JsonProperty("restrictContainmentToRelatedCategories") Boolean restrictContainmentToRelatedCategories
    ) {
        public MergeSettings {
            if (restrictContainmentToRelatedCategories == null) {
                restrictContainmentToRelatedCategories = true;
            }
        }

        public static MergeSettings defaults() {
            return new MergeSettings(true);
        }
    }

    /**
     * Extraction call settings.
     *
     * @param extractor id of the extractor to use
     * @param workers maximum concurrent extraction calls
     * @param maxAttempts attempts per document before degrading to an empty result
     * @param initialBackoffMillis delay before the first retry
     * @param maxBackoffMillis upper bound for the retry delay
     * @param keyphraseField JSON field holding precomputed candidates (embedded extractor)
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ExtractionSettings(
        @JsonProperty("extractor") String extractor,
        @JsonProperty("workers") Integer workers,
        @JsonProperty("maxAttempts") Integer maxAttempts,
        @JsonProperty("initialBackoffMillis") Long initialBackoffMillis,
        @JsonProperty("maxBackoffMillis") Long maxBackoffMillis,
        @JsonProperty("keyphraseField") String keyphraseField
    ) {
        public ExtractionSettings {
            if (extractor == null || extractor.isBlank()) {
                extractor = "embedded";
            }
            if (workers == null) {
                workers = 4;
            }
            if (maxAttempts == null) {
                maxAttempts = 3;
            }
            if (initialBackoffMillis == null) {
                initialBackoffMillis = 200L;
            }
            if (maxBackoffMillis == null) {
                maxBackoffMillis = 2000L;
            }
            if (keyphraseField == null || keyphraseField.isBlank()) {
                keyphraseField = "keyphrases";
            }
        }

        public static ExtractionSettings defaults() {
            return new ExtractionSettings("embedded", 4, 3, 200L, 2000L, "keyphrases");
        }
    }
}
