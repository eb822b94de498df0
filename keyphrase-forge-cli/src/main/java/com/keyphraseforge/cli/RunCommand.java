package com.keyphraseforge.cli;

import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.keyphraseforge.core.config.ConfigLoader;
import com.keyphraseforge.core.config.PipelineConfig;
import com.keyphraseforge.core.config.PipelineConfig.ExtractionSettings;
import com.keyphraseforge.core.corpus.CorpusLoader;
import com.keyphraseforge.core.extraction.Extractors;
import com.keyphraseforge.core.extraction.KeyphraseExtractor;
import com.keyphraseforge.core.model.Document;
import com.keyphraseforge.core.model.RankedKeyphrase;
import com.keyphraseforge.core.model.RunStatistics;
import com.keyphraseforge.core.model.RunSummary;
import com.keyphraseforge.core.pipeline.PipelineOrchestrator;
import com.keyphraseforge.core.pipeline.PipelineResult;
import com.keyphraseforge.core.report.RenderContext;
import com.keyphraseforge.core.report.ReportBundle;
import com.keyphraseforge.core.report.ReportFile;
import com.keyphraseforge.core.report.ReportGenerator;
import com.keyphraseforge.core.report.ReportInput;
import com.keyphraseforge.core.report.Reports;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.Callable;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Command to build the keyphrase list for a documentation corpus.
 *
 * <p>Runs the full pipeline:
 * <ol>
 *   <li>Load configuration (defaults when no file exists)</li>
 *   <li>Load the corpus and assign categories</li>
 *   <li>Extract, deduplicate and rank keyphrases</li>
 *   <li>Generate reports in the requested formats</li>
 *   <li>Render the reports to the output directory</li>
 * </ol>
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * # Run over a corpus, writing keyphrases.json and keyphrases.md into it
 * keyphrase-forge run ./docs-export
 *
 * # Custom configuration, output directory and target size
 * keyphrase-forge run ./docs-export -c forge.yaml -o ./out --target 200
 *
 * # Dry run (no report files written)
 * keyphrase-forge run ./docs-export --dry-run
 * }</pre>
 */
@Command(
    name = "run",
    description = "Extract, deduplicate and rank keyphrases for a documentation corpus",
    mixinStandardHelpOptions = true
)
public class RunCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(RunCommand.class);
    private static final String DEFAULT_CONFIG = "keyphrase-forge.yaml";
    private static final int SAMPLE_SIZE = 10;

    @Parameters(
        index = "0",
        description = "Corpus directory of JSON documentation pages (default: current directory)",
        defaultValue = "."
    )
    private Path inputDir;

    @Option(
        names = {"-c", "--config"},
        description = "Configuration file (default: keyphrase-forge.yaml in the corpus directory)"
    )
    private Path configPath;

    @Option(
        names = {"-o", "--output"},
        description = "Output directory for reports (default: corpus directory)"
    )
    private Path outputDir;

    @Option(
        names = {"--extractor"},
        description = "Extractor id (overrides config)"
    )
    private String extractorId;

    @Option(
        names = {"-t", "--target"},
        description = "Global target size (overrides config)"
    )
    private Integer target;

    @Option(
        names = {"-f", "--format"},
        split = ",",
        defaultValue = "json,markdown",
        description = "Report formats (default: ${DEFAULT-VALUE})"
    )
    private List<String> formats;

    @Option(
        names = {"--timeout"},
        description = "Cancel extraction after this many seconds and rank what was ingested"
    )
    private Long timeoutSeconds;

    @Option(
        names = {"--dry-run"},
        description = "Run the pipeline but don't write reports"
    )
    private boolean dryRun;

    @Override
    public Integer call() {
        try {
            log.info("Starting run over: {}", inputDir.toAbsolutePath());
            System.out.println("Processing corpus: " + inputDir.toAbsolutePath());
            System.out.println();

            PipelineConfig config = loadConfiguration();
            KeyphraseExtractor extractor = Extractors.byId(config.extraction().extractor());
            List<ReportGenerator> generators = resolveGenerators();
            System.out.println("✓ Loaded configuration (" + config.categories().size()
                + " categories, target " + config.globalTarget() + ")");

            List<Document> documents = new CorpusLoader(config).load(inputDir, reportPath("json"));
            System.out.println("✓ Loaded " + documents.size() + " documents");
            CorpusLoader.countByCategory(documents).forEach((category, count) ->
                System.out.println("  → " + category + ": " + count));

            PipelineResult result = runPipeline(config, extractor, documents);
            printSummary(result);

            if (dryRun) {
                System.out.println();
                System.out.println("Dry-run mode: Skipping report generation");
                return 0;
            }

            ReportInput input = new ReportInput(inputDir.toAbsolutePath().toString(),
                extractor.getId(), config, result);
            List<ReportFile> files = new ArrayList<>();
            for (ReportGenerator generator : generators) {
                files.add(generator.generate(input));
            }
            Reports.renderer("filesystem").render(new ReportBundle(files),
                new RenderContext(getOutputDirectory().toString()));
            System.out.println("✓ Wrote " + files.size() + " report(s) to: " + getOutputDirectory());

            System.out.println();
            System.out.println("✓ Run complete");
            return 0;

        } catch (Exception e) {
            log.error("Run failed", e);
            System.err.println("✗ Run failed: " + e.getMessage());
            return 1;
        }
    }

    private PipelineConfig loadConfiguration() {
        PipelineConfig config = configPath != null
            ? ConfigLoader.load(configPath)
            : ConfigLoader.loadOrDefaults(inputDir.resolve(DEFAULT_CONFIG));

        if (target != null) {
            config = config.withGlobalTarget(target);
        }
        if (extractorId != null) {
            ExtractionSettings current = config.extraction();
            config = config.withExtraction(new ExtractionSettings(extractorId, current.workers(),
                current.maxAttempts(), current.initialBackoffMillis(), current.maxBackoffMillis(),
                current.keyphraseField()));
        }
        return config.validate();
    }

    private List<ReportGenerator> resolveGenerators() {
        List<ReportGenerator> generators = new ArrayList<>();
        for (String format : formats) {
            generators.add(Reports.generator(format.toLowerCase(Locale.ROOT)));
        }
        return generators;
    }

    private PipelineResult runPipeline(PipelineConfig config, KeyphraseExtractor extractor, List<Document> documents) {
        PipelineOrchestrator orchestrator = new PipelineOrchestrator(config, extractor);
        System.out.println("  → Extracting with " + extractor.getDisplayName());

        if (timeoutSeconds == null) {
            return orchestrator.run(documents);
        }

        ScheduledExecutorService timer = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, "run-timeout");
            thread.setDaemon(true);
            return thread;
        });
        try {
            timer.schedule(orchestrator::cancel, timeoutSeconds, TimeUnit.SECONDS);
            return orchestrator.run(documents);
        } finally {
            timer.shutdownNow();
        }
    }

    private void printSummary(PipelineResult result) {
        RunSummary summary = result.summary();
        RunStatistics stats = result.statistics();

        System.out.println("✓ Extracted " + stats.candidatesExtracted() + " candidates into "
            + stats.clustersFormed() + " clusters");
        if (stats.documentsDegraded() > 0) {
            System.out.println("⚠ " + stats.documentsDegraded() + " document(s) degraded after failed extraction");
        }
        if (stats.cancelled()) {
            System.out.println("⚠ Run cancelled: " + stats.documentsSkipped() + " document(s) skipped");
        }
        System.out.println("✓ Ranked " + summary.admittedCount() + " keyphrases (target "
            + summary.globalTarget() + ")");
        if (summary.shortfall() > 0) {
            System.out.println("  → " + summary.shortfall() + " short of target");
        }
        summary.categories().forEach((category, count) ->
            System.out.println("  → " + category + ": " + count));

        List<RankedKeyphrase> keyphrases = result.keyphrases();
        if (!keyphrases.isEmpty()) {
            System.out.println();
            System.out.println("Top keyphrases:");
            keyphrases.stream().limit(SAMPLE_SIZE).forEach(k ->
                System.out.printf(Locale.ROOT, "  %6.2f  %s (%s)%n", k.score(), k.text(), k.category()));
        }
    }

    private Path getOutputDirectory() {
        return outputDir != null ? outputDir : inputDir;
    }

    private Path reportPath(String extension) {
        return getOutputDirectory().resolve(ReportGenerator.REPORT_BASENAME + "." + extension);
    }
}
