package com.keyphraseforge.cli;

import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.keyphraseforge.core.config.ConfigLoader;
import com.keyphraseforge.core.config.PipelineConfig;
import com.keyphraseforge.core.config.PipelineConfig.CategoryConfig;
import com.keyphraseforge.core.extraction.Extractors;
import com.keyphraseforge.core.extraction.KeyphraseExtractor;
import com.keyphraseforge.core.report.ReportGenerator;
import com.keyphraseforge.core.report.ReportRenderer;
import com.keyphraseforge.core.report.Reports;

import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.Callable;

/**
 * Command to list available extractors, generators, renderers or configured categories.
 *
 * <p>Extractors, generators and renderers are discovered via Java Service Provider
 * Interface (SPI).
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * keyphrase-forge list extractors
 * keyphrase-forge list generators
 * keyphrase-forge list renderers
 * keyphrase-forge list categories -c keyphrase-forge.yaml
 * }</pre>
 */
@Command(
    name = "list",
    description = "List available extractors, generators, renderers or categories",
    mixinStandardHelpOptions = true
)
public class ListCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ListCommand.class);

    @Parameters(
        index = "0",
        description = "Type to list: extractors, generators, renderers or categories"
    )
    private String type;

    @Option(
        names = {"-c", "--config"},
        description = "Configuration file for 'categories' (default: built-in defaults)"
    )
    private Path configPath;

    @Override
    public Integer call() {
        return switch (type.toLowerCase(Locale.ROOT)) {
            case "extractors", "extractor" -> listExtractors();
            case "generators", "generator" -> listGenerators();
            case "renderers", "renderer" -> listRenderers();
            case "categories", "category" -> listCategories();
            default -> {
                log.error("Unknown type: {}. Use: extractors, generators, renderers or categories", type);
                yield 1;
            }
        };
    }

    private int listExtractors() {
        System.out.println("Available Extractors:");
        System.out.println();

        List<KeyphraseExtractor> extractors = Extractors.available();
        for (KeyphraseExtractor extractor : extractors) {
            System.out.printf("  • %s (ID: %s)%n", extractor.getDisplayName(), extractor.getId());
        }
        if (extractors.isEmpty()) {
            System.out.println("  No extractors found.");
        }
        return 0;
    }

    private int listGenerators() {
        System.out.println("Available Generators:");
        System.out.println();

        List<ReportGenerator> generators = Reports.generators();
        for (ReportGenerator generator : generators) {
            System.out.printf("  • %s (ID: %s)%n", generator.getDisplayName(), generator.getId());
            System.out.printf("    File: %s%n", generator.fileName());
        }
        if (generators.isEmpty()) {
            System.out.println("  No generators found.");
        }
        return 0;
    }

    private int listRenderers() {
        System.out.println("Available Renderers:");
        System.out.println();

        List<ReportRenderer> renderers = Reports.renderers();
        for (ReportRenderer renderer : renderers) {
            System.out.printf("  • %s%n", renderer.getId());
        }
        if (renderers.isEmpty()) {
            System.out.println("  No renderers found.");
        }
        return 0;
    }

    private int listCategories() {
        PipelineConfig config;
        try {
            config = configPath != null ? ConfigLoader.load(configPath) : PipelineConfig.defaults();
        } catch (RuntimeException e) {
            log.error("Could not load configuration: {}", e.getMessage());
            return 1;
        }

        System.out.println("Configured Categories:");
        System.out.println();
        for (CategoryConfig category : config.categories()) {
            String marker = config.isCommon(category.name()) ? " [common]" : "";
            System.out.printf("  • %s%s%n", category.name(), marker);
            System.out.printf("    Folders: %s%n", category.folders());
            if (!category.markers().isEmpty()) {
                System.out.printf("    Markers: %s%n", category.markers());
            }
        }
        return 0;
    }
}
