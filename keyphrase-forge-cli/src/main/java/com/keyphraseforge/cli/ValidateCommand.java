package com.keyphraseforge.cli;

import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.keyphraseforge.core.config.ConfigLoader;
import com.keyphraseforge.core.config.ConfigurationException;
import com.keyphraseforge.core.config.PipelineConfig;
import com.keyphraseforge.core.config.PipelineConfig.CategoryConfig;

import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Command to validate a configuration file.
 */
@Command(
    name = "validate",
    description = "Validate a configuration file",
    mixinStandardHelpOptions = true
)
public class ValidateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ValidateCommand.class);

    @Parameters(index = "0", description = "Config file to validate", defaultValue = "keyphrase-forge.yaml")
    private Path configFile;

    @Override
    public Integer call() {
        log.info("Validating configuration: {}", configFile);
        try {
            PipelineConfig config = ConfigLoader.load(configFile);

            System.out.println("✓ Configuration is valid: " + configFile);
            System.out.println("  Global target: " + config.globalTarget());
            System.out.println("  Extractor: " + config.extraction().extractor());
            System.out.println("  Categories:");
            for (CategoryConfig category : config.categories()) {
                System.out.printf("    • %s: soft target %d (+%d), weight %.1f, %s words%n",
                    category.name(),
                    category.softTarget(),
                    category.overflowMargin(),
                    category.priorityWeight(),
                    config.wordCountRangeFor(category.name()));
            }
            int softTotal = config.categories().stream().mapToInt(CategoryConfig::softTarget).sum();
            if (softTotal != config.globalTarget()) {
                System.out.println("⚠ Soft targets sum to " + softTotal
                    + ", global target is " + config.globalTarget());
            }
            return 0;
        } catch (ConfigurationException e) {
            log.error("Invalid configuration: {}", e.getMessage());
            System.err.println("✗ " + e.getMessage());
            return 1;
        }
    }
}
