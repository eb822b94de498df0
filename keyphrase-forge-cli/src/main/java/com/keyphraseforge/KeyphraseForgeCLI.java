package com.keyphraseforge;

import com.keyphraseforge.cli.ListCommand;
import com.keyphraseforge.cli.RunCommand;
import com.keyphraseforge.cli.ValidateCommand;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ch.qos.logback.classic.Level;

/**
 * Main CLI entry point for KeyphraseForge.
 *
 * <p>KeyphraseForge builds a deduplicated, ranked keyphrase list for an autocomplete index
 * from a corpus of API documentation pages.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code run} - Extract, deduplicate and rank keyphrases for a corpus</li>
 *   <li>{@code validate} - Validate a configuration file</li>
 *   <li>{@code list} - List available extractors, generators, renderers or categories</li>
 * </ul>
 *
 * <p><b>Global Options:</b>
 * <ul>
 *   <li>{@code -v, --verbose} - Enable verbose output</li>
 *   <li>{@code -q, --quiet} - Suppress all output except errors</li>
 *   <li>{@code --help} - Show help information</li>
 *   <li>{@code --version} - Show version information</li>
 * </ul>
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * # Build the keyphrase list for a documentation export
 * keyphrase-forge run ./docs-export
 *
 * # Use the offline heading extractor and write only JSON
 * keyphrase-forge run ./docs-export --extractor headings --format json
 *
 * # List available extractors
 * keyphrase-forge list extractors
 * }</pre>
 */
@Command(
    name = "keyphrase-forge",
    mixinStandardHelpOptions = true,
    version = "KeyphraseForge 1.0.0-SNAPSHOT",
    description = "Aggregates, deduplicates and ranks autocomplete keyphrases from API documentation",
    subcommands = {
        RunCommand.class,
        ValidateCommand.class,
        ListCommand.class
    }
)
public class KeyphraseForgeCLI implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(KeyphraseForgeCLI.class);

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)")
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Suppress all output except errors")
    private boolean quiet;

    @Override
    public void run() {
        if (quiet) {
            return;
        }

        System.out.println("KeyphraseForge - Autocomplete Keyphrase Aggregator");
        System.out.println("Version: 1.0.0-SNAPSHOT");
        System.out.println();
        System.out.println("Use 'keyphrase-forge --help' to see available commands");
        System.out.println("Use 'keyphrase-forge <command> --help' for command-specific help");
    }

    /**
     * Configures logging level based on global options.
     */
    void configureLogging() {
        ch.qos.logback.classic.Logger root =
            (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);

        if (quiet) {
            root.setLevel(Level.ERROR);
        } else if (verbose) {
            root.setLevel(Level.DEBUG);
        } else {
            root.setLevel(Level.INFO);
        }
        log.debug("Log level set to {}", root.getLevel());
    }

    /**
     * Builds the command line with logging configured before any subcommand runs.
     *
     * @return command line ready to execute
     */
    public static CommandLine createCommandLine() {
        KeyphraseForgeCLI cli = new KeyphraseForgeCLI();
        CommandLine commandLine = new CommandLine(cli);
        commandLine.setExecutionStrategy(parseResult -> {
            cli.configureLogging();
            return new CommandLine.RunLast().execute(parseResult);
        });
        return commandLine;
    }

    /**
     * Main entry point.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        int exitCode = createCommandLine().execute(args);
        System.exit(exitCode);
    }
}
