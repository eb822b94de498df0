package com.keyphraseforge;

import ch.qos.logback.classic.Level;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link KeyphraseForgeCLI}.
 */
class KeyphraseForgeCLITest {

    private final ch.qos.logback.classic.Logger root =
        (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);

    @AfterEach
    void resetLogging() {
        root.setLevel(Level.INFO);
    }

    @Test
    void execute_quietFlag_appliesToSubcommand() {
        int exitCode = KeyphraseForgeCLI.createCommandLine().execute("-q", "list", "extractors");

        assertThat(exitCode).isZero();
        assertThat(root.getLevel()).isEqualTo(Level.ERROR);
    }

    @Test
    void execute_verboseFlag_enablesDebugLogging() {
        int exitCode = KeyphraseForgeCLI.createCommandLine().execute("-v", "list", "renderers");

        assertThat(exitCode).isZero();
        assertThat(root.getLevel()).isEqualTo(Level.DEBUG);
    }

    @Test
    void execute_noSubcommand_printsBanner() {
        CommandLine commandLine = KeyphraseForgeCLI.createCommandLine();

        assertThat(commandLine.execute()).isZero();
        assertThat(commandLine.getSubcommands()).containsOnlyKeys("run", "validate", "list");
    }

    @Test
    void execute_unknownSubcommand_isUsageError() {
        assertThat(KeyphraseForgeCLI.createCommandLine().execute("scan")).isEqualTo(2);
    }
}
