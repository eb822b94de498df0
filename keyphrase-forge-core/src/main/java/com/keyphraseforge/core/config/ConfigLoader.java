package com.keyphraseforge.core.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Utility for loading pipeline configuration from YAML files.
 *
 * <p>Uses Jackson to deserialize {@code keyphrase-forge.yaml} into {@link PipelineConfig}
 * records. Unlike a missing file, a file that exists but cannot be parsed or fails
 * validation is fatal: the run must not start on a half-understood quota table.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * PipelineConfig config = ConfigLoader.loadOrDefaults(Paths.get("keyphrase-forge.yaml"));
 * int target = config.globalTarget();
 * }</pre>
 */
public final class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private ConfigLoader() {
        // Utility class
    }

    /**
     * Loads and validates configuration from a YAML file.
     *
     * @param configPath path to {@code keyphrase-forge.yaml}
     * @return validated configuration
     * @throws ConfigurationException if the file is missing, unreadable, malformed or invalid
     */
    public static PipelineConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            throw new ConfigurationException("Configuration file not found: " + configPath);
        }
        return read(configPath);
    }

    /**
     * Loads configuration from a YAML file, or returns validated defaults if the file does not exist.
     *
     * @param configPath path to {@code keyphrase-forge.yaml}
     * @return validated configuration
     * @throws ConfigurationException if the file exists but is unreadable, malformed or invalid
     */
    public static PipelineConfig loadOrDefaults(Path configPath) {
        if (!Files.exists(configPath)) {
            log.warn("Configuration file not found: {}. Using defaults.", configPath);
            return PipelineConfig.defaults().validate();
        }
        return read(configPath);
    }

    private static PipelineConfig read(Path configPath) {
        if (!Files.isRegularFile(configPath) || !Files.isReadable(configPath)) {
            throw new ConfigurationException("Configuration file is not readable: " + configPath);
        }

        PipelineConfig config;
        try {
            log.debug("Loading configuration from: {}", configPath);
            config = YAML_MAPPER.readValue(configPath.toFile(), PipelineConfig.class);
        } catch (IOException e) {
            throw new ConfigurationException(
                "Failed to parse configuration file " + configPath + ": " + e.getMessage(), e);
        }

        if (config == null) {
            throw new ConfigurationException("Configuration file is empty: " + configPath);
        }

        config.validate();
        log.info("Loaded configuration from: {} ({} categories, global target {})",
            configPath, config.categories().size(), config.globalTarget());
        return config;
    }
}
