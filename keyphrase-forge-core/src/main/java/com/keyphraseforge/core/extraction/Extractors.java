package com.keyphraseforge.core.extraction;

import com.keyphraseforge.core.config.ConfigurationException;

import java.util.ArrayList;
import java.util.List;
import java.util.ServiceLoader;

/**
 * Looks up {@link KeyphraseExtractor} implementations registered through {@link ServiceLoader}.
 */
public final class Extractors {

    private Extractors() {
        // Utility class
    }

    /**
     * Returns every registered extractor, in registration order.
     *
     * @return extractors
     */
    public static List<KeyphraseExtractor> available() {
        List<KeyphraseExtractor> extractors = new ArrayList<>();
        ServiceLoader.load(KeyphraseExtractor.class).forEach(extractors::add);
        return extractors;
    }

    /**
     * Returns the extractor with the given id.
     *
     * @param id extractor id (case-insensitive)
     * @return a new extractor instance
     * @throws ConfigurationException if no extractor has this id
     */
    public static KeyphraseExtractor byId(String id) {
        return available().stream()
            .filter(e -> e.getId().equalsIgnoreCase(id))
            .findFirst()
            .orElseThrow(() -> new ConfigurationException("Unknown extractor: " + id + ". Available: "
                + available().stream().map(KeyphraseExtractor::getId).toList()));
    }
}
