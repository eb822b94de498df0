package com.keyphraseforge.core.report;

import com.keyphraseforge.core.config.ConfigurationException;

import java.util.ArrayList;
import java.util.List;
import java.util.ServiceLoader;

/**
 * Looks up report generators and renderers registered through {@link ServiceLoader}.
 */
public final class Reports {

    private Reports() {
        // Utility class
    }

    public static List<ReportGenerator> generators() {
        List<ReportGenerator> generators = new ArrayList<>();
        ServiceLoader.load(ReportGenerator.class).forEach(generators::add);
        return generators;
    }

    public static List<ReportRenderer> renderers() {
        List<ReportRenderer> renderers = new ArrayList<>();
        ServiceLoader.load(ReportRenderer.class).forEach(renderers::add);
        return renderers;
    }

    /**
     * Returns the generator with the given id.
     *
     * @param id generator id (case-insensitive)
     * @return generator
     * @throws ConfigurationException if no generator has this id
     */
    public static ReportGenerator generator(String id) {
        return generators().stream()
            .filter(g -> g.getId().equalsIgnoreCase(id.trim()))
            .findFirst()
            .orElseThrow(() -> new ConfigurationException("Unknown report format: " + id));
    }

    /**
     * Returns the renderer with the given id.
     *
     * @param id renderer id (case-insensitive)
     * @return renderer
     * @throws ConfigurationException if no renderer has this id
     */
    public static ReportRenderer renderer(String id) {
        return renderers().stream()
            .filter(r -> r.getId().equalsIgnoreCase(id.trim()))
            .findFirst()
            .orElseThrow(() -> new ConfigurationException("Unknown renderer: " + id));
    }
}
