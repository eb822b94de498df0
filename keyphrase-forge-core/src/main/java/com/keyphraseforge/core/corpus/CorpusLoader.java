package com.keyphraseforge.core.corpus;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.keyphraseforge.core.config.ConfigurationException;
import com.keyphraseforge.core.config.PipelineConfig;
import com.keyphraseforge.core.config.PipelineConfig.CategoryConfig;
import com.keyphraseforge.core.model.Document;
import com.keyphraseforge.core.util.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Loads a directory of JSON documentation pages as a corpus.
 *
 * <p>Every {@code *.json} file below the input directory becomes a {@link Document} whose id
 * is its relative path. The category is chosen from configuration:
 * <ol>
 *   <li>a directory in the relative path equal to one of a category's {@code folders}
 *       (case-insensitive; categories checked in configuration order)</li>
 *   <li>a top-level JSON key equal to one of a category's {@code markers}</li>
 *   <li>otherwise the configured default category</li>
 * </ol>
 *
 * <p>Documents are returned sorted by relative path.
 */
public class CorpusLoader {

    private static final Logger log = LoggerFactory.getLogger(CorpusLoader.class);
    private static final String JSON_GLOB = "{*.json,**/*.json}";

    private final PipelineConfig config;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public CorpusLoader(PipelineConfig config) {
        this.config = config;
    }

    /**
     * Loads every JSON page below a directory.
     *
     * @param inputDir corpus root
     * @return documents sorted by relative path
     * @throws IOException if the directory cannot be walked or a file cannot be read
     */
    public List<Document> load(Path inputDir) throws IOException {
        return load(inputDir, null);
    }

    /**
     * Loads every JSON page below a directory, skipping a report file written there.
     *
     * @param inputDir corpus root
     * @param excludedFile file to skip (typically the JSON report of a previous run), may be null
     * @return documents sorted by relative path
     * @throws IOException if the directory cannot be walked or a file cannot be read
     * @throws ConfigurationException if the input directory does not exist
     */
    public List<Document> load(Path inputDir, Path excludedFile) throws IOException {
        if (!Files.isDirectory(inputDir)) {
            throw new ConfigurationException("Input directory does not exist: " + inputDir);
        }

        List<Document> documents = new ArrayList<>();
        for (Path file : FileUtils.findFiles(inputDir, JSON_GLOB)) {
            if (FileUtils.isSameFile(file, excludedFile)) {
                log.debug("Skipping report file {}", file);
                continue;
            }
            String id = FileUtils.relativePath(inputDir, file);
            String content = Files.readString(file, StandardCharsets.UTF_8);
            documents.add(new Document(id, classify(id, content), content));
        }

        log.info("Loaded {} documents from {}", documents.size(), inputDir);
        if (log.isDebugEnabled()) {
            countByCategory(documents).forEach((category, count) ->
                log.debug("  {}: {} documents", category, count));
        }
        return documents;
    }

    /**
     * Chooses the category of a page.
     *
     * @param relativePath page path relative to the corpus root, with forward slashes
     * @param content page content
     * @return configured category name
     */
    public String classify(String relativePath, String content) {
        String[] segments = relativePath.split("/");
        for (CategoryConfig category : config.categories()) {
            for (int i = 0; i < segments.length - 1; i++) {
                String segment = segments[i];
                if (category.folders().stream().anyMatch(f -> f.equalsIgnoreCase(segment))) {
                    return category.name();
                }
            }
        }

        JsonNode root = parse(relativePath, content);
        if (root != null && root.isObject()) {
            for (CategoryConfig category : config.categories()) {
                if (category.markers().stream().anyMatch(root::has)) {
                    return category.name();
                }
            }
        }

        return config.defaultCategory() != null ? config.defaultCategory() : config.categoryNames().get(0);
    }

    /**
     * Counts documents per category, in order of first appearance.
     *
     * @param documents documents
     * @return counts by category
     */
    public static Map<String, Integer> countByCategory(List<Document> documents) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (Document document : documents) {
            counts.merge(document.category(), 1, Integer::sum);
        }
        return counts;
    }

    private JsonNode parse(String relativePath, String content) {
        try {
            return objectMapper.readTree(content);
        } catch (IOException e) {
            log.warn("Could not parse {} as JSON, using folder rules only: {}", relativePath, e.getMessage());
            return null;
        }
    }
}
