package com.keyphraseforge.core.pipeline;

import com.keyphraseforge.core.aggregate.Aggregator;
import com.keyphraseforge.core.aggregate.IngestResult;
import com.keyphraseforge.core.config.ConfigurationException;
import com.keyphraseforge.core.config.PipelineConfig;
import com.keyphraseforge.core.config.PipelineConfig.CategoryConfig;
import com.keyphraseforge.core.extraction.ExtractionOutcome;
import com.keyphraseforge.core.extraction.KeyphraseExtractor;
import com.keyphraseforge.core.extraction.RetryingExtraction;
import com.keyphraseforge.core.merge.KeyphraseCluster;
import com.keyphraseforge.core.model.AuditEntry;
import com.keyphraseforge.core.model.Document;
import com.keyphraseforge.core.model.DocumentReport;
import com.keyphraseforge.core.model.RankedKeyphrase;
import com.keyphraseforge.core.model.RunStatistics;
import com.keyphraseforge.core.model.RunSummary;
import com.keyphraseforge.core.rank.Ranker;
import com.keyphraseforge.core.rank.RankingResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs the whole pipeline for one corpus.
 *
 * <p><b>Run phases:</b>
 * <ol>
 *   <li>Validate the configuration and every document's category; any problem fails the run
 *       before the first extraction call.</li>
 *   <li>Order documents: the common category first, then all others, each in arrival order.</li>
 *   <li>Issue extraction calls concurrently on a bounded pool, retrying failed calls.</li>
 *   <li>Replay the outcomes into a single {@link Aggregator} strictly in document order.</li>
 *   <li>Rank and truncate the final clusters.</li>
 * </ol>
 *
 * <p>{@link #cancel()} stops new extraction calls; documents not yet started are skipped and
 * the run still completes with whatever was ingested. An orchestrator runs one corpus at a
 * time; runs share no state.
 */
public class PipelineOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(PipelineOrchestrator.class);

    private final PipelineConfig config;
    private final KeyphraseExtractor extractor;
    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    /**
     * @param config pipeline configuration (validated at the start of every run)
     * @param extractor extraction collaborator
     */
    public PipelineOrchestrator(PipelineConfig config, KeyphraseExtractor extractor) {
        this.config = config;
        this.extractor = extractor;
    }

    /**
     * Runs the pipeline.
     *
     * @param documents documents in arrival order
     * @return the run result, possibly empty
     * @throws ConfigurationException if the configuration or a document category is invalid
     */
    public PipelineResult run(List<Document> documents) {
        config.validate();
        List<Document> ordered = order(resolveCategories(documents));
        extractor.configure(config);

        log.info("Starting run over {} documents with extractor '{}' ({} workers)",
            ordered.size(), extractor.getId(), config.extraction().workers());

        List<ExtractionOutcome> outcomes = extractAll(ordered);

        Aggregator aggregator = new Aggregator(config);
        RunStatistics.Builder stats = new RunStatistics.Builder().documentsTotal(ordered.size());
        List<DocumentReport> reports = new ArrayList<>(ordered.size());

        for (int i = 0; i < ordered.size(); i++) {
            Document document = ordered.get(i);
            ExtractionOutcome outcome = outcomes.get(i);
            IngestResult ingested = IngestResult.empty();

            switch (outcome.status()) {
                case SUCCESS -> {
                    ingested = aggregator.ingest(document, outcome.phrases());
                    stats.addCandidates(document.category(), ingested.candidates());
                    stats.addRejected(ingested.dropped());
                }
                case DEGRADED -> {
                    aggregator.recordExtractionFailure(document, outcome.reason());
                    stats.incrementDocumentsDegraded();
                }
                case SKIPPED -> stats.incrementDocumentsSkipped();
            }

            reports.add(new DocumentReport(document.id(), document.category(), outcome.status(),
                outcome.attempts(), ingested.candidates(), ingested.created(), ingested.merged(),
                ingested.dropped()));
        }

        List<KeyphraseCluster> clusters = aggregator.snapshot();
        RankingResult ranking = new Ranker(config).finalizeRanking(clusters, config.globalTarget());

        List<AuditEntry> audit = new ArrayList<>(aggregator.auditLog().entries());
        audit.addAll(ranking.truncated());

        RunSummary summary = summarize(ranking.keyphrases());
        RunStatistics statistics = stats
            .clustersFormed(clusters.size())
            .cancelled(cancelled.get())
            .build();

        log.info("Run complete: {} keyphrases for a target of {} ({} clusters, {} audit entries)",
            summary.admittedCount(), summary.globalTarget(), clusters.size(), audit.size());
        if (statistics.documentsDegraded() > 0) {
            log.warn("{} document(s) degraded after failed extraction", statistics.documentsDegraded());
        }

        return new PipelineResult(ranking.keyphrases(), audit, summary, statistics, reports);
    }

    /**
     * Requests cancellation: no new extraction calls are issued.
     */
    public void cancel() {
        if (cancelled.compareAndSet(false, true)) {
            log.info("Run cancellation requested");
        }
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    private List<ExtractionOutcome> extractAll(List<Document> documents) {
        RetryingExtraction extraction = new RetryingExtraction(extractor, config.extraction(), cancelled::get);
        List<Future<ExtractionOutcome>> futures = new ArrayList<>(documents.size());
        List<ExtractionOutcome> outcomes = new ArrayList<>(documents.size());

        try (ExtractionExecutor executor = new ExtractionExecutor(config.extraction().workers())) {
            for (Document document : documents) {
                futures.add(executor.submit(() -> extraction.extract(document)));
            }
            for (int i = 0; i < documents.size(); i++) {
                outcomes.add(await(futures.get(i), documents.get(i)));
            }
        }
        return outcomes;
    }

    private ExtractionOutcome await(Future<ExtractionOutcome> future, Document document) {
        try {
            return future.get();
        } catch (CancellationException e) {
            return ExtractionOutcome.skipped(document.id(), "run cancelled");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancel();
            future.cancel(true);
            return ExtractionOutcome.skipped(document.id(), "interrupted");
        } catch (ExecutionException e) {
            log.warn("Extraction task for {} failed: {}", document.id(), e.getCause().getMessage());
            return ExtractionOutcome.degraded(document.id(), String.valueOf(e.getCause().getMessage()), 1);
        }
    }

    private List<Document> resolveCategories(List<Document> documents) {
        List<String> problems = new ArrayList<>();
        Set<String> ids = new HashSet<>();
        List<Document> resolved = new ArrayList<>(documents.size());

        for (Document document : documents) {
            if (!ids.add(document.id())) {
                problems.add("duplicate document id " + document.id());
            }
            Optional<CategoryConfig> category = config.findCategory(document.category());
            if (category.isEmpty()) {
                problems.add("document " + document.id() + " has unknown category '" + document.category() + "'");
                continue;
            }
            resolved.add(new Document(document.id(), category.get().name(), document.rawContent()));
        }

        if (!problems.isEmpty()) {
            throw new ConfigurationException("Invalid corpus: " + String.join("; ", problems));
        }
        return resolved;
    }

    private List<Document> order(List<Document> documents) {
        List<Document> ordered = new ArrayList<>(documents.size());
        documents.stream().filter(d -> config.isCommon(d.category())).forEach(ordered::add);
        documents.stream().filter(d -> !config.isCommon(d.category())).forEach(ordered::add);
        return ordered;
    }

    private RunSummary summarize(List<RankedKeyphrase> keyphrases) {
        Map<String, Integer> byCategory = new LinkedHashMap<>();
        for (String name : config.categoryNames()) {
            byCategory.put(name, 0);
        }
        for (RankedKeyphrase keyphrase : keyphrases) {
            byCategory.merge(keyphrase.category(), 1, Integer::sum);
        }
        return new RunSummary(keyphrases.size(), config.globalTarget(), byCategory);
    }
}
