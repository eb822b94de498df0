package com.keyphraseforge.core.extraction;

import com.keyphraseforge.core.config.PipelineConfig.ExtractionSettings;
import com.keyphraseforge.core.model.CandidatePhrase;
import com.keyphraseforge.core.model.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.function.BooleanSupplier;

/**
 * Calls an extractor with bounded retries and exponential backoff.
 *
 * <p>The delay starts at {@code initialBackoffMillis} and doubles after every failed attempt,
 * capped at {@code maxBackoffMillis}. After {@code maxAttempts} failures the document is
 * degraded to an empty result. Retrying stops early once the run is cancelled.
 */
public class RetryingExtraction {

    private static final Logger log = LoggerFactory.getLogger(RetryingExtraction.class);

    private final KeyphraseExtractor extractor;
    private final ExtractionSettings settings;
    private final BooleanSupplier cancelled;

    /**
     * @param extractor extractor to call
     * @param settings attempt and backoff limits
     * @param cancelled reports whether the run has been cancelled
     */
    public RetryingExtraction(KeyphraseExtractor extractor, ExtractionSettings settings, BooleanSupplier cancelled) {
        this.extractor = extractor;
        this.settings = settings;
        this.cancelled = cancelled;
    }

    /**
     * Extracts a document, retrying failed calls.
     *
     * @param document document to extract
     * @return outcome; never throws
     */
    public ExtractionOutcome extract(Document document) {
        if (cancelled.getAsBoolean()) {
            return ExtractionOutcome.skipped(document.id(), "run cancelled");
        }

        String lastError = "no attempt made";
        int attempt = 0;

        while (attempt < settings.maxAttempts()) {
            attempt++;
            try {
                List<CandidatePhrase> phrases = extractor.extract(document);
                if (phrases == null) {
                    log.warn("Extractor {} returned no result for {}, treating as empty",
                        extractor.getId(), document.id());
                    phrases = List.of();
                }
                return ExtractionOutcome.success(document.id(), phrases, attempt);
            } catch (ExtractionException e) {
                lastError = e.getMessage();
                log.debug("Extraction attempt {}/{} failed for {}: {}",
                    attempt, settings.maxAttempts(), document.id(), e.getMessage());
            } catch (RuntimeException e) {
                lastError = e.getClass().getSimpleName() + ": " + e.getMessage();
                log.debug("Extraction attempt {}/{} failed unexpectedly for {}",
                    attempt, settings.maxAttempts(), document.id(), e);
            }

            if (attempt >= settings.maxAttempts() || cancelled.getAsBoolean()) {
                break;
            }
            long backoff = backoffFor(settings, attempt);
            if (backoff > 0) {
                try {
                    Thread.sleep(backoff);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    lastError = "interrupted while waiting to retry";
                    break;
                }
            }
        }

        log.warn("Extraction failed for {} after {} attempt(s): {}", document.id(), attempt, lastError);
        return ExtractionOutcome.degraded(document.id(), lastError, attempt);
    }

    /**
     * Returns the delay before the retry following the given attempt.
     *
     * @param settings backoff settings
     * @param attempt failed attempt number, starting at 1
     * @return delay in milliseconds
     */
    static long backoffFor(ExtractionSettings settings, int attempt) {
        long delay = settings.initialBackoffMillis();
        for (int i = 1; i < attempt; i++) {
            delay = Math.min(delay * 2, settings.maxBackoffMillis());
        }
        return Math.min(delay, settings.maxBackoffMillis());
    }
}
