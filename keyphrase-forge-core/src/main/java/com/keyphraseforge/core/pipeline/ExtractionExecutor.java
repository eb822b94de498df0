package com.keyphraseforge.core.pipeline;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Callable;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Bounded thread pool for the extraction calls of one run.
 *
 * <p>The pool size caps the number of in-flight extraction calls.
 */
class ExtractionExecutor implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ExtractionExecutor.class);
    private static final long SHUTDOWN_TIMEOUT_SECONDS = 10;

    private final ThreadPoolExecutor executor;

    ExtractionExecutor(int workers) {
        AtomicInteger threadCounter = new AtomicInteger(0);
        ThreadFactory threadFactory = r -> {
            Thread thread = new Thread(r, "extractor-" + threadCounter.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        };

        this.executor = new ThreadPoolExecutor(
            workers,
            workers,
            0L, TimeUnit.MILLISECONDS,
            new LinkedBlockingQueue<>(),
            threadFactory
        );
        log.debug("Extraction pool started with {} workers", workers);
    }

    <T> Future<T> submit(Callable<T> task) {
        return executor.submit(task);
    }

    /**
     * Waits for queued calls to finish, then stops the pool.
     */
    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                log.warn("Extraction pool did not terminate in time, forcing shutdown");
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            log.error("Interrupted while waiting for the extraction pool to terminate", e);
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
