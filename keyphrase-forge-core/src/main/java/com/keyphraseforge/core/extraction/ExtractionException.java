package com.keyphraseforge.core.extraction;

/**
 * Thrown by a {@link KeyphraseExtractor} when a single extraction call fails.
 *
 * <p>Callers retry and finally degrade the document to an empty result; this exception
 * never fails a run.
 */
public class ExtractionException extends Exception {

    public ExtractionException(String message) {
        super(message);
    }

    public ExtractionException(String message, Throwable cause) {
        super(message, cause);
    }
}
