package com.keyphraseforge.core.model;

/**
 * Outcome status of the extraction call for one document.
 */
public enum ExtractionStatus {
    /** Candidates were returned */
    SUCCESS,
    /** All attempts failed; the document contributes no candidates */
    DEGRADED,
    /** The run was cancelled before the call completed */
    SKIPPED
}
