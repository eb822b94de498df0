package com.keyphraseforge.core.model;

/**
 * Kinds of non-fatal outcomes recorded in the audit log.
 */
public enum ErrorKind {
    /** An extraction call failed after all retries */
    EXTRACTION_FAILURE,
    /** A phrase failed normalization constraints */
    VALIDATION_REJECTION,
    /** A phrase was refused because its category and the global budget were exhausted */
    QUOTA_EXHAUSTION,
    /** A phrase duplicated a common-section term */
    EXCLUSION,
    /** A cluster fell below the global target cut-off */
    TRUNCATION
}
