package com.keyphraseforge.core.model;

/**
 * Reason a candidate phrase, cluster or document did not reach the output.
 */
public enum AuditReason {
    TOO_SHORT(ErrorKind.VALIDATION_REJECTION),
    TOO_LONG(ErrorKind.VALIDATION_REJECTION),
    STOPLISTED(ErrorKind.VALIDATION_REJECTION),
    EXCLUDED_COMMON_TERM(ErrorKind.EXCLUSION),
    QUOTA_EXHAUSTED(ErrorKind.QUOTA_EXHAUSTION),
    EXTRACTION_FAILED(ErrorKind.EXTRACTION_FAILURE),
    TRUNCATED(ErrorKind.TRUNCATION);

    private final ErrorKind kind;

    AuditReason(ErrorKind kind) {
        this.kind = kind;
    }

    public ErrorKind kind() {
        return kind;
    }
}
