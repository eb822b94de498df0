package com.keyphraseforge.core.model;

import java.util.Objects;

/**
 * One record in the run's audit log.
 *
 * @param text phrase text (or document id for extraction failures)
 * @param documentId source document id, or null for cluster-level entries
 * @param category category involved
 * @param reason why the item was dropped
 * @param detail human-readable detail
 */
public record AuditEntry(
    String text,
    String documentId,
    String category,
    AuditReason reason,
    String detail
) {
    /**
     * Compact constructor with validation.
     */
    public AuditEntry {
        Objects.requireNonNull(text, "text must not be null");
        Objects.requireNonNull(reason, "reason must not be null");
        if (detail == null) {
            detail = "";
        }
    }

    /**
     * Returns the error kind of this entry.
     *
     * @return error kind derived from the reason
     */
    public ErrorKind kind() {
        return reason.kind();
    }
}
