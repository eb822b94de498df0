package com.keyphraseforge.core.aggregate;

import com.keyphraseforge.core.model.AuditEntry;
import com.keyphraseforge.core.model.AuditReason;
import com.keyphraseforge.core.model.ErrorKind;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Append-only record of every rejected, excluded or truncated item in a run.
 */
public class AuditLog {

    private final List<AuditEntry> entries = new ArrayList<>();

    public void add(AuditEntry entry) {
        entries.add(entry);
    }

    public void add(String text, String documentId, String category, AuditReason reason, String detail) {
        entries.add(new AuditEntry(text, documentId, category, reason, detail));
    }

    public List<AuditEntry> entries() {
        return Collections.unmodifiableList(entries);
    }

    public int size() {
        return entries.size();
    }

    /**
     * Returns the entries of one kind.
     *
     * @param kind error kind
     * @return matching entries in log order
     */
    public List<AuditEntry> entries(ErrorKind kind) {
        return entries.stream().filter(e -> e.kind() == kind).toList();
    }

    /**
     * Counts entries per reason.
     *
     * @return counts by reason, in enum order
     */
    public Map<AuditReason, Integer> countsByReason() {
        Map<AuditReason, Integer> counts = new EnumMap<>(AuditReason.class);
        for (AuditEntry entry : entries) {
            counts.merge(entry.reason(), 1, Integer::sum);
        }
        return counts;
    }
}
