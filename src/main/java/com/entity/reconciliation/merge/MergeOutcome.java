package com.entity.reconciliation.merge;

import com.entity.reconciliation.audit.ConflictLogEntry;
import com.entity.reconciliation.core.model.MergedRecord;

import java.util.List;

/**
 * Merged records for a batch (sorted by master id) and the conflicts found producing them.
 */
public record MergeOutcome(List<MergedRecord> records, List<ConflictLogEntry> conflicts) {

    public MergeOutcome {
        records = records != null ? List.copyOf(records) : List.of();
        conflicts = conflicts != null ? List.copyOf(conflicts) : List.of();
    }

    public double averageQualityScore() {
        return records.stream().mapToInt(MergedRecord::dqScore).average().orElse(0.0);
    }

    public long unresolvedReferenceCount() {
        return records.stream().mapToLong(r -> r.unresolvedReferences().size()).sum();
    }
}
