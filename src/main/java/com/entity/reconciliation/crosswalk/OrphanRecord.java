package com.entity.reconciliation.crosswalk;

import com.entity.reconciliation.core.model.SourceRecord;

import java.util.Objects;

/**
 * A source record excluded from the crosswalk because it could not be keyed.
 */
public record OrphanRecord(SourceRecord record, String reason) {

    public static final String MISSING_NATURAL_KEY = "missing natural key";

    public OrphanRecord {
        Objects.requireNonNull(record, "record is required");
        Objects.requireNonNull(reason, "reason is required");
    }
}
