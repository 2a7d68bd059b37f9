package com.entity.reconciliation.source;

import com.entity.reconciliation.core.model.EntityType;
import com.entity.reconciliation.core.model.SourceRecord;
import com.entity.reconciliation.core.model.SourceSide;

import java.util.List;

/**
 * Supplies the raw records one source system delivered for a batch.
 * Implementations may return historical redeliveries; the crosswalk stage applies
 * the rolling window and collapses duplicates.
 */
public interface SourceRecordProvider {

    List<SourceRecord> fetch(EntityType entityType, SourceSide side, String batchId);
}
