package com.entity.reconciliation.merge;

import com.entity.reconciliation.core.model.EntityType;
import com.entity.reconciliation.core.model.MergedRecord;

import java.util.List;
import java.util.Optional;

/**
 * Storage for merged records, replaced per (entity type, batch).
 */
public interface StagingRepository {

    void replaceBatch(EntityType entityType, String batchId, List<MergedRecord> records);

    Optional<List<MergedRecord>> findBatch(EntityType entityType, String batchId);

    void deleteBatch(EntityType entityType, String batchId);

    default Optional<MergedRecord> find(EntityType entityType, String batchId, String masterId) {
        return findBatch(entityType, batchId)
                .flatMap(records -> records.stream()
                        .filter(r -> r.masterId().equals(masterId))
                        .findFirst());
    }
}
