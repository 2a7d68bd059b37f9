package com.entity.reconciliation.crosswalk;

import com.entity.reconciliation.core.model.CrosswalkEntry;
import com.entity.reconciliation.core.model.EntityType;

import java.util.List;
import java.util.Optional;

/**
 * Storage for crosswalk snapshots. Each (entity type, batch) is replaced as a unit.
 */
public interface CrosswalkRepository {

    /**
     * Replaces the crosswalk for a batch with the given entries.
     */
    void replaceBatch(EntityType entityType, String batchId, List<CrosswalkEntry> entries);

    /**
     * Returns the crosswalk for a batch, or empty if none was ever written.
     * An existing but empty crosswalk is returned as an empty list.
     */
    Optional<List<CrosswalkEntry>> findBatch(EntityType entityType, String batchId);

    /**
     * Removes the crosswalk for a batch.
     */
    void deleteBatch(EntityType entityType, String batchId);

    /**
     * Finds the entry for a master id within a batch.
     */
    default Optional<CrosswalkEntry> findByMasterId(EntityType entityType, String batchId, String masterId) {
        return findBatch(entityType, batchId)
                .flatMap(entries -> entries.stream()
                        .filter(e -> e.masterId().equals(masterId))
                        .findFirst());
    }
}
