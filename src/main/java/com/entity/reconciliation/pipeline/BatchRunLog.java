package com.entity.reconciliation.pipeline;

import com.entity.reconciliation.core.model.EntityType;

import java.util.List;
import java.util.Optional;

/**
 * Records pipeline runs and answers whether a batch's output may be consumed downstream.
 */
public interface BatchRunLog {

    /**
     * Stores or replaces a run, keyed by its run id.
     */
    void save(BatchRun run);

    /**
     * Most recently started run for the entity type and batch.
     */
    Optional<BatchRun> findLatest(EntityType entityType, String batchId);

    /**
     * Earliest run for the entity type and batch, whatever its status.
     */
    Optional<BatchRun> findFirst(EntityType entityType, String batchId);

    List<BatchRun> findAll(EntityType entityType);

    /**
     * True when the latest run for the entity type and batch succeeded.
     * Output of failed or still-running runs is not consumable.
     */
    default boolean isConsumable(EntityType entityType, String batchId) {
        return findLatest(entityType, batchId)
                .map(run -> run.status() == BatchStatus.SUCCEEDED)
                .orElse(false);
    }
}
