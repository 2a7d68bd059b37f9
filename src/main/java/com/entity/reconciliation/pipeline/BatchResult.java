package com.entity.reconciliation.pipeline;

import com.entity.reconciliation.core.model.EntityType;

import java.util.Objects;

/**
 * Outcome of {@link ReconciliationPipeline#processBatch}.
 *
 * @param entityType the entity type
 * @param batchId    the batch
 * @param runId      id of the run's execution log row, null if the run never started
 * @param status     SUCCEEDED or FAILED
 * @param statistics counts collected before completion or failure
 * @param error      the failure cause, null on success
 */
public record BatchResult(
        EntityType entityType,
        String batchId,
        String runId,
        BatchStatus status,
        BatchStatistics statistics,
        RuntimeException error
) {
    public BatchResult {
        Objects.requireNonNull(status, "status is required");
        if (statistics == null) {
            statistics = BatchStatistics.empty();
        }
        if (status == BatchStatus.FAILED && error == null) {
            throw new IllegalArgumentException("A failed result needs an error");
        }
    }

    public static BatchResult succeeded(EntityType entityType, String batchId, String runId,
                                        BatchStatistics statistics) {
        return new BatchResult(entityType, batchId, runId, BatchStatus.SUCCEEDED, statistics, null);
    }

    public static BatchResult failed(EntityType entityType, String batchId, String runId,
                                     BatchStatistics statistics, RuntimeException error) {
        return new BatchResult(entityType, batchId, runId, BatchStatus.FAILED, statistics, error);
    }

    public boolean isSuccess() {
        return status == BatchStatus.SUCCEEDED;
    }

    /**
     * Rows committed by the run. A failed run's output is rolled back, so it reports none.
     */
    public int rowCount() {
        return isSuccess() ? statistics.rowCount() : 0;
    }
}
