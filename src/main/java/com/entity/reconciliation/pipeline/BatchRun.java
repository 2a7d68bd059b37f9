package com.entity.reconciliation.pipeline;

import com.entity.reconciliation.core.model.EntityType;

import java.time.Instant;
import java.util.Objects;

/**
 * Execution log row for one {@code processBatch} run.
 *
 * @param runId        unique run id
 * @param entityType   the entity type
 * @param batchId      the batch
 * @param status       lifecycle status
 * @param startedAt    start time
 * @param finishedAt   end time, null while running
 * @param statistics   counts collected so far
 * @param errorMessage failure description, null unless failed
 */
public record BatchRun(
        String runId,
        EntityType entityType,
        String batchId,
        BatchStatus status,
        Instant startedAt,
        Instant finishedAt,
        BatchStatistics statistics,
        String errorMessage
) {
    public BatchRun {
        Objects.requireNonNull(runId, "runId is required");
        Objects.requireNonNull(entityType, "entityType is required");
        Objects.requireNonNull(batchId, "batchId is required");
        Objects.requireNonNull(status, "status is required");
        Objects.requireNonNull(startedAt, "startedAt is required");
        if (statistics == null) {
            statistics = BatchStatistics.empty();
        }
    }

    public static BatchRun started(String runId, EntityType entityType, String batchId, Instant startedAt) {
        return new BatchRun(runId, entityType, batchId, BatchStatus.RUNNING, startedAt, null, null, null);
    }

    public BatchRun succeeded(Instant finishedAt, BatchStatistics statistics) {
        return new BatchRun(runId, entityType, batchId, BatchStatus.SUCCEEDED, startedAt, finishedAt, statistics, null);
    }

    public BatchRun failed(Instant finishedAt, String errorMessage) {
        return new BatchRun(runId, entityType, batchId, BatchStatus.FAILED, startedAt, finishedAt, statistics, errorMessage);
    }
}
