package com.entity.reconciliation.rest.dto;

import com.entity.reconciliation.pipeline.BatchRun;

/**
 * Response DTO for an execution log row.
 */
public record BatchRunResponse(
        String runId,
        String entityType,
        String batchId,
        String status,
        String startedAt,
        String finishedAt,
        int rowCount,
        int conflicts,
        String errorMessage
) {
    public static BatchRunResponse from(BatchRun run) {
        return new BatchRunResponse(
                run.runId(),
                run.entityType().name(),
                run.batchId(),
                run.status().name(),
                run.startedAt().toString(),
                run.finishedAt() != null ? run.finishedAt().toString() : null,
                run.statistics().rowCount(),
                run.statistics().conflicts(),
                run.errorMessage()
        );
    }
}
