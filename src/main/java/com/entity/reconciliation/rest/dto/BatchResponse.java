package com.entity.reconciliation.rest.dto;

import com.entity.reconciliation.error.DependencyNotReadyException;
import com.entity.reconciliation.error.ReconciliationException;
import com.entity.reconciliation.pipeline.BatchResult;
import com.entity.reconciliation.pipeline.BatchStatistics;

/**
 * Response DTO for a processed batch.
 */
public record BatchResponse(
        String entityType,
        String batchId,
        String runId,
        String status,
        int rowCount,
        int recordsRead,
        int orphans,
        int conflicts,
        int versionsOpened,
        int versionsChanged,
        int versionsUnchanged,
        String errorType,
        String errorMessage,
        String missingDependency,
        String naturalKey
) {
    public static BatchResponse from(BatchResult result) {
        BatchStatistics stats = result.statistics();
        RuntimeException error = result.error();
        String missing = error instanceof DependencyNotReadyException dnr && dnr.getMissingDependency() != null
                ? dnr.getMissingDependency().name()
                : null;
        return new BatchResponse(
                result.entityType() != null ? result.entityType().name() : null,
                result.batchId(),
                result.runId(),
                result.status().name(),
                result.rowCount(),
                stats.recordsRead(),
                stats.orphans(),
                stats.conflicts(),
                stats.versionsOpened(),
                stats.versionsChanged(),
                stats.versionsUnchanged(),
                error != null ? ErrorResponse.errorType(error) : null,
                error != null ? error.getMessage() : null,
                missing,
                error instanceof ReconciliationException re ? re.getNaturalKey() : null
        );
    }
}
