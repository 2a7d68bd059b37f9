package com.entity.reconciliation.rest.dto;

import com.entity.reconciliation.audit.ConflictLogEntry;

/**
 * Response DTO for a conflict log entry.
 */
public record ConflictResponse(
        String entityId,
        String batchId,
        String fieldName,
        String sourceAValue,
        String sourceBValue,
        String resolvedValue,
        String resolutionRule,
        String timestamp
) {
    public static ConflictResponse from(ConflictLogEntry entry) {
        return new ConflictResponse(
                entry.entityId(),
                entry.batchId(),
                entry.fieldName(),
                entry.sourceAValue(),
                entry.sourceBValue(),
                entry.resolvedValue(),
                entry.resolutionRule().description(),
                entry.timestamp().toString()
        );
    }
}
