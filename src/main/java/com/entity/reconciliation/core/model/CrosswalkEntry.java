package com.entity.reconciliation.core.model;

import java.util.Objects;

/**
 * Maps one natural key observed in a batch to its master identifier.
 * Crosswalk entries are replaced per (entity type, batch) and never updated in place.
 *
 * @param entityType    the entity type
 * @param batchId       the batch that produced the entry
 * @param masterId      canonical identifier (the coalesced natural key)
 * @param sourceARef    source record id of the surviving source A record, or null
 * @param sourceBRef    source record id of the surviving source B record, or null
 * @param confidence    match confidence, 0-100
 * @param matchMethod   how the key was matched
 * @param primarySource the side treated as primary for this entity
 */
public record CrosswalkEntry(
        EntityType entityType,
        String batchId,
        String masterId,
        String sourceARef,
        String sourceBRef,
        int confidence,
        MatchMethod matchMethod,
        SourceSide primarySource
) {
    public CrosswalkEntry {
        Objects.requireNonNull(entityType, "entityType is required");
        Objects.requireNonNull(batchId, "batchId is required");
        Objects.requireNonNull(masterId, "masterId is required");
        Objects.requireNonNull(matchMethod, "matchMethod is required");
        Objects.requireNonNull(primarySource, "primarySource is required");
        if (sourceARef == null && sourceBRef == null) {
            throw new IllegalArgumentException("Crosswalk entry " + masterId + " has no contributing source");
        }
        if (confidence < 0 || confidence > 100) {
            throw new IllegalArgumentException("confidence must be between 0 and 100");
        }
    }

    public String refFor(SourceSide side) {
        return side == SourceSide.A ? sourceARef : sourceBRef;
    }

    public boolean hasSource(SourceSide side) {
        return refFor(side) != null;
    }
}
