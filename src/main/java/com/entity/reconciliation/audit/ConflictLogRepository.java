package com.entity.reconciliation.audit;

import com.entity.reconciliation.core.model.EntityType;

import java.util.List;

/**
 * Append-only storage for conflict log entries.
 */
public interface ConflictLogRepository {

    /**
     * Appends the entry unless one with the same {@link ConflictLogEntry#key()} already exists.
     *
     * @return true if the entry was appended
     */
    boolean appendIfAbsent(ConflictLogEntry entry);

    List<ConflictLogEntry> findAll();

    List<ConflictLogEntry> findByEntityId(EntityType entityType, String entityId);

    List<ConflictLogEntry> findByBatch(EntityType entityType, String batchId);

    List<ConflictLogEntry> findByField(EntityType entityType, String fieldName);

    int count();
}
