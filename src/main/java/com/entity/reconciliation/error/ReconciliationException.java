package com.entity.reconciliation.error;

import com.entity.reconciliation.core.model.EntityType;

/**
 * Base class for failures raised while processing a batch.
 * Carries the entity type, batch and, where known, the natural key being processed.
 */
public class ReconciliationException extends RuntimeException {

    private final EntityType entityType;
    private final String batchId;
    private final String naturalKey;

    public ReconciliationException(EntityType entityType, String batchId, String naturalKey, String message) {
        super(message);
        this.entityType = entityType;
        this.batchId = batchId;
        this.naturalKey = naturalKey;
    }

    public ReconciliationException(EntityType entityType, String batchId, String naturalKey,
                                   String message, Throwable cause) {
        super(message, cause);
        this.entityType = entityType;
        this.batchId = batchId;
        this.naturalKey = naturalKey;
    }

    public EntityType getEntityType() {
        return entityType;
    }

    public String getBatchId() {
        return batchId;
    }

    /**
     * Natural key or master id involved in the failure, or null when the failure is batch-wide.
     */
    public String getNaturalKey() {
        return naturalKey;
    }
}
