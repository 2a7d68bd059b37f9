package com.entity.reconciliation.lock;

import com.entity.reconciliation.core.model.EntityType;

/**
 * Runtime exception thrown when a run lock cannot be acquired
 * within the configured timeout.
 */
public class LockAcquisitionException extends RuntimeException {

    private final EntityType entityType;

    public LockAcquisitionException(EntityType entityType, String message) {
        super(message);
        this.entityType = entityType;
    }

    public LockAcquisitionException(EntityType entityType, String message, Throwable cause) {
        super(message, cause);
        this.entityType = entityType;
    }

    public EntityType getEntityType() {
        return entityType;
    }
}
