package com.entity.reconciliation.error;

import com.entity.reconciliation.core.model.EntityType;

/**
 * Thrown when stored dimension history breaks its structural rules,
 * such as a master id with more than one current version.
 */
public class IntegrityViolationException extends ReconciliationException {

    public IntegrityViolationException(EntityType entityType, String batchId, String masterId, String message) {
        super(entityType, batchId, masterId, message);
    }
}
