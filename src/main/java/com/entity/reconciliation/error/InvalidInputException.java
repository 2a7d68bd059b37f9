package com.entity.reconciliation.error;

import com.entity.reconciliation.core.model.EntityType;

/**
 * Thrown when a batch request is malformed (missing entity type, blank or invalid batch id).
 * Raised before any state is touched.
 */
public class InvalidInputException extends ReconciliationException {

    public InvalidInputException(EntityType entityType, String batchId, String message) {
        super(entityType, batchId, null, message);
    }
}
