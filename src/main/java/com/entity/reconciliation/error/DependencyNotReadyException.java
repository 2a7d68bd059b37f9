package com.entity.reconciliation.error;

import com.entity.reconciliation.core.model.EntityType;

/**
 * Thrown when a stage runs before the data it consumes has been produced,
 * e.g. merging without a crosswalk, a batch with no eligible source records, or
 * processing events before their referenced dimensions succeeded for the same batch.
 */
public class DependencyNotReadyException extends ReconciliationException {

    private final EntityType missingDependency;

    public DependencyNotReadyException(EntityType entityType, String batchId,
                                       EntityType missingDependency, String message) {
        super(entityType, batchId, null, message);
        this.missingDependency = missingDependency;
    }

    public DependencyNotReadyException(EntityType entityType, String batchId, String message) {
        super(entityType, batchId, null, message);
        this.missingDependency = null;
    }

    public DependencyNotReadyException(EntityType entityType, String batchId, String naturalKey, String message) {
        super(entityType, batchId, naturalKey, message);
        this.missingDependency = null;
    }

    /**
     * The upstream entity type that was not ready, or null if the missing input is this type's own data.
     */
    public EntityType getMissingDependency() {
        return missingDependency;
    }
}
