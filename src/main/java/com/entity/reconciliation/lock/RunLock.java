package com.entity.reconciliation.lock;

import com.entity.reconciliation.core.model.EntityType;

/**
 * Serializes pipeline runs of the same entity type.
 */
public interface RunLock {

    /**
     * Acquires the run lock for an entity type.
     *
     * @throws LockAcquisitionException if the lock is not acquired within the configured timeout
     */
    void acquire(EntityType entityType);

    /**
     * Releases the run lock if the calling thread holds it.
     */
    void release(EntityType entityType);
}
