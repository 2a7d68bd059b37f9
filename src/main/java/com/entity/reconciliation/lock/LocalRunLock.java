package com.entity.reconciliation.lock;

import com.entity.reconciliation.core.model.EntityType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-process run lock backed by one {@link ReentrantLock} per entity type.
 * Suitable for single-JVM deployments.
 */
public class LocalRunLock implements RunLock {
    private static final Logger log = LoggerFactory.getLogger(LocalRunLock.class);

    private final Map<EntityType, ReentrantLock> locks = new ConcurrentHashMap<>();
    private final Duration timeout;

    public LocalRunLock(Duration timeout) {
        this.timeout = timeout;
    }

    @Override
    public void acquire(EntityType entityType) {
        ReentrantLock lock = locks.computeIfAbsent(entityType, k -> new ReentrantLock());
        try {
            if (!lock.tryLock(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                throw new LockAcquisitionException(entityType,
                        "Run of " + entityType + " still in progress after " + timeout.toMillis() + "ms");
            }
            log.debug("lock.acquired entityType={}", entityType);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LockAcquisitionException(entityType, "Interrupted while waiting for run lock of " + entityType, e);
        }
    }

    @Override
    public void release(EntityType entityType) {
        ReentrantLock lock = locks.get(entityType);
        if (lock != null && lock.isHeldByCurrentThread()) {
            lock.unlock();
            log.debug("lock.released entityType={}", entityType);
        }
    }

    /**
     * Whether another run of the entity type currently holds the lock.
     */
    public boolean isLocked(EntityType entityType) {
        ReentrantLock lock = locks.get(entityType);
        return lock != null && lock.isLocked();
    }
}
