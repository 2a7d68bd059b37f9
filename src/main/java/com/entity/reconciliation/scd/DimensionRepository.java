package com.entity.reconciliation.scd;

import com.entity.reconciliation.core.model.EntityType;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Storage for SCD type-2 dimension history.
 */
public interface DimensionRepository {

    /**
     * Atomically replaces a master id's history with the result of the transition.
     * The transition receives the current history (oldest first, empty if none) and returns
     * the new history. Concurrent callers on the same master id are serialized and readers
     * never observe a partially applied transition. Exceptions thrown by the transition
     * leave the history untouched and propagate to the caller.
     *
     * @return the history after the transition
     */
    List<DimensionVersion> applyVersion(EntityType entityType, String masterId,
                                        UnaryOperator<List<DimensionVersion>> transition);

    /**
     * Full history of a master id, oldest first.
     */
    List<DimensionVersion> findHistory(EntityType entityType, String masterId);

    Optional<DimensionVersion> findCurrent(EntityType entityType, String masterId);

    /**
     * The version in effect at an instant, if any.
     */
    default Optional<DimensionVersion> findAsOf(EntityType entityType, String masterId, Instant asOf) {
        return findHistory(entityType, masterId).stream()
                .filter(v -> v.isEffectiveAt(asOf))
                .findFirst();
    }

    List<DimensionVersion> findAllCurrent(EntityType entityType);

    int countVersions(EntityType entityType);
}
