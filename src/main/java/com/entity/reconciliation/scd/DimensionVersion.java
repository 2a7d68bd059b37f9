package com.entity.reconciliation.scd;

import com.entity.reconciliation.core.model.EntityType;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One SCD type-2 version of a dimension entity.
 * The current version has {@code effectiveEnd == OPEN_END} and {@code current == true}.
 */
public record DimensionVersion(
        EntityType entityType,
        String masterId,
        int versionNumber,
        Map<String, Object> attributes,
        String fingerprint,
        String batchId,
        Instant effectiveStart,
        Instant effectiveEnd,
        boolean current
) {
    /**
     * Sentinel end timestamp of an open version: 9999-12-31T23:59:59Z.
     */
    public static final Instant OPEN_END = Instant.parse("9999-12-31T23:59:59Z");

    public DimensionVersion {
        Objects.requireNonNull(entityType, "entityType is required");
        Objects.requireNonNull(masterId, "masterId is required");
        Objects.requireNonNull(fingerprint, "fingerprint is required");
        Objects.requireNonNull(effectiveStart, "effectiveStart is required");
        Objects.requireNonNull(effectiveEnd, "effectiveEnd is required");
        if (versionNumber < 1) {
            throw new IllegalArgumentException("versionNumber must be positive");
        }
        if (effectiveEnd.isBefore(effectiveStart)) {
            throw new IllegalArgumentException("effectiveEnd precedes effectiveStart for " + masterId);
        }
        if (current != OPEN_END.equals(effectiveEnd)) {
            throw new IllegalArgumentException("Only the open version may be current for " + masterId);
        }
        attributes = attributes != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(attributes))
                : Map.of();
    }

    /**
     * Creates the open version of a newly observed or changed entity.
     */
    public static DimensionVersion open(EntityType entityType, String masterId, int versionNumber,
                                        Map<String, Object> attributes, String fingerprint,
                                        String batchId, Instant effectiveStart) {
        return new DimensionVersion(entityType, masterId, versionNumber, attributes, fingerprint,
                batchId, effectiveStart, OPEN_END, true);
    }

    /**
     * Returns this version closed at the given instant.
     */
    public DimensionVersion closeAt(Instant end) {
        return new DimensionVersion(entityType, masterId, versionNumber, attributes, fingerprint,
                batchId, effectiveStart, end, false);
    }

    /**
     * Whether this version was in effect at the instant (start inclusive, end exclusive).
     */
    public boolean isEffectiveAt(Instant instant) {
        return !instant.isBefore(effectiveStart) && instant.isBefore(effectiveEnd);
    }
}
