package com.entity.reconciliation.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Canonical attribute set resolved for one master identifier in one batch.
 *
 * @param entityType           the entity type
 * @param batchId              the batch
 * @param masterId             canonical identifier
 * @param sourceSystem         provenance label, e.g. {@code OMS_MERGED}
 * @param attributes           resolved, normalized attributes (values may be null)
 * @param fingerprint          hash over change-tracked attributes
 * @param dqScore              data quality score, 0-100
 * @param dqIssues             ordered data quality issue tags
 * @param conflictFields       tracked fields on which the sources disagreed
 * @param unresolvedReferences reference fields whose value had no crosswalk match
 */
public record MergedRecord(
        EntityType entityType,
        String batchId,
        String masterId,
        String sourceSystem,
        Map<String, Object> attributes,
        String fingerprint,
        int dqScore,
        List<String> dqIssues,
        List<String> conflictFields,
        List<String> unresolvedReferences
) {
    public MergedRecord {
        Objects.requireNonNull(entityType, "entityType is required");
        Objects.requireNonNull(batchId, "batchId is required");
        Objects.requireNonNull(masterId, "masterId is required");
        Objects.requireNonNull(fingerprint, "fingerprint is required");
        attributes = attributes != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(attributes))
                : Map.of();
        dqIssues = dqIssues != null ? List.copyOf(dqIssues) : List.of();
        conflictFields = conflictFields != null ? List.copyOf(conflictFields) : List.of();
        unresolvedReferences = unresolvedReferences != null ? List.copyOf(unresolvedReferences) : List.of();
    }

    public Object attribute(String name) {
        return attributes.get(name);
    }

    public boolean hasConflicts() {
        return !conflictFields.isEmpty();
    }
}
