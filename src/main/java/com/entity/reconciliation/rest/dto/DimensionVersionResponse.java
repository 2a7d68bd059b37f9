package com.entity.reconciliation.rest.dto;

import com.entity.reconciliation.core.hash.Fingerprints;
import com.entity.reconciliation.scd.DimensionVersion;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Response DTO for one dimension version. Attribute values are rendered as strings.
 */
public record DimensionVersionResponse(
        String masterId,
        int versionNumber,
        boolean current,
        String effectiveStart,
        String effectiveEnd,
        String batchId,
        String fingerprint,
        Map<String, String> attributes
) {
    public static DimensionVersionResponse from(DimensionVersion version) {
        Map<String, String> attributes = new LinkedHashMap<>();
        version.attributes().forEach((key, value) ->
                attributes.put(key, value != null ? Fingerprints.render(value) : null));
        return new DimensionVersionResponse(
                version.masterId(),
                version.versionNumber(),
                version.current(),
                version.effectiveStart().toString(),
                version.effectiveEnd().toString(),
                version.batchId(),
                version.fingerprint(),
                attributes
        );
    }
}
