package com.entity.reconciliation.core.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable raw record delivered by a source system for one batch.
 * Attribute values may be {@code null}; the map preserves the source's field order.
 *
 * @param entityType     the entity type the record describes
 * @param side           the source system that produced it
 * @param sourceRecordId the source system's internal row id (defaults to the natural key)
 * @param naturalKey     business identifier used for cross-source matching, may be blank
 * @param attributes     raw attributes keyed by the source's own field names
 * @param batchId        the batch that delivered the record
 * @param ingestionTime  when the record was ingested
 */
public record SourceRecord(
        EntityType entityType,
        SourceSide side,
        String sourceRecordId,
        String naturalKey,
        Map<String, Object> attributes,
        String batchId,
        Instant ingestionTime
) {
    public SourceRecord {
        Objects.requireNonNull(entityType, "entityType is required");
        Objects.requireNonNull(side, "side is required");
        Objects.requireNonNull(batchId, "batchId is required");
        Objects.requireNonNull(ingestionTime, "ingestionTime is required");
        attributes = attributes != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(attributes))
                : Map.of();
        if (sourceRecordId == null || sourceRecordId.isBlank()) {
            sourceRecordId = naturalKey;
        }
    }

    /**
     * Returns the natural key with surrounding whitespace removed, or {@code null} if blank.
     */
    public String trimmedKey() {
        if (naturalKey == null || naturalKey.isBlank()) {
            return null;
        }
        return naturalKey.trim();
    }

    public boolean hasNaturalKey() {
        return trimmedKey() != null;
    }

    public Object attribute(String name) {
        return attributes.get(name);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private EntityType entityType;
        private SourceSide side;
        private String sourceRecordId;
        private String naturalKey;
        private final Map<String, Object> attributes = new LinkedHashMap<>();
        private String batchId;
        private Instant ingestionTime;

        public Builder entityType(EntityType entityType) {
            this.entityType = entityType;
            return this;
        }

        public Builder side(SourceSide side) {
            this.side = side;
            return this;
        }

        public Builder sourceRecordId(String sourceRecordId) {
            this.sourceRecordId = sourceRecordId;
            return this;
        }

        public Builder naturalKey(String naturalKey) {
            this.naturalKey = naturalKey;
            return this;
        }

        public Builder attribute(String name, Object value) {
            this.attributes.put(name, value);
            return this;
        }

        public Builder attributes(Map<String, Object> attributes) {
            if (attributes != null) {
                this.attributes.putAll(attributes);
            }
            return this;
        }

        public Builder batchId(String batchId) {
            this.batchId = batchId;
            return this;
        }

        public Builder ingestionTime(Instant ingestionTime) {
            this.ingestionTime = ingestionTime;
            return this;
        }

        public SourceRecord build() {
            return new SourceRecord(entityType, side, sourceRecordId, naturalKey,
                    attributes, batchId, ingestionTime);
        }
    }
}
