package com.entity.reconciliation.audit;

import com.entity.reconciliation.config.FieldRule;
import com.entity.reconciliation.core.model.EntityType;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Immutable audit record of one field-level disagreement between the two sources.
 * Values are the normalized forms that were compared, rendered as strings.
 */
public record ConflictLogEntry(
        String id,
        EntityType entityType,
        String batchId,
        String entityId,
        String fieldName,
        String sourceAValue,
        String sourceBValue,
        String resolvedValue,
        FieldRule resolutionRule,
        Instant timestamp
) {
    public ConflictLogEntry {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(entityType, "entityType is required");
        Objects.requireNonNull(batchId, "batchId is required");
        Objects.requireNonNull(entityId, "entityId is required");
        Objects.requireNonNull(fieldName, "fieldName is required");
        Objects.requireNonNull(resolutionRule, "resolutionRule is required");
        Objects.requireNonNull(timestamp, "timestamp is required");
    }

    /**
     * Identity of the disagreement, independent of when it was logged.
     */
    public ConflictKey key() {
        return new ConflictKey(entityType, batchId, entityId, fieldName);
    }

    public record ConflictKey(EntityType entityType, String batchId, String entityId, String fieldName) {}

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String id = UUID.randomUUID().toString();
        private EntityType entityType;
        private String batchId;
        private String entityId;
        private String fieldName;
        private String sourceAValue;
        private String sourceBValue;
        private String resolvedValue;
        private FieldRule resolutionRule = FieldRule.PREFER_PRIMARY;
        private Instant timestamp = Instant.now();

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder entityType(EntityType entityType) {
            this.entityType = entityType;
            return this;
        }

        public Builder batchId(String batchId) {
            this.batchId = batchId;
            return this;
        }

        public Builder entityId(String entityId) {
            this.entityId = entityId;
            return this;
        }

        public Builder fieldName(String fieldName) {
            this.fieldName = fieldName;
            return this;
        }

        public Builder sourceAValue(String sourceAValue) {
            this.sourceAValue = sourceAValue;
            return this;
        }

        public Builder sourceBValue(String sourceBValue) {
            this.sourceBValue = sourceBValue;
            return this;
        }

        public Builder resolvedValue(String resolvedValue) {
            this.resolvedValue = resolvedValue;
            return this;
        }

        public Builder resolutionRule(FieldRule resolutionRule) {
            this.resolutionRule = resolutionRule;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public ConflictLogEntry build() {
            return new ConflictLogEntry(id, entityType, batchId, entityId, fieldName,
                    sourceAValue, sourceBValue, resolvedValue, resolutionRule, timestamp);
        }
    }
}
