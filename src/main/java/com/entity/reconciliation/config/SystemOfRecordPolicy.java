package com.entity.reconciliation.config;

import com.entity.reconciliation.core.model.EntityType;
import com.entity.reconciliation.core.model.SourceSide;
import com.entity.reconciliation.quality.QualityRule;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Per entity type: which source is authoritative, how each field resolves,
 * which fields are derived and how merged records are scored.
 *
 * @param entityType    the entity type
 * @param primarySource default primary source for fields without an override
 * @param historized    whether merged records are kept as SCD type-2 dimension history
 * @param fields        source field policies, in output order
 * @param derivedFields derived fields, in evaluation order
 * @param qualityRules  data quality rules, in issue order
 */
public record SystemOfRecordPolicy(
        EntityType entityType,
        SourceSide primarySource,
        boolean historized,
        List<FieldPolicy> fields,
        List<DerivedField> derivedFields,
        List<QualityRule> qualityRules
) {
    public SystemOfRecordPolicy {
        Objects.requireNonNull(entityType, "entityType is required");
        Objects.requireNonNull(primarySource, "primarySource is required");
        fields = fields != null ? List.copyOf(fields) : List.of();
        derivedFields = derivedFields != null ? List.copyOf(derivedFields) : List.of();
        qualityRules = qualityRules != null ? List.copyOf(qualityRules) : List.of();
        Set<String> names = new HashSet<>();
        for (FieldPolicy field : fields) {
            if (!names.add(field.name())) {
                throw new IllegalArgumentException("Duplicate field " + field.name() + " for " + entityType);
            }
            if (field.references() == entityType) {
                throw new IllegalArgumentException("Field " + field.name() + " of " + entityType
                        + " cannot reference its own entity type");
            }
        }
    }

    /**
     * Change-tracked fields in declaration order. This order defines the fingerprint.
     */
    public List<FieldPolicy> trackedFields() {
        return fields.stream().filter(FieldPolicy::tracked).toList();
    }

    /**
     * Entity types whose crosswalks must exist (and whose runs must have succeeded)
     * before this type can be processed for the same batch.
     */
    public Set<EntityType> dependencies() {
        Set<EntityType> deps = EnumSet.noneOf(EntityType.class);
        for (FieldPolicy field : fields) {
            if (field.references() != null) {
                deps.add(field.references());
            }
        }
        return Collections.unmodifiableSet(deps);
    }

    public Optional<FieldPolicy> field(String name) {
        return fields.stream().filter(f -> f.name().equals(name)).findFirst();
    }

    public static Builder builder(EntityType entityType) {
        return new Builder(entityType);
    }

    public static class Builder {
        private final EntityType entityType;
        private SourceSide primarySource = SourceSide.A;
        private boolean historized = true;
        private final List<FieldPolicy> fields = new ArrayList<>();
        private final List<DerivedField> derivedFields = new ArrayList<>();
        private final List<QualityRule> qualityRules = new ArrayList<>();

        private Builder(EntityType entityType) {
            this.entityType = entityType;
        }

        public Builder primarySource(SourceSide primarySource) {
            this.primarySource = primarySource;
            return this;
        }

        public Builder historized(boolean historized) {
            this.historized = historized;
            return this;
        }

        public Builder field(FieldPolicy field) {
            this.fields.add(field);
            return this;
        }

        public Builder derived(DerivedField derivedField) {
            this.derivedFields.add(derivedField);
            return this;
        }

        public Builder qualityRule(QualityRule rule) {
            this.qualityRules.add(rule);
            return this;
        }

        public SystemOfRecordPolicy build() {
            return new SystemOfRecordPolicy(entityType, primarySource, historized,
                    fields, derivedFields, qualityRules);
        }
    }
}
