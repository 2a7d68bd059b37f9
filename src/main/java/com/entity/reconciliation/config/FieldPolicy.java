package com.entity.reconciliation.config;

import com.entity.reconciliation.core.model.EntityType;
import com.entity.reconciliation.core.model.SourceSide;

import java.util.Objects;

/**
 * Resolution policy for one canonical field.
 *
 * @param name         canonical field name in merged records
 * @param sourceAField attribute name in source A records
 * @param sourceBField attribute name in source B records
 * @param primary      field-level primary source, or null to use the entity default
 * @param rule         how to choose between the two sources
 * @param normalizer   normalization applied to both sources before comparison
 * @param tracked      whether the field takes part in change detection and conflict logging
 * @param codeMapping  name of a code mapping translating source codes, or null
 * @param references   entity type whose crosswalk resolves this field to a master id, or null
 */
public record FieldPolicy(
        String name,
        String sourceAField,
        String sourceBField,
        SourceSide primary,
        FieldRule rule,
        FieldNormalizer normalizer,
        boolean tracked,
        String codeMapping,
        EntityType references
) {
    public FieldPolicy {
        Objects.requireNonNull(name, "name is required");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Field name cannot be blank");
        }
        if (sourceAField == null || sourceAField.isBlank()) {
            sourceAField = name;
        }
        if (sourceBField == null || sourceBField.isBlank()) {
            sourceBField = name;
        }
        if (rule == null) {
            rule = FieldRule.PREFER_PRIMARY;
        }
        if (normalizer == null) {
            normalizer = FieldNormalizer.NONE;
        }
    }

    public String sourceField(SourceSide side) {
        return side == SourceSide.A ? sourceAField : sourceBField;
    }

    /**
     * The primary source for this field, falling back to the entity-level primary.
     */
    public SourceSide primaryOr(SourceSide entityPrimary) {
        return primary != null ? primary : entityPrimary;
    }

    public boolean isReference() {
        return references != null;
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public static class Builder {
        private final String name;
        private String sourceAField;
        private String sourceBField;
        private SourceSide primary;
        private FieldRule rule = FieldRule.PREFER_PRIMARY;
        private FieldNormalizer normalizer = FieldNormalizer.NONE;
        private boolean tracked;
        private String codeMapping;
        private EntityType references;

        private Builder(String name) {
            this.name = name;
        }

        public Builder sourceAField(String sourceAField) {
            this.sourceAField = sourceAField;
            return this;
        }

        public Builder sourceBField(String sourceBField) {
            this.sourceBField = sourceBField;
            return this;
        }

        public Builder primary(SourceSide primary) {
            this.primary = primary;
            return this;
        }

        public Builder rule(FieldRule rule) {
            this.rule = rule;
            return this;
        }

        public Builder normalizer(FieldNormalizer normalizer) {
            this.normalizer = normalizer;
            return this;
        }

        public Builder tracked(boolean tracked) {
            this.tracked = tracked;
            return this;
        }

        public Builder codeMapping(String codeMapping) {
            this.codeMapping = codeMapping;
            return this;
        }

        public Builder references(EntityType references) {
            this.references = references;
            return this;
        }

        public FieldPolicy build() {
            return new FieldPolicy(name, sourceAField, sourceBField, primary, rule,
                    normalizer, tracked, codeMapping, references);
        }
    }
}
