package com.entity.reconciliation.config;

import com.entity.reconciliation.core.model.EntityType;
import com.entity.reconciliation.error.PolicyConfigurationException;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Set;

/**
 * All system-of-record policies plus the shared code mappings.
 */
public final class PolicyCatalog {

    private final Map<EntityType, SystemOfRecordPolicy> policies;
    private final CodeMappingTable codeMappings;

    private PolicyCatalog(Map<EntityType, SystemOfRecordPolicy> policies, CodeMappingTable codeMappings) {
        this.policies = Collections.unmodifiableMap(new EnumMap<>(policies));
        this.codeMappings = codeMappings;
    }

    /**
     * @throws PolicyConfigurationException if no policy is configured for the type
     */
    public SystemOfRecordPolicy policyFor(EntityType entityType) {
        SystemOfRecordPolicy policy = policies.get(entityType);
        if (policy == null) {
            throw new PolicyConfigurationException("No system-of-record policy configured for " + entityType);
        }
        return policy;
    }

    public boolean hasPolicy(EntityType entityType) {
        return policies.containsKey(entityType);
    }

    public Set<EntityType> entityTypes() {
        return policies.keySet();
    }

    public CodeMappingTable codeMappings() {
        return codeMappings;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private final Map<EntityType, SystemOfRecordPolicy> policies = new EnumMap<>(EntityType.class);
        private CodeMappingTable codeMappings = CodeMappingTable.empty();

        public Builder policy(SystemOfRecordPolicy policy) {
            policies.put(policy.entityType(), policy);
            return this;
        }

        public Builder codeMappings(CodeMappingTable codeMappings) {
            this.codeMappings = codeMappings;
            return this;
        }

        /**
         * Builds the catalog, checking that referenced entity types and code mappings exist.
         *
         * @throws PolicyConfigurationException on a dangling reference or dependency cycle
         */
        public PolicyCatalog build() {
            for (SystemOfRecordPolicy policy : policies.values()) {
                for (FieldPolicy field : policy.fields()) {
                    if (field.references() != null && !policies.containsKey(field.references())) {
                        throw new PolicyConfigurationException("Field " + field.name() + " of "
                                + policy.entityType() + " references unconfigured type " + field.references());
                    }
                    if (field.codeMapping() != null && !codeMappings.hasMapping(field.codeMapping())) {
                        throw new PolicyConfigurationException("Field " + field.name() + " of "
                                + policy.entityType() + " uses unknown code mapping " + field.codeMapping());
                    }
                }
            }
            for (EntityType type : policies.keySet()) {
                checkAcyclic(type, type, 0);
            }
            return new PolicyCatalog(policies, codeMappings);
        }

        private void checkAcyclic(EntityType origin, EntityType current, int depth) {
            if (depth > policies.size()) {
                throw new PolicyConfigurationException("Dependency cycle involving " + origin);
            }
            for (EntityType dep : policies.get(current).dependencies()) {
                if (dep == origin) {
                    throw new PolicyConfigurationException("Dependency cycle involving " + origin);
                }
                checkAcyclic(origin, dep, depth + 1);
            }
        }
    }
}
