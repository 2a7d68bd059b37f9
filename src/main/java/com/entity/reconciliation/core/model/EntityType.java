package com.entity.reconciliation.core.model;

import java.util.Locale;

/**
 * Entity types reconciled by the pipeline.
 * Whether a type is historized and which types it depends on is declared by its
 * system-of-record policy, not here.
 */
public enum EntityType {
    VETERAN("Veteran"),
    EVALUATOR("Evaluator"),
    FACILITY("Facility"),
    EXAM_REQUEST("ExamRequest"),
    EVALUATION("Evaluation"),
    APPOINTMENT("Appointment");

    private final String label;

    EntityType(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    /**
     * Parses an entity type name, ignoring case and surrounding whitespace.
     *
     * @throws IllegalArgumentException if the name is blank or unknown
     */
    public static EntityType fromName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Entity type is required");
        }
        return EntityType.valueOf(name.trim().toUpperCase(Locale.ROOT));
    }
}
