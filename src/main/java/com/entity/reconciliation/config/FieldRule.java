package com.entity.reconciliation.config;

/**
 * How a field's value is chosen when both sources supply one.
 */
public enum FieldRule {
    /**
     * Take the primary source's value, falling back to the other source when it is null.
     */
    PREFER_PRIMARY("prefer configured primary source"),

    /**
     * Take the value from the most recently ingested source, falling back when it is null.
     * Equal ingestion times defer to the primary source.
     */
    MOST_RECENT("prefer most recently ingested source");

    private final String description;

    FieldRule(String description) {
        this.description = description;
    }

    public String description() {
        return description;
    }
}
