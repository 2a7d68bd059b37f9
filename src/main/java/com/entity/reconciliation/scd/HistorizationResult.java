package com.entity.reconciliation.scd;

/**
 * Counts of SCD transitions applied for one batch.
 */
public record HistorizationResult(int opened, int versioned, int unchanged) {

    private static final HistorizationResult SKIPPED = new HistorizationResult(0, 0, 0);

    /**
     * Result for entity types that are not historized.
     */
    public static HistorizationResult skipped() {
        return SKIPPED;
    }

    /**
     * Versions inserted: one per new entity plus one per changed entity.
     */
    public int inserted() {
        return opened + versioned;
    }

    /**
     * Versions closed, one per changed entity.
     */
    public int closed() {
        return versioned;
    }

    public int total() {
        return opened + versioned + unchanged;
    }
}
