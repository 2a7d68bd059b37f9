package com.entity.reconciliation.core.model;

/**
 * How a crosswalk entry's natural key was observed across the two sources.
 */
public enum MatchMethod {
    /**
     * Key present in both sources.
     */
    BOTH_EXACT(100),

    /**
     * Key present only in source A.
     */
    SOURCE_A_ONLY(90),

    /**
     * Key present only in source B.
     */
    SOURCE_B_ONLY(90);

    private final int confidence;

    MatchMethod(int confidence) {
        this.confidence = confidence;
    }

    public int confidence() {
        return confidence;
    }

    /**
     * Determines the method from which sources contributed the key.
     *
     * @throws IllegalArgumentException if neither source contributed
     */
    public static MatchMethod forPresence(boolean inSourceA, boolean inSourceB) {
        if (inSourceA && inSourceB) {
            return BOTH_EXACT;
        }
        if (inSourceA) {
            return SOURCE_A_ONLY;
        }
        if (inSourceB) {
            return SOURCE_B_ONLY;
        }
        throw new IllegalArgumentException("A match requires at least one contributing source");
    }
}
