package com.entity.reconciliation.pipeline;

/**
 * Row counts collected by one run. For a failed run they describe what was attempted
 * before the failure, not what was committed.
 *
 * @param recordsRead      source records received from both sides
 * @param crosswalkEntries crosswalk entries written (one per master id)
 * @param orphans          records excluded for a missing natural key
 * @param conflicts        conflict log entries appended
 * @param versionsOpened   dimension versions opened for new master ids
 * @param versionsChanged  master ids whose current version was replaced
 * @param versionsUnchanged master ids whose fingerprint did not change
 */
public record BatchStatistics(
        int recordsRead,
        int crosswalkEntries,
        int orphans,
        int conflicts,
        int versionsOpened,
        int versionsChanged,
        int versionsUnchanged
) {
    private static final BatchStatistics EMPTY = new BatchStatistics(0, 0, 0, 0, 0, 0, 0);

    public static BatchStatistics empty() {
        return EMPTY;
    }

    /**
     * Rows the run produced: one merged record per crosswalk entry.
     */
    public int rowCount() {
        return crosswalkEntries;
    }
}
