package com.entity.reconciliation.crosswalk;

import com.entity.reconciliation.core.model.CrosswalkEntry;
import com.entity.reconciliation.core.model.MatchMethod;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Output of the crosswalk stage.
 *
 * @param entries          one entry per distinct natural key, sorted by master id
 * @param orphans          records with no usable natural key
 * @param recordsRead      records received from both sources
 * @param outsideWindow    records dropped by the rolling window
 */
public record CrosswalkResult(
        List<CrosswalkEntry> entries,
        List<OrphanRecord> orphans,
        int recordsRead,
        int outsideWindow
) {
    public CrosswalkResult {
        entries = entries != null ? List.copyOf(entries) : List.of();
        orphans = orphans != null ? List.copyOf(orphans) : List.of();
    }

    public Map<MatchMethod, Long> countsByMethod() {
        Map<MatchMethod, Long> counts = new EnumMap<>(MatchMethod.class);
        for (CrosswalkEntry entry : entries) {
            counts.merge(entry.matchMethod(), 1L, Long::sum);
        }
        return counts;
    }
}
