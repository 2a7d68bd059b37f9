package com.entity.reconciliation.crosswalk;

import com.entity.reconciliation.config.PipelineConfig;
import com.entity.reconciliation.core.model.CrosswalkEntry;
import com.entity.reconciliation.core.model.EntityType;
import com.entity.reconciliation.core.model.MatchMethod;
import com.entity.reconciliation.core.model.SourceRecord;
import com.entity.reconciliation.core.model.SourceSide;
import com.entity.reconciliation.error.InvalidInputException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeSet;

/**
 * Builds the crosswalk for one entity type and batch.
 *
 * <p>Records outside the rolling window are ignored. Records with a blank natural key
 * are reported as orphans. Within each source, duplicates of the same key collapse to
 * the most recent record (see {@link SourceRecordOrdering}). Keys are then matched
 * exactly across sources:</p>
 * <ul>
 *   <li>present in both: {@link MatchMethod#BOTH_EXACT}, confidence 100</li>
 *   <li>present in one: {@code SOURCE_A_ONLY} / {@code SOURCE_B_ONLY}, confidence 90</li>
 * </ul>
 * The master id is the trimmed natural key. Output is sorted by master id.
 */
public class CrosswalkBuilder {
    private static final Logger log = LoggerFactory.getLogger(CrosswalkBuilder.class);

    private final PipelineConfig config;

    public CrosswalkBuilder(PipelineConfig config) {
        this.config = Objects.requireNonNull(config, "config is required");
    }

    /**
     * @param processingTime the instant the rolling window is measured back from
     * @throws InvalidInputException if the batch id is blank; nothing is built in that case
     */
    public CrosswalkResult build(EntityType entityType, String batchId, SourceSide primarySource,
                                 Collection<SourceRecord> sourceA, Collection<SourceRecord> sourceB,
                                 Instant processingTime) {
        Objects.requireNonNull(entityType, "entityType is required");
        if (batchId == null || batchId.isBlank()) {
            throw new InvalidInputException(entityType, batchId, "Batch id is required and cannot be empty");
        }
        Objects.requireNonNull(primarySource, "primarySource is required");
        Objects.requireNonNull(processingTime, "processingTime is required");

        Instant windowStart = processingTime.minus(config.getRollingWindow());
        List<OrphanRecord> orphans = new ArrayList<>();
        int[] outsideWindow = {0};

        Map<String, SourceRecord> latestA = collapse(entityType, SourceSide.A, sourceA, windowStart, orphans, outsideWindow);
        Map<String, SourceRecord> latestB = collapse(entityType, SourceSide.B, sourceB, windowStart, orphans, outsideWindow);

        TreeSet<String> keys = new TreeSet<>(latestA.keySet());
        keys.addAll(latestB.keySet());

        List<CrosswalkEntry> entries = new ArrayList<>(keys.size());
        for (String key : keys) {
            SourceRecord a = latestA.get(key);
            SourceRecord b = latestB.get(key);
            MatchMethod method = MatchMethod.forPresence(a != null, b != null);
            entries.add(new CrosswalkEntry(
                    entityType,
                    batchId,
                    key,
                    a != null ? a.sourceRecordId() : null,
                    b != null ? b.sourceRecordId() : null,
                    method.confidence(),
                    method,
                    primarySource));
        }

        int recordsRead = sourceA.size() + sourceB.size();
        if (!orphans.isEmpty()) {
            log.warn("crosswalk.orphans entityType={} batchId={} count={}", entityType, batchId, orphans.size());
        }
        log.info("crosswalk.built entityType={} batchId={} recordsRead={} entries={} outsideWindow={}",
                entityType, batchId, recordsRead, entries.size(), outsideWindow[0]);
        orphans.sort(Comparator.comparing((OrphanRecord o) -> o.record().side())
                .thenComparing(o -> String.valueOf(o.record().sourceRecordId())));
        return new CrosswalkResult(entries, orphans, recordsRead, outsideWindow[0]);
    }

    private Map<String, SourceRecord> collapse(EntityType entityType, SourceSide side,
                                               Collection<SourceRecord> records, Instant windowStart,
                                               List<OrphanRecord> orphans, int[] outsideWindow) {
        Map<String, SourceRecord> latest = new HashMap<>();
        for (SourceRecord record : records) {
            if (record.entityType() != entityType || record.side() != side) {
                throw new IllegalArgumentException("Record " + record.sourceRecordId() + " is "
                        + record.entityType() + "/" + record.side() + ", expected " + entityType + "/" + side);
            }
            if (record.ingestionTime().isBefore(windowStart)) {
                outsideWindow[0]++;
                continue;
            }
            String key = record.trimmedKey();
            if (key == null) {
                orphans.add(new OrphanRecord(record, OrphanRecord.MISSING_NATURAL_KEY));
                continue;
            }
            latest.merge(key, record, (current, candidate) ->
                    SourceRecordOrdering.MOST_RECENT.compare(candidate, current) > 0 ? candidate : current);
        }
        return latest;
    }
}
