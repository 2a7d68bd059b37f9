package com.entity.reconciliation.crosswalk;

import com.entity.reconciliation.core.hash.Fingerprints;
import com.entity.reconciliation.core.model.SourceRecord;

import java.util.Collection;
import java.util.Comparator;
import java.util.Optional;

/**
 * Total order used to pick the surviving record among duplicates from one source.
 * Later ingestion wins; ties fall to the greater source record id, then to the greater
 * attribute digest, so the survivor never depends on input order.
 */
public final class SourceRecordOrdering {

    public static final Comparator<SourceRecord> MOST_RECENT = Comparator
            .comparing(SourceRecord::ingestionTime)
            .thenComparing(SourceRecord::sourceRecordId, Comparator.nullsFirst(Comparator.naturalOrder()))
            .thenComparing(r -> Fingerprints.attributeDigest(r.attributes()));

    private SourceRecordOrdering() {
    }

    public static Optional<SourceRecord> latest(Collection<SourceRecord> records) {
        return records.stream().max(MOST_RECENT);
    }
}
