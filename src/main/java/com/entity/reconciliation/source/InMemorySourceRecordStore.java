package com.entity.reconciliation.source;

import com.entity.reconciliation.core.model.EntityType;
import com.entity.reconciliation.core.model.SourceRecord;
import com.entity.reconciliation.core.model.SourceSide;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory staging area for raw source records, keyed by entity type, side and batch.
 * Suitable for tests and for feeding records parsed by {@link JsonLinesSourceReader}.
 */
public class InMemorySourceRecordStore implements SourceRecordProvider {

    private record Key(EntityType entityType, SourceSide side, String batchId) {}

    private final Map<Key, List<SourceRecord>> records = new ConcurrentHashMap<>();

    public void add(SourceRecord record) {
        Objects.requireNonNull(record, "record is required");
        records.computeIfAbsent(new Key(record.entityType(), record.side(), record.batchId()),
                k -> new CopyOnWriteArrayList<>()).add(record);
    }

    public void addAll(Collection<SourceRecord> batch) {
        batch.forEach(this::add);
    }

    @Override
    public List<SourceRecord> fetch(EntityType entityType, SourceSide side, String batchId) {
        List<SourceRecord> found = records.get(new Key(entityType, side, batchId));
        return found != null ? List.copyOf(found) : List.of();
    }

    /**
     * Removes everything staged for a batch on one side.
     */
    public void clear(EntityType entityType, SourceSide side, String batchId) {
        records.remove(new Key(entityType, side, batchId));
    }

    public int size() {
        return records.values().stream().mapToInt(List::size).sum();
    }
}
