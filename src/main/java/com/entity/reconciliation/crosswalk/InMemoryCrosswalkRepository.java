package com.entity.reconciliation.crosswalk;

import com.entity.reconciliation.core.model.CrosswalkEntry;
import com.entity.reconciliation.core.model.EntityType;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of CrosswalkRepository.
 * Each batch snapshot is an immutable list swapped atomically.
 */
public class InMemoryCrosswalkRepository implements CrosswalkRepository {

    private record Key(EntityType entityType, String batchId) {}

    private final Map<Key, List<CrosswalkEntry>> batches = new ConcurrentHashMap<>();

    @Override
    public void replaceBatch(EntityType entityType, String batchId, List<CrosswalkEntry> entries) {
        batches.put(new Key(entityType, batchId), List.copyOf(entries));
    }

    @Override
    public Optional<List<CrosswalkEntry>> findBatch(EntityType entityType, String batchId) {
        return Optional.ofNullable(batches.get(new Key(entityType, batchId)));
    }

    @Override
    public void deleteBatch(EntityType entityType, String batchId) {
        batches.remove(new Key(entityType, batchId));
    }
}
