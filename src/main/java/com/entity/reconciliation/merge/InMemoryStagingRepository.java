package com.entity.reconciliation.merge;

import com.entity.reconciliation.core.model.EntityType;
import com.entity.reconciliation.core.model.MergedRecord;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of StagingRepository.
 */
public class InMemoryStagingRepository implements StagingRepository {

    private record Key(EntityType entityType, String batchId) {}

    private final Map<Key, List<MergedRecord>> batches = new ConcurrentHashMap<>();

    @Override
    public void replaceBatch(EntityType entityType, String batchId, List<MergedRecord> records) {
        batches.put(new Key(entityType, batchId), List.copyOf(records));
    }

    @Override
    public Optional<List<MergedRecord>> findBatch(EntityType entityType, String batchId) {
        return Optional.ofNullable(batches.get(new Key(entityType, batchId)));
    }

    @Override
    public void deleteBatch(EntityType entityType, String batchId) {
        batches.remove(new Key(entityType, batchId));
    }
}
