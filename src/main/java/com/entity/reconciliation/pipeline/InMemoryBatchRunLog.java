package com.entity.reconciliation.pipeline;

import com.entity.reconciliation.core.model.EntityType;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory implementation of BatchRunLog.
 * Runs are ordered by when they were first saved, so runs started within the
 * same clock tick still have a well-defined latest.
 */
public class InMemoryBatchRunLog implements BatchRunLog {

    private record Slot(long sequence, BatchRun run) {}

    private final Map<String, Slot> runs = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();

    @Override
    public void save(BatchRun run) {
        runs.compute(run.runId(), (id, existing) ->
                new Slot(existing != null ? existing.sequence() : sequence.incrementAndGet(), run));
    }

    @Override
    public Optional<BatchRun> findLatest(EntityType entityType, String batchId) {
        return runs.values().stream()
                .filter(s -> s.run().entityType() == entityType && s.run().batchId().equals(batchId))
                .max(Comparator.comparingLong(Slot::sequence))
                .map(Slot::run);
    }

    @Override
    public Optional<BatchRun> findFirst(EntityType entityType, String batchId) {
        return runs.values().stream()
                .filter(s -> s.run().entityType() == entityType && s.run().batchId().equals(batchId))
                .min(Comparator.comparingLong(Slot::sequence))
                .map(Slot::run);
    }

    @Override
    public List<BatchRun> findAll(EntityType entityType) {
        return runs.values().stream()
                .filter(s -> s.run().entityType() == entityType)
                .sorted(Comparator.comparingLong(Slot::sequence))
                .map(Slot::run)
                .toList();
    }
}
