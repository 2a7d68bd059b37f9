package com.entity.reconciliation.scd;

import com.entity.reconciliation.core.model.EntityType;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;

/**
 * In-memory implementation of DimensionRepository.
 * Each master id's history is an immutable list replaced inside {@link ConcurrentHashMap#compute},
 * which serializes writers per key and publishes the new list in one step.
 */
public class InMemoryDimensionRepository implements DimensionRepository {

    private record Key(EntityType entityType, String masterId) {}

    private final Map<Key, List<DimensionVersion>> histories = new ConcurrentHashMap<>();

    @Override
    public List<DimensionVersion> applyVersion(EntityType entityType, String masterId,
                                               UnaryOperator<List<DimensionVersion>> transition) {
        return histories.compute(new Key(entityType, masterId), (key, existing) -> {
            List<DimensionVersion> history = existing != null ? existing : List.of();
            List<DimensionVersion> updated = transition.apply(history);
            return updated == null || updated.isEmpty() ? null : List.copyOf(updated);
        });
    }

    @Override
    public List<DimensionVersion> findHistory(EntityType entityType, String masterId) {
        List<DimensionVersion> history = histories.get(new Key(entityType, masterId));
        return history != null ? history : List.of();
    }

    @Override
    public Optional<DimensionVersion> findCurrent(EntityType entityType, String masterId) {
        return findHistory(entityType, masterId).stream()
                .filter(DimensionVersion::current)
                .findFirst();
    }

    @Override
    public List<DimensionVersion> findAllCurrent(EntityType entityType) {
        return histories.entrySet().stream()
                .filter(e -> e.getKey().entityType() == entityType)
                .flatMap(e -> e.getValue().stream())
                .filter(DimensionVersion::current)
                .sorted(Comparator.comparing(DimensionVersion::masterId))
                .toList();
    }

    @Override
    public int countVersions(EntityType entityType) {
        return histories.entrySet().stream()
                .filter(e -> e.getKey().entityType() == entityType)
                .mapToInt(e -> e.getValue().size())
                .sum();
    }

    /**
     * Replaces a history without any checks. Used to load existing warehouse state.
     */
    public void load(EntityType entityType, String masterId, List<DimensionVersion> history) {
        histories.put(new Key(entityType, masterId), List.copyOf(history));
    }
}
