package com.entity.reconciliation.audit;

import com.entity.reconciliation.core.model.EntityType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * In-memory implementation of ConflictLogRepository.
 * Thread-safe via CopyOnWriteArrayList; duplicate keys are rejected atomically.
 */
public class InMemoryConflictLogRepository implements ConflictLogRepository {

    private final List<ConflictLogEntry> entries = new CopyOnWriteArrayList<>();
    private final Set<ConflictLogEntry.ConflictKey> keys = ConcurrentHashMap.newKeySet();

    @Override
    public boolean appendIfAbsent(ConflictLogEntry entry) {
        if (!keys.add(entry.key())) {
            return false;
        }
        entries.add(entry);
        return true;
    }

    @Override
    public List<ConflictLogEntry> findAll() {
        return Collections.unmodifiableList(new ArrayList<>(entries));
    }

    @Override
    public List<ConflictLogEntry> findByEntityId(EntityType entityType, String entityId) {
        return entries.stream()
                .filter(e -> e.entityType() == entityType && entityId.equals(e.entityId()))
                .collect(Collectors.toList());
    }

    @Override
    public List<ConflictLogEntry> findByBatch(EntityType entityType, String batchId) {
        return entries.stream()
                .filter(e -> e.entityType() == entityType && batchId.equals(e.batchId()))
                .collect(Collectors.toList());
    }

    @Override
    public List<ConflictLogEntry> findByField(EntityType entityType, String fieldName) {
        return entries.stream()
                .filter(e -> e.entityType() == entityType && fieldName.equals(e.fieldName()))
                .collect(Collectors.toList());
    }

    @Override
    public int count() {
        return entries.size();
    }
}
