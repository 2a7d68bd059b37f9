package com.entity.reconciliation.audit;

import com.entity.reconciliation.core.model.EntityType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Persists conflicts found by the merge stage.
 * Re-logging a batch appends nothing new: entries already recorded for the same
 * entity type, batch, entity and field are skipped.
 */
public class ConflictLogger {
    private static final Logger log = LoggerFactory.getLogger(ConflictLogger.class);

    private final ConflictLogRepository repository;

    public ConflictLogger(ConflictLogRepository repository) {
        this.repository = Objects.requireNonNull(repository, "repository is required");
    }

    /**
     * Appends the conflicts that are not yet recorded.
     *
     * @return the number of entries appended
     */
    public int log(List<ConflictLogEntry> conflicts) {
        int appended = 0;
        for (ConflictLogEntry conflict : conflicts) {
            if (repository.appendIfAbsent(conflict)) {
                appended++;
                log.debug("conflict.logged entityType={} entityId={} field={} rule={}",
                        conflict.entityType(), conflict.entityId(), conflict.fieldName(), conflict.resolutionRule());
            }
        }
        if (appended < conflicts.size()) {
            log.info("conflict.duplicatesSkipped count={}", conflicts.size() - appended);
        }
        return appended;
    }

    public List<ConflictLogEntry> getHistory(EntityType entityType, String entityId) {
        return repository.findByEntityId(entityType, entityId);
    }

    public List<ConflictLogEntry> getBatchConflicts(EntityType entityType, String batchId) {
        return repository.findByBatch(entityType, batchId);
    }

    public List<ConflictLogEntry> getFieldConflicts(EntityType entityType, String fieldName) {
        return repository.findByField(entityType, fieldName);
    }
}
