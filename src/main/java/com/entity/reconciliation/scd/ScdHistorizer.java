package com.entity.reconciliation.scd;

import com.entity.reconciliation.core.model.EntityType;
import com.entity.reconciliation.core.model.MergedRecord;
import com.entity.reconciliation.error.IntegrityViolationException;
import com.entity.reconciliation.error.ReconciliationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Applies SCD type-2 history for merged dimension records.
 *
 * <p>Per master id: with no current version a first version opens; with a current version
 * whose fingerprint matches nothing changes; otherwise the current version closes at the
 * processing time and a new one opens at the same instant. If the processing time precedes
 * the current version's start, the current start is used so history stays contiguous.
 * Each master id's transition is applied atomically; distinct master ids are processed
 * in parallel.</p>
 *
 * <p>The whole batch is checked before any transition is applied: a master id with more
 * than one current version fails the batch with nothing written.</p>
 */
public class ScdHistorizer implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ScdHistorizer.class);

    private final DimensionRepository repository;
    private final ExecutorService executor;

    public ScdHistorizer(DimensionRepository repository, int parallelism) {
        this.repository = Objects.requireNonNull(repository, "repository is required");
        if (parallelism < 1) {
            throw new IllegalArgumentException("parallelism must be at least 1");
        }
        AtomicInteger threadCount = new AtomicInteger();
        this.executor = Executors.newFixedThreadPool(parallelism, runnable -> {
            Thread thread = new Thread(runnable, "scd-historizer-" + threadCount.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Historizes all records of a batch.
     *
     * @throws IntegrityViolationException if a master id has more than one current version;
     *                                     no master id of the batch is applied in that case
     */
    public HistorizationResult historize(EntityType entityType, String batchId,
                                         List<MergedRecord> records, Instant processingTime) {
        Objects.requireNonNull(processingTime, "processingTime is required");
        verifyBatch(entityType, batchId, records);

        List<CompletableFuture<ScdTransition>> futures = new ArrayList<>(records.size());
        for (MergedRecord record : records) {
            futures.add(CompletableFuture.supplyAsync(
                    () -> historizeOne(record, batchId, processingTime), executor));
        }

        try {
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof ReconciliationException re) {
                throw re;
            }
            if (cause instanceof RuntimeException rte) {
                throw rte;
            }
            throw e;
        }

        Map<ScdTransition, Integer> counts = new EnumMap<>(ScdTransition.class);
        for (CompletableFuture<ScdTransition> future : futures) {
            counts.merge(future.join(), 1, Integer::sum);
        }
        HistorizationResult result = new HistorizationResult(
                counts.getOrDefault(ScdTransition.OPENED, 0),
                counts.getOrDefault(ScdTransition.VERSIONED, 0),
                counts.getOrDefault(ScdTransition.UNCHANGED, 0));
        log.info("scd.completed entityType={} batchId={} opened={} versioned={} unchanged={}",
                entityType, batchId, result.opened(), result.versioned(), result.unchanged());
        return result;
    }

    private void verifyBatch(EntityType entityType, String batchId, List<MergedRecord> records) {
        for (MergedRecord record : records) {
            if (record.entityType() != entityType) {
                throw new IllegalArgumentException("Record " + record.masterId() + " is " + record.entityType()
                        + ", expected " + entityType);
            }
        }
        for (MergedRecord record : records) {
            long current = repository.findHistory(entityType, record.masterId()).stream()
                    .filter(DimensionVersion::current)
                    .count();
            if (current > 1) {
                log.error("scd.integrityViolation entityType={} batchId={} masterId={} currentVersions={}",
                        entityType, batchId, record.masterId(), current);
                throw new IntegrityViolationException(entityType, batchId, record.masterId(),
                        "Master id " + record.masterId() + " has " + current + " current versions");
            }
        }
    }

    /**
     * Applies one record's transition and reports what it did.
     */
    ScdTransition historizeOne(MergedRecord record, String batchId, Instant processingTime) {
        AtomicReference<ScdTransition> outcome = new AtomicReference<>();
        repository.applyVersion(record.entityType(), record.masterId(), history -> {
            List<DimensionVersion> current = history.stream().filter(DimensionVersion::current).toList();
            if (current.size() > 1) {
                throw new IntegrityViolationException(record.entityType(), batchId, record.masterId(),
                        "Master id " + record.masterId() + " has " + current.size() + " current versions");
            }
            int nextVersion = history.stream().mapToInt(DimensionVersion::versionNumber).max().orElse(0) + 1;

            if (current.isEmpty()) {
                Instant start = processingTime;
                if (!history.isEmpty()) {
                    Instant lastEnd = history.get(history.size() - 1).effectiveEnd();
                    start = processingTime.isBefore(lastEnd) ? lastEnd : processingTime;
                }
                outcome.set(ScdTransition.OPENED);
                List<DimensionVersion> updated = new ArrayList<>(history);
                updated.add(DimensionVersion.open(record.entityType(), record.masterId(), nextVersion,
                        record.attributes(), record.fingerprint(), batchId, start));
                return updated;
            }

            DimensionVersion open = current.get(0);
            if (open.fingerprint().equals(record.fingerprint())) {
                outcome.set(ScdTransition.UNCHANGED);
                return history;
            }

            Instant start = processingTime.isBefore(open.effectiveStart()) ? open.effectiveStart() : processingTime;
            List<DimensionVersion> updated = new ArrayList<>(history.size() + 1);
            for (DimensionVersion version : history) {
                updated.add(version == open ? version.closeAt(start) : version);
            }
            updated.add(DimensionVersion.open(record.entityType(), record.masterId(), nextVersion,
                    record.attributes(), record.fingerprint(), batchId, start));
            outcome.set(ScdTransition.VERSIONED);
            return updated;
        });
        log.debug("scd.applied masterId={} transition={}", record.masterId(), outcome.get());
        return outcome.get();
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
