package com.entity.reconciliation.pipeline;

import com.entity.reconciliation.core.model.EntityType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("InMemoryBatchRunLog Tests")
class InMemoryBatchRunLogTest {

    private static final Instant NOW = Instant.parse("2024-01-05T12:00:00Z");

    @Test
    @DisplayName("Latest run is the most recently started, even within one clock tick")
    void latestRun() {
        InMemoryBatchRunLog runLog = new InMemoryBatchRunLog();
        BatchRun first = BatchRun.started("run-1", EntityType.VETERAN, "B1", NOW);
        BatchRun second = BatchRun.started("run-2", EntityType.VETERAN, "B1", NOW);
        runLog.save(first);
        runLog.save(second);
        runLog.save(first.succeeded(NOW, BatchStatistics.empty()));

        BatchRun latest = runLog.findLatest(EntityType.VETERAN, "B1").orElseThrow();
        assertEquals("run-2", latest.runId());
        assertEquals(2, runLog.findAll(EntityType.VETERAN).size());
        assertEquals(BatchStatus.SUCCEEDED, runLog.findAll(EntityType.VETERAN).get(0).status());
    }

    @Test
    @DisplayName("Only a succeeded latest run is consumable")
    void consumable() {
        InMemoryBatchRunLog runLog = new InMemoryBatchRunLog();
        assertFalse(runLog.isConsumable(EntityType.VETERAN, "B1"));

        BatchRun run = BatchRun.started("run-1", EntityType.VETERAN, "B1", NOW);
        runLog.save(run);
        assertFalse(runLog.isConsumable(EntityType.VETERAN, "B1"));

        runLog.save(run.succeeded(NOW, BatchStatistics.empty()));
        assertTrue(runLog.isConsumable(EntityType.VETERAN, "B1"));
        assertFalse(runLog.isConsumable(EntityType.VETERAN, "B2"));

        BatchRun rerun = BatchRun.started("run-2", EntityType.VETERAN, "B1", NOW);
        runLog.save(rerun.failed(NOW, "boom"));
        assertFalse(runLog.isConsumable(EntityType.VETERAN, "B1"));
    }

    @Test
    @DisplayName("Failed results require an error")
    void failedResultNeedsError() {
        assertThrows(IllegalArgumentException.class, () ->
                new BatchResult(EntityType.VETERAN, "B1", "run-1", BatchStatus.FAILED, null, null));
        BatchResult ok = BatchResult.succeeded(EntityType.VETERAN, "B1", "run-1", null);
        assertTrue(ok.isSuccess());
        assertEquals(0, ok.rowCount());
    }
}
