package com.entity.reconciliation.logging;

import com.entity.reconciliation.core.model.EntityType;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.util.HashSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("LogContext Tests")
class LogContextTest {

    @AfterEach
    void cleanupMDC() {
        MDC.clear();
    }

    @Test
    @DisplayName("forBatch should set entityType, batchId and operation in MDC")
    void forBatchSetsMDC() {
        try (LogContext ctx = LogContext.forBatch(EntityType.VETERAN, "BATCH_001")) {
            assertEquals("VETERAN", MDC.get("entityType"));
            assertEquals("BATCH_001", MDC.get("batchId"));
            assertEquals("processBatch", MDC.get("operation"));
        }
    }

    @Test
    @DisplayName("forBatch should tolerate a missing entity type")
    void forBatchWithoutType() {
        try (LogContext ctx = LogContext.forBatch(null, "BATCH_001")) {
            assertEquals("UNKNOWN", MDC.get("entityType"));
        }
    }

    @Test
    @DisplayName("forStage should set the stage in MDC")
    void forStageSetsMDC() {
        try (LogContext ctx = LogContext.forStage("merge")) {
            assertEquals("merge", MDC.get("stage"));
        }
        assertNull(MDC.get("stage"));
    }

    @Test
    @DisplayName("close should remove all keys from MDC")
    void closeRemovesKeys() {
        LogContext ctx = LogContext.forBatch(EntityType.FACILITY, "BATCH_002");
        ctx.with("runId", "run-1");
        assertEquals("run-1", MDC.get("runId"));

        ctx.close();

        assertNull(MDC.get("entityType"));
        assertNull(MDC.get("batchId"));
        assertNull(MDC.get("operation"));
        assertNull(MDC.get("runId"));
    }

    @Test
    @DisplayName("Nested stage context leaves the batch context intact")
    void nestedContexts() {
        try (LogContext batch = LogContext.forBatch(EntityType.VETERAN, "BATCH_001")) {
            try (LogContext stage = LogContext.forStage("crosswalk")) {
                assertEquals("crosswalk", MDC.get("stage"));
                assertEquals("BATCH_001", MDC.get("batchId"));
            }
            assertNull(MDC.get("stage"));
            assertEquals("BATCH_001", MDC.get("batchId"));
        }
    }

    @Test
    @DisplayName("generateRunId should produce unique values")
    void generateRunIdUnique() {
        Set<String> ids = new HashSet<>();
        for (int i = 0; i < 100; i++) {
            assertTrue(ids.add(LogContext.generateRunId()));
        }
    }
}
