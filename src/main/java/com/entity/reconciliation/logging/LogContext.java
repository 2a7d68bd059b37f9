package com.entity.reconciliation.logging;

import com.entity.reconciliation.core.model.EntityType;
import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * AutoCloseable MDC (Mapped Diagnostic Context) wrapper for structured logging.
 * Adds key-value pairs to SLF4J MDC and removes them on close.
 *
 * <pre>
 * try (LogContext ctx = LogContext.forBatch(EntityType.VETERAN, "BATCH_001")) {
 *     log.info("batch.started runId={}", runId);
 * }
 * </pre>
 */
public class LogContext implements AutoCloseable {

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    /**
     * Creates a log context for one {@code processBatch} run.
     */
    public static LogContext forBatch(EntityType entityType, String batchId) {
        LogContext ctx = new LogContext();
        ctx.put("entityType", entityType != null ? entityType.name() : "UNKNOWN");
        ctx.put("batchId", batchId);
        ctx.put("operation", "processBatch");
        return ctx;
    }

    /**
     * Creates a log context for a single pipeline stage within a run.
     */
    public static LogContext forStage(String stage) {
        LogContext ctx = new LogContext();
        ctx.put("stage", stage);
        return ctx;
    }

    public static String generateRunId() {
        return UUID.randomUUID().toString();
    }

    /**
     * Adds an additional key-value pair to this log context.
     */
    public LogContext with(String key, String value) {
        put(key, value);
        return this;
    }

    private void put(String key, String value) {
        keys.add(key);
        MDC.put(key, value);
    }

    @Override
    public void close() {
        for (String key : keys) {
            MDC.remove(key);
        }
        keys.clear();
    }
}
