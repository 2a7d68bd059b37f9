package com.entity.reconciliation.tracing;

/**
 * One traced pipeline stage. Closing the span ends it.
 *
 * <pre>
 * try (Span span = tracer.startStage("merge", entityType, batchId)) {
 *     span.setAttribute("records", merged.size());
 * }
 * </pre>
 */
public interface Span extends AutoCloseable {

    void setAttribute(String key, String value);

    void setAttribute(String key, long value);

    /**
     * Marks the stage failed and records the exception.
     */
    void fail(Throwable t);

    @Override
    void close();
}
