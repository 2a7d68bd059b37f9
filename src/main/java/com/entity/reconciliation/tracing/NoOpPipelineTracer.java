package com.entity.reconciliation.tracing;

import com.entity.reconciliation.core.model.EntityType;

/**
 * Tracer that creates spans doing nothing.
 */
public class NoOpPipelineTracer implements PipelineTracer {

    private static final Span NOOP_SPAN = new Span() {
        @Override
        public void setAttribute(String key, String value) {
        }

        @Override
        public void setAttribute(String key, long value) {
        }

        @Override
        public void fail(Throwable t) {
        }

        @Override
        public void close() {
        }
    };

    @Override
    public Span startStage(String stage, EntityType entityType, String batchId) {
        return NOOP_SPAN;
    }
}
