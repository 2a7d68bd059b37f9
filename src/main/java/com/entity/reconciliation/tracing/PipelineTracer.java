package com.entity.reconciliation.tracing;

import com.entity.reconciliation.core.model.EntityType;

/**
 * Tracing integration for pipeline stages.
 * The default {@link NoOpPipelineTracer} does nothing, so the pipeline runs
 * without any tracing dependencies on the classpath.
 */
public interface PipelineTracer {

    Span startStage(String stage, EntityType entityType, String batchId);
}
