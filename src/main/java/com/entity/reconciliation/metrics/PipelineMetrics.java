package com.entity.reconciliation.metrics;

import com.entity.reconciliation.core.model.EntityType;
import com.entity.reconciliation.core.model.MatchMethod;
import com.entity.reconciliation.pipeline.BatchStatus;
import com.entity.reconciliation.scd.ScdTransition;

import java.time.Duration;

/**
 * Metrics sink for pipeline runs.
 * The default {@link NoOpPipelineMetrics} records nothing, so the pipeline runs
 * without a metrics backend on the classpath.
 */
public interface PipelineMetrics {

    void recordBatchDuration(EntityType type, BatchStatus status, Duration duration);

    void recordCrosswalkEntries(EntityType type, MatchMethod method, long count);

    void recordOrphans(EntityType type, long count);

    void recordConflicts(EntityType type, long count);

    void recordQualityScore(EntityType type, int score);

    void recordTransitions(EntityType type, ScdTransition transition, long count);
}
