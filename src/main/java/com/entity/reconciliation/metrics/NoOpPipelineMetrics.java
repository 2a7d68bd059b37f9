package com.entity.reconciliation.metrics;

import com.entity.reconciliation.core.model.EntityType;
import com.entity.reconciliation.core.model.MatchMethod;
import com.entity.reconciliation.pipeline.BatchStatus;
import com.entity.reconciliation.scd.ScdTransition;

import java.time.Duration;

/**
 * Metrics implementation that records nothing.
 */
public class NoOpPipelineMetrics implements PipelineMetrics {

    @Override
    public void recordBatchDuration(EntityType type, BatchStatus status, Duration duration) {
    }

    @Override
    public void recordCrosswalkEntries(EntityType type, MatchMethod method, long count) {
    }

    @Override
    public void recordOrphans(EntityType type, long count) {
    }

    @Override
    public void recordConflicts(EntityType type, long count) {
    }

    @Override
    public void recordQualityScore(EntityType type, int score) {
    }

    @Override
    public void recordTransitions(EntityType type, ScdTransition transition, long count) {
    }
}
