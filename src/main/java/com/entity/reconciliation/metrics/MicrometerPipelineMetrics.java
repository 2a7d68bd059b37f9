package com.entity.reconciliation.metrics;

import com.entity.reconciliation.core.model.EntityType;
import com.entity.reconciliation.core.model.MatchMethod;
import com.entity.reconciliation.pipeline.BatchStatus;
import com.entity.reconciliation.scd.ScdTransition;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link PipelineMetrics}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code reconciliation.batch.duration}: Timer (tags: entityType, status)</li>
 *   <li>{@code reconciliation.crosswalk.entries}: Counter (tags: entityType, method)</li>
 *   <li>{@code reconciliation.orphans}: Counter (tag: entityType)</li>
 *   <li>{@code reconciliation.conflicts}: Counter (tag: entityType)</li>
 *   <li>{@code reconciliation.dq.score}: DistributionSummary (tag: entityType)</li>
 *   <li>{@code reconciliation.scd.transitions}: Counter (tags: entityType, transition)</li>
 * </ul>
 */
public class MicrometerPipelineMetrics implements PipelineMetrics {

    private final MeterRegistry registry;
    private final Map<String, Timer> timerCache = new ConcurrentHashMap<>();
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final Map<String, DistributionSummary> summaryCache = new ConcurrentHashMap<>();

    public MicrometerPipelineMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void recordBatchDuration(EntityType type, BatchStatus status, Duration duration) {
        String key = type.name() + ":" + status.name();
        Timer timer = timerCache.computeIfAbsent(key, k ->
                Timer.builder("reconciliation.batch.duration")
                        .description("Duration of processBatch runs")
                        .tag("entityType", type.name())
                        .tag("status", status.name())
                        .register(registry));
        timer.record(duration);
    }

    @Override
    public void recordCrosswalkEntries(EntityType type, MatchMethod method, long count) {
        String key = "crosswalk:" + type.name() + ":" + method.name();
        Counter counter = counterCache.computeIfAbsent(key, k ->
                Counter.builder("reconciliation.crosswalk.entries")
                        .description("Crosswalk entries built, by match method")
                        .tag("entityType", type.name())
                        .tag("method", method.name())
                        .register(registry));
        counter.increment(count);
    }

    @Override
    public void recordOrphans(EntityType type, long count) {
        counter("reconciliation.orphans", "Source records without a natural key", type).increment(count);
    }

    @Override
    public void recordConflicts(EntityType type, long count) {
        counter("reconciliation.conflicts", "Field conflicts between sources", type).increment(count);
    }

    @Override
    public void recordQualityScore(EntityType type, int score) {
        DistributionSummary summary = summaryCache.computeIfAbsent(type.name(), k ->
                DistributionSummary.builder("reconciliation.dq.score")
                        .description("Data quality score of merged records")
                        .tag("entityType", type.name())
                        .register(registry));
        summary.record(score);
    }

    @Override
    public void recordTransitions(EntityType type, ScdTransition transition, long count) {
        String key = "scd:" + type.name() + ":" + transition.name();
        Counter counter = counterCache.computeIfAbsent(key, k ->
                Counter.builder("reconciliation.scd.transitions")
                        .description("SCD type-2 transitions applied")
                        .tag("entityType", type.name())
                        .tag("transition", transition.name())
                        .register(registry));
        counter.increment(count);
    }

    private Counter counter(String name, String description, EntityType type) {
        return counterCache.computeIfAbsent(name + ":" + type.name(), k ->
                Counter.builder(name)
                        .description(description)
                        .tag("entityType", type.name())
                        .register(registry));
    }
}
