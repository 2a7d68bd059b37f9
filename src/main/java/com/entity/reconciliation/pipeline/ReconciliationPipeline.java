package com.entity.reconciliation.pipeline;

import com.entity.reconciliation.audit.ConflictLogRepository;
import com.entity.reconciliation.audit.ConflictLogger;
import com.entity.reconciliation.audit.InMemoryConflictLogRepository;
import com.entity.reconciliation.config.PipelineConfig;
import com.entity.reconciliation.config.PolicyCatalog;
import com.entity.reconciliation.config.PolicyCatalogLoader;
import com.entity.reconciliation.config.SystemOfRecordPolicy;
import com.entity.reconciliation.core.model.CrosswalkEntry;
import com.entity.reconciliation.core.model.EntityType;
import com.entity.reconciliation.core.model.MatchMethod;
import com.entity.reconciliation.core.model.MergedRecord;
import com.entity.reconciliation.core.model.SourceRecord;
import com.entity.reconciliation.core.model.SourceSide;
import com.entity.reconciliation.crosswalk.CrosswalkBuilder;
import com.entity.reconciliation.crosswalk.CrosswalkRepository;
import com.entity.reconciliation.crosswalk.CrosswalkResult;
import com.entity.reconciliation.crosswalk.InMemoryCrosswalkRepository;
import com.entity.reconciliation.error.DependencyNotReadyException;
import com.entity.reconciliation.error.InvalidInputException;
import com.entity.reconciliation.logging.LogContext;
import com.entity.reconciliation.lock.LocalRunLock;
import com.entity.reconciliation.lock.LockAcquisitionException;
import com.entity.reconciliation.lock.RunLock;
import com.entity.reconciliation.merge.CrosswalkReferenceResolver;
import com.entity.reconciliation.merge.FieldMergeEngine;
import com.entity.reconciliation.merge.InMemoryStagingRepository;
import com.entity.reconciliation.merge.MergeOutcome;
import com.entity.reconciliation.merge.ReferenceResolver;
import com.entity.reconciliation.merge.StagingRepository;
import com.entity.reconciliation.metrics.NoOpPipelineMetrics;
import com.entity.reconciliation.metrics.PipelineMetrics;
import com.entity.reconciliation.quality.DataQualityScorer;
import com.entity.reconciliation.scd.DimensionRepository;
import com.entity.reconciliation.scd.HistorizationResult;
import com.entity.reconciliation.scd.InMemoryDimensionRepository;
import com.entity.reconciliation.scd.ScdHistorizer;
import com.entity.reconciliation.scd.ScdTransition;
import com.entity.reconciliation.source.SourceRecordProvider;
import com.entity.reconciliation.tracing.NoOpPipelineTracer;
import com.entity.reconciliation.tracing.PipelineTracer;
import com.entity.reconciliation.tracing.Span;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Supplier;
import java.util.regex.Pattern;

/**
 * Runs the reconciliation stages for one entity type and batch:
 * crosswalk, field merge, conflict logging and, for historized types, SCD type-2 historization.
 *
 * <pre>
 * ReconciliationPipeline pipeline = ReconciliationPipeline.builder()
 *     .sourceRecordProvider(provider)
 *     .build();
 *
 * BatchResult result = pipeline.processBatch(EntityType.VETERAN, "BATCH_20240105_001");
 * </pre>
 *
 * <p>Runs of the same entity type are serialized. Event types refuse to run until every
 * entity type they reference has succeeded for the same batch. The rolling window is
 * measured back from the start of the batch's first run, so a replay selects the same
 * source records however late it happens. A batch with no eligible record fails instead
 * of committing an empty crosswalk.</p>
 *
 * <p>A failed run restores the batch's previous crosswalk and staging snapshots and is
 * recorded as FAILED, so its output is never consumed downstream. Dimension history is
 * checked for integrity before any version is written, and conflicts are appended only
 * once historization has succeeded. Conflict log entries are append-only and dimension
 * history transitions are idempotent, so re-running a batch is safe.</p>
 */
public class ReconciliationPipeline implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ReconciliationPipeline.class);

    private static final Pattern BATCH_ID_PATTERN = Pattern.compile("[A-Za-z0-9_-]{1,128}");

    private final PolicyCatalog catalog;
    private final PipelineConfig config;
    private final SourceRecordProvider sources;
    private final CrosswalkRepository crosswalks;
    private final StagingRepository staging;
    private final ConflictLogger conflictLogger;
    private final DimensionRepository dimensions;
    private final BatchRunLog runLog;
    private final RunLock runLock;
    private final PipelineMetrics metrics;
    private final PipelineTracer tracer;
    private final Clock clock;
    private final CrosswalkBuilder crosswalkBuilder;
    private final FieldMergeEngine mergeEngine;
    private final ScdHistorizer historizer;

    private ReconciliationPipeline(Builder builder) {
        this.catalog = builder.catalog;
        this.config = builder.config;
        this.sources = builder.sources;
        this.crosswalks = builder.crosswalks;
        this.staging = builder.staging;
        this.conflictLogger = new ConflictLogger(builder.conflictLog);
        this.dimensions = builder.dimensions;
        this.runLog = builder.runLog;
        this.runLock = builder.runLock;
        this.metrics = builder.metrics;
        this.tracer = builder.tracer;
        this.clock = builder.clock;
        this.crosswalkBuilder = new CrosswalkBuilder(config);
        this.mergeEngine = new FieldMergeEngine(new DataQualityScorer(), catalog.codeMappings(), config);
        this.historizer = new ScdHistorizer(dimensions, config.getHistorizationParallelism());
    }

    /**
     * Processes one batch of one entity type.
     *
     * @return SUCCEEDED with row counts, or FAILED carrying the cause
     * @throws InvalidInputException if the entity type is missing or unconfigured or the batch id is invalid;
     *                               nothing has been written in that case
     */
    public BatchResult processBatch(EntityType entityType, String batchId) {
        validate(entityType, batchId);
        SystemOfRecordPolicy policy = catalog.policyFor(entityType);

        try (LogContext ctx = LogContext.forBatch(entityType, batchId)) {
            long startNanos = System.nanoTime();
            try {
                runLock.acquire(entityType);
            } catch (LockAcquisitionException e) {
                log.warn("batch.lockUnavailable error={}", e.getMessage());
                metrics.recordBatchDuration(entityType, BatchStatus.FAILED, elapsedSince(startNanos));
                return BatchResult.failed(entityType, batchId, null, null, e);
            }
            try {
                return runLocked(entityType, batchId, policy, ctx, startNanos);
            } finally {
                runLock.release(entityType);
            }
        }
    }

    /**
     * Processes every configured entity type for a batch, referenced types first.
     * Dependents of a failed type fail with {@link DependencyNotReadyException}.
     */
    public List<BatchResult> processAll(String batchId) {
        List<BatchResult> results = new ArrayList<>();
        for (EntityType type : dependencyOrder()) {
            results.add(processBatch(type, batchId));
        }
        return results;
    }

    private BatchResult runLocked(EntityType entityType, String batchId, SystemOfRecordPolicy policy,
                                  LogContext ctx, long startNanos) {
        Instant processingTime = clock.instant();
        Instant batchTime = runLog.findFirst(entityType, batchId)
                .map(BatchRun::startedAt)
                .orElse(processingTime);
        BatchRun run = BatchRun.started(LogContext.generateRunId(), entityType, batchId, processingTime);
        runLog.save(run);
        ctx.with("runId", run.runId());
        log.info("batch.started processingTime={} batchTime={}", processingTime, batchTime);

        RunCounters counters = new RunCounters();
        try {
            checkDependencies(entityType, batchId, policy);
            execute(entityType, batchId, policy, processingTime, batchTime, counters);
        } catch (RuntimeException e) {
            BatchStatistics partial = counters.toStatistics();
            runLog.save(run.failed(clock.instant(), e.getClass().getSimpleName() + ": " + e.getMessage()));
            metrics.recordBatchDuration(entityType, BatchStatus.FAILED, elapsedSince(startNanos));
            log.error("batch.failed errorType={} error={}", e.getClass().getSimpleName(), e.getMessage());
            return BatchResult.failed(entityType, batchId, run.runId(), partial, e);
        }

        BatchStatistics statistics = counters.toStatistics();
        runLog.save(run.succeeded(clock.instant(), statistics));
        recordMetrics(entityType, counters);
        metrics.recordBatchDuration(entityType, BatchStatus.SUCCEEDED, elapsedSince(startNanos));
        log.info("batch.succeeded rows={} orphans={} conflicts={} opened={} changed={} unchanged={}",
                statistics.rowCount(), statistics.orphans(), statistics.conflicts(),
                statistics.versionsOpened(), statistics.versionsChanged(), statistics.versionsUnchanged());
        return BatchResult.succeeded(entityType, batchId, run.runId(), statistics);
    }

    private void execute(EntityType entityType, String batchId, SystemOfRecordPolicy policy,
                         Instant processingTime, Instant batchTime, RunCounters counters) {
        List<SourceRecord> sourceA = sources.fetch(entityType, SourceSide.A, batchId);
        List<SourceRecord> sourceB = sources.fetch(entityType, SourceSide.B, batchId);

        try (BatchTransaction tx = new BatchTransaction()) {
            CrosswalkResult crosswalk = stage("crosswalk", entityType, batchId, () ->
                    crosswalkBuilder.build(entityType, batchId, policy.primarySource(),
                            sourceA, sourceB, batchTime));
            counters.crosswalk = crosswalk;
            if (crosswalk.entries().isEmpty()) {
                throw new DependencyNotReadyException(entityType, batchId,
                        "No eligible source records for batch " + batchId + ": read=" + crosswalk.recordsRead()
                                + " outsideWindow=" + crosswalk.outsideWindow()
                                + " orphans=" + crosswalk.orphans().size());
            }

            List<CrosswalkEntry> previousCrosswalk = crosswalks.findBatch(entityType, batchId).orElse(null);
            tx.execute("replace crosswalk",
                    () -> crosswalks.replaceBatch(entityType, batchId, crosswalk.entries()),
                    () -> restoreCrosswalk(entityType, batchId, previousCrosswalk));

            MergeOutcome merged = stage("merge", entityType, batchId, () -> {
                ReferenceResolver references = policy.dependencies().isEmpty()
                        ? ReferenceResolver.none()
                        : CrosswalkReferenceResolver.load(crosswalks, entityType, batchId, policy.dependencies());
                return mergeEngine.merge(entityType, batchId,
                        crosswalks.findBatch(entityType, batchId).orElse(null),
                        sourceA, sourceB, policy, references, processingTime);
            });
            counters.merged = merged;

            List<MergedRecord> previousStaging = staging.findBatch(entityType, batchId).orElse(null);
            tx.execute("replace staging",
                    () -> staging.replaceBatch(entityType, batchId, merged.records()),
                    () -> restoreStaging(entityType, batchId, previousStaging));

            if (policy.historized()) {
                tx.executeNoCompensation("historize", () ->
                        counters.historization = stage("historize", entityType, batchId,
                                () -> historizer.historize(entityType, batchId, merged.records(), processingTime)));
            }

            tx.executeNoCompensation("log conflicts", () ->
                    counters.conflictsLogged = stage("conflicts", entityType, batchId,
                            () -> conflictLogger.log(merged.conflicts())));
            tx.markSuccess();
        }
    }

    private <T> T stage(String name, EntityType entityType, String batchId, Supplier<T> work) {
        try (LogContext stageCtx = LogContext.forStage(name);
             Span span = tracer.startStage(name, entityType, batchId)) {
            try {
                return work.get();
            } catch (RuntimeException e) {
                span.fail(e);
                throw e;
            }
        }
    }

    private void checkDependencies(EntityType entityType, String batchId, SystemOfRecordPolicy policy) {
        for (EntityType dependency : policy.dependencies()) {
            if (!runLog.isConsumable(dependency, batchId)) {
                throw new DependencyNotReadyException(entityType, batchId, dependency,
                        dependency + " has not succeeded for batch " + batchId);
            }
        }
    }

    private void restoreCrosswalk(EntityType entityType, String batchId, List<CrosswalkEntry> previous) {
        if (previous != null) {
            crosswalks.replaceBatch(entityType, batchId, previous);
        } else {
            crosswalks.deleteBatch(entityType, batchId);
        }
    }

    private void restoreStaging(EntityType entityType, String batchId, List<MergedRecord> previous) {
        if (previous != null) {
            staging.replaceBatch(entityType, batchId, previous);
        } else {
            staging.deleteBatch(entityType, batchId);
        }
    }

    private void recordMetrics(EntityType entityType, RunCounters counters) {
        if (counters.crosswalk != null) {
            for (Map.Entry<MatchMethod, Long> entry : counters.crosswalk.countsByMethod().entrySet()) {
                metrics.recordCrosswalkEntries(entityType, entry.getKey(), entry.getValue());
            }
            metrics.recordOrphans(entityType, counters.crosswalk.orphans().size());
        }
        metrics.recordConflicts(entityType, counters.conflictsLogged);
        if (counters.merged != null) {
            counters.merged.records().forEach(r -> metrics.recordQualityScore(entityType, r.dqScore()));
        }
        HistorizationResult h = counters.historization;
        metrics.recordTransitions(entityType, ScdTransition.OPENED, h.opened());
        metrics.recordTransitions(entityType, ScdTransition.VERSIONED, h.versioned());
        metrics.recordTransitions(entityType, ScdTransition.UNCHANGED, h.unchanged());
    }

    private void validate(EntityType entityType, String batchId) {
        if (entityType == null) {
            throw new InvalidInputException(null, batchId, "Entity type is required");
        }
        if (batchId == null || batchId.isBlank()) {
            throw new InvalidInputException(entityType, batchId, "Batch id is required and cannot be empty");
        }
        if (!BATCH_ID_PATTERN.matcher(batchId).matches()) {
            throw new InvalidInputException(entityType, batchId,
                    "Batch id must contain only letters, digits, underscores and hyphens: " + batchId);
        }
        if (!catalog.hasPolicy(entityType)) {
            throw new InvalidInputException(entityType, batchId,
                    "No system-of-record policy configured for " + entityType);
        }
    }

    private List<EntityType> dependencyOrder() {
        Set<EntityType> ordered = new LinkedHashSet<>();
        for (EntityType type : EntityType.values()) {
            if (catalog.hasPolicy(type)) {
                visit(type, ordered);
            }
        }
        return List.copyOf(ordered);
    }

    private void visit(EntityType type, Set<EntityType> ordered) {
        if (ordered.contains(type)) {
            return;
        }
        for (EntityType dependency : catalog.policyFor(type).dependencies()) {
            visit(dependency, ordered);
        }
        ordered.add(type);
    }

    private static Duration elapsedSince(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }

    public ConflictLogger getConflictLogger() {
        return conflictLogger;
    }

    public CrosswalkRepository getCrosswalkRepository() {
        return crosswalks;
    }

    public StagingRepository getStagingRepository() {
        return staging;
    }

    public DimensionRepository getDimensionRepository() {
        return dimensions;
    }

    public BatchRunLog getBatchRunLog() {
        return runLog;
    }

    public PolicyCatalog getPolicyCatalog() {
        return catalog;
    }

    @Override
    public void close() {
        historizer.close();
    }

    /**
     * Mutable counters filled in as stages complete, so failed runs can report partial progress.
     */
    private static final class RunCounters {
        CrosswalkResult crosswalk;
        MergeOutcome merged;
        int conflictsLogged;
        HistorizationResult historization = HistorizationResult.skipped();

        BatchStatistics toStatistics() {
            return new BatchStatistics(
                    crosswalk != null ? crosswalk.recordsRead() : 0,
                    crosswalk != null ? crosswalk.entries().size() : 0,
                    crosswalk != null ? crosswalk.orphans().size() : 0,
                    conflictsLogged,
                    historization.opened(),
                    historization.versioned(),
                    historization.unchanged());
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private PolicyCatalog catalog;
        private PipelineConfig config = PipelineConfig.defaults();
        private SourceRecordProvider sources;
        private CrosswalkRepository crosswalks;
        private StagingRepository staging;
        private ConflictLogRepository conflictLog;
        private DimensionRepository dimensions;
        private BatchRunLog runLog;
        private RunLock runLock;
        private PipelineMetrics metrics = new NoOpPipelineMetrics();
        private PipelineTracer tracer = new NoOpPipelineTracer();
        private Clock clock = Clock.systemUTC();

        public Builder policyCatalog(PolicyCatalog catalog) {
            this.catalog = catalog;
            return this;
        }

        public Builder config(PipelineConfig config) {
            this.config = config;
            return this;
        }

        public Builder sourceRecordProvider(SourceRecordProvider sources) {
            this.sources = sources;
            return this;
        }

        public Builder crosswalkRepository(CrosswalkRepository crosswalks) {
            this.crosswalks = crosswalks;
            return this;
        }

        public Builder stagingRepository(StagingRepository staging) {
            this.staging = staging;
            return this;
        }

        public Builder conflictLogRepository(ConflictLogRepository conflictLog) {
            this.conflictLog = conflictLog;
            return this;
        }

        public Builder dimensionRepository(DimensionRepository dimensions) {
            this.dimensions = dimensions;
            return this;
        }

        public Builder batchRunLog(BatchRunLog runLog) {
            this.runLog = runLog;
            return this;
        }

        public Builder runLock(RunLock runLock) {
            this.runLock = runLock;
            return this;
        }

        public Builder metrics(PipelineMetrics metrics) {
            this.metrics = metrics;
            return this;
        }

        public Builder tracer(PipelineTracer tracer) {
            this.tracer = tracer;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public ReconciliationPipeline build() {
            if (sources == null) {
                throw new IllegalStateException("SourceRecordProvider is required");
            }
            if (config == null) {
                throw new IllegalStateException("PipelineConfig is required");
            }
            if (catalog == null) {
                catalog = new PolicyCatalogLoader().loadDefault();
            }
            if (crosswalks == null) {
                crosswalks = new InMemoryCrosswalkRepository();
            }
            if (staging == null) {
                staging = new InMemoryStagingRepository();
            }
            if (conflictLog == null) {
                conflictLog = new InMemoryConflictLogRepository();
            }
            if (dimensions == null) {
                dimensions = new InMemoryDimensionRepository();
            }
            if (runLog == null) {
                runLog = new InMemoryBatchRunLog();
            }
            if (runLock == null) {
                runLock = new LocalRunLock(config.getLockTimeout());
            }
            if (metrics == null) {
                metrics = new NoOpPipelineMetrics();
            }
            if (tracer == null) {
                tracer = new NoOpPipelineTracer();
            }
            if (clock == null) {
                clock = Clock.systemUTC();
            }
            return new ReconciliationPipeline(this);
        }
    }
}
