package com.entity.reconciliation.cdi;

import com.entity.reconciliation.config.PipelineConfig;
import com.entity.reconciliation.config.PolicyCatalog;
import com.entity.reconciliation.config.PolicyCatalogLoader;
import com.entity.reconciliation.metrics.MicrometerPipelineMetrics;
import com.entity.reconciliation.metrics.NoOpPipelineMetrics;
import com.entity.reconciliation.metrics.PipelineMetrics;
import com.entity.reconciliation.pipeline.ReconciliationPipeline;
import com.entity.reconciliation.source.SourceRecordProvider;
import com.entity.reconciliation.tracing.NoOpPipelineTracer;
import com.entity.reconciliation.tracing.OpenTelemetryPipelineTracer;
import com.entity.reconciliation.tracing.PipelineTracer;
import io.micrometer.core.instrument.MeterRegistry;
import io.opentelemetry.api.OpenTelemetry;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Instance;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Optional;

/**
 * CDI producer that wires the reconciliation pipeline from MicroProfile Config properties.
 *
 * <pre>
 * reconciliation:
 *   rolling-window-days: 30
 *   historization-parallelism: 4
 *   lock-timeout-millis: 30000
 *   source-a-label: OMS
 *   source-b-label: VEMS
 *   policy-file: /etc/reconciliation/policies.json   # optional, defaults to the bundled policies
 * </pre>
 *
 * <p>The deployment must provide a {@link SourceRecordProvider} bean. A {@link MeterRegistry}
 * or {@link OpenTelemetry} bean, when present, enables metrics or tracing.</p>
 */
@ApplicationScoped
public class ReconciliationProducer {

    private static final Logger log = LoggerFactory.getLogger(ReconciliationProducer.class);

    @Inject
    @ConfigProperty(name = "reconciliation.rolling-window-days", defaultValue = "30")
    int rollingWindowDays;

    @Inject
    @ConfigProperty(name = "reconciliation.historization-parallelism", defaultValue = "4")
    int historizationParallelism;

    @Inject
    @ConfigProperty(name = "reconciliation.lock-timeout-millis", defaultValue = "30000")
    long lockTimeoutMillis;

    @Inject
    @ConfigProperty(name = "reconciliation.parallel-merge", defaultValue = "true")
    boolean parallelMerge;

    @Inject
    @ConfigProperty(name = "reconciliation.source-a-label", defaultValue = "OMS")
    String sourceALabel;

    @Inject
    @ConfigProperty(name = "reconciliation.source-b-label", defaultValue = "VEMS")
    String sourceBLabel;

    @Inject
    @ConfigProperty(name = "reconciliation.policy-file")
    Optional<String> policyFile;

    @Produces
    @ApplicationScoped
    public PipelineConfig pipelineConfig() {
        return PipelineConfig.builder()
                .rollingWindow(Duration.ofDays(rollingWindowDays))
                .historizationParallelism(historizationParallelism)
                .lockTimeout(Duration.ofMillis(lockTimeoutMillis))
                .parallelMerge(parallelMerge)
                .sourceALabel(sourceALabel)
                .sourceBLabel(sourceBLabel)
                .build();
    }

    @Produces
    @ApplicationScoped
    public PolicyCatalog policyCatalog() {
        PolicyCatalogLoader loader = new PolicyCatalogLoader();
        if (policyFile.isPresent()) {
            log.info("Loading reconciliation policies from {}", policyFile.get());
            return loader.load(Path.of(policyFile.get()));
        }
        return loader.loadDefault();
    }

    @Produces
    @ApplicationScoped
    public ReconciliationPipeline reconciliationPipeline(PipelineConfig config,
                                                         PolicyCatalog catalog,
                                                         SourceRecordProvider sourceRecordProvider,
                                                         Instance<MeterRegistry> meterRegistry,
                                                         Instance<OpenTelemetry> openTelemetry) {
        log.info("Producing ReconciliationPipeline: window={} parallelism={} sources={}/{}",
                config.getRollingWindow(), config.getHistorizationParallelism(),
                config.getSourceALabel(), config.getSourceBLabel());

        PipelineMetrics metrics = meterRegistry.isResolvable()
                ? new MicrometerPipelineMetrics(meterRegistry.get())
                : new NoOpPipelineMetrics();
        PipelineTracer tracer = openTelemetry.isResolvable()
                ? new OpenTelemetryPipelineTracer(openTelemetry.get().getTracer("entity-reconciliation"))
                : new NoOpPipelineTracer();

        return ReconciliationPipeline.builder()
                .config(config)
                .policyCatalog(catalog)
                .sourceRecordProvider(sourceRecordProvider)
                .metrics(metrics)
                .tracer(tracer)
                .build();
    }

    public void closePipeline(@Disposes ReconciliationPipeline pipeline) {
        log.info("Closing ReconciliationPipeline");
        pipeline.close();
    }
}
