package com.entity.reconciliation.tracing;

import com.entity.reconciliation.core.model.EntityType;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;

/**
 * OpenTelemetry-based implementation of {@link PipelineTracer}.
 * Stage spans are named {@code reconciliation.<stage>} and carry the entity type and batch id.
 */
public class OpenTelemetryPipelineTracer implements PipelineTracer {

    private final Tracer tracer;

    public OpenTelemetryPipelineTracer(Tracer tracer) {
        this.tracer = tracer;
    }

    @Override
    public Span startStage(String stage, EntityType entityType, String batchId) {
        io.opentelemetry.api.trace.Span otelSpan = tracer.spanBuilder("reconciliation." + stage)
                .setAttribute("entityType", entityType.name())
                .setAttribute("batchId", batchId)
                .startSpan();
        return new OTelSpanAdapter(otelSpan);
    }

    private static class OTelSpanAdapter implements Span {

        private final io.opentelemetry.api.trace.Span otelSpan;

        OTelSpanAdapter(io.opentelemetry.api.trace.Span otelSpan) {
            this.otelSpan = otelSpan;
        }

        @Override
        public void setAttribute(String key, String value) {
            otelSpan.setAttribute(key, value);
        }

        @Override
        public void setAttribute(String key, long value) {
            otelSpan.setAttribute(key, value);
        }

        @Override
        public void fail(Throwable t) {
            otelSpan.recordException(t);
            otelSpan.setStatus(StatusCode.ERROR, t.getMessage() != null ? t.getMessage() : t.getClass().getSimpleName());
        }

        @Override
        public void close() {
            otelSpan.end();
        }
    }
}
