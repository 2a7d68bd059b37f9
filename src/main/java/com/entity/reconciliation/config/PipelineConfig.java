package com.entity.reconciliation.config;

import com.entity.reconciliation.core.model.SourceSide;

import java.time.Duration;
import java.util.Objects;

/**
 * Runtime settings for the reconciliation pipeline.
 */
public class PipelineConfig {

    private static final Duration DEFAULT_ROLLING_WINDOW = Duration.ofDays(30);
    private static final Duration DEFAULT_LOCK_TIMEOUT = Duration.ofSeconds(30);
    private static final int DEFAULT_HISTORIZATION_PARALLELISM = 4;
    private static final String DEFAULT_SOURCE_A_LABEL = "OMS";
    private static final String DEFAULT_SOURCE_B_LABEL = "VEMS";

    private final Duration rollingWindow;
    private final Duration lockTimeout;
    private final int historizationParallelism;
    private final boolean parallelMerge;
    private final String sourceALabel;
    private final String sourceBLabel;

    private PipelineConfig(Builder builder) {
        this.rollingWindow = builder.rollingWindow;
        this.lockTimeout = builder.lockTimeout;
        this.historizationParallelism = builder.historizationParallelism;
        this.parallelMerge = builder.parallelMerge;
        this.sourceALabel = builder.sourceALabel;
        this.sourceBLabel = builder.sourceBLabel;
    }

    public static PipelineConfig defaults() {
        return builder().build();
    }

    /**
     * Source records ingested earlier than processing time minus this window are ignored.
     */
    public Duration getRollingWindow() {
        return rollingWindow;
    }

    public Duration getLockTimeout() {
        return lockTimeout;
    }

    public int getHistorizationParallelism() {
        return historizationParallelism;
    }

    public boolean isParallelMerge() {
        return parallelMerge;
    }

    public String getSourceALabel() {
        return sourceALabel;
    }

    public String getSourceBLabel() {
        return sourceBLabel;
    }

    public String labelFor(SourceSide side) {
        return side == SourceSide.A ? sourceALabel : sourceBLabel;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private Duration rollingWindow = DEFAULT_ROLLING_WINDOW;
        private Duration lockTimeout = DEFAULT_LOCK_TIMEOUT;
        private int historizationParallelism = DEFAULT_HISTORIZATION_PARALLELISM;
        private boolean parallelMerge = true;
        private String sourceALabel = DEFAULT_SOURCE_A_LABEL;
        private String sourceBLabel = DEFAULT_SOURCE_B_LABEL;

        public Builder rollingWindow(Duration rollingWindow) {
            this.rollingWindow = rollingWindow;
            return this;
        }

        public Builder lockTimeout(Duration lockTimeout) {
            this.lockTimeout = lockTimeout;
            return this;
        }

        public Builder historizationParallelism(int historizationParallelism) {
            this.historizationParallelism = historizationParallelism;
            return this;
        }

        public Builder parallelMerge(boolean parallelMerge) {
            this.parallelMerge = parallelMerge;
            return this;
        }

        public Builder sourceALabel(String sourceALabel) {
            this.sourceALabel = sourceALabel;
            return this;
        }

        public Builder sourceBLabel(String sourceBLabel) {
            this.sourceBLabel = sourceBLabel;
            return this;
        }

        public PipelineConfig build() {
            Objects.requireNonNull(rollingWindow, "rollingWindow is required");
            Objects.requireNonNull(lockTimeout, "lockTimeout is required");
            if (rollingWindow.isNegative() || rollingWindow.isZero()) {
                throw new IllegalArgumentException("rollingWindow must be positive");
            }
            if (lockTimeout.isNegative()) {
                throw new IllegalArgumentException("lockTimeout cannot be negative");
            }
            if (historizationParallelism < 1) {
                throw new IllegalArgumentException("historizationParallelism must be at least 1");
            }
            if (sourceALabel == null || sourceALabel.isBlank() || sourceBLabel == null || sourceBLabel.isBlank()) {
                throw new IllegalArgumentException("Source labels cannot be blank");
            }
            if (sourceALabel.equals(sourceBLabel)) {
                throw new IllegalArgumentException("Source labels must differ");
            }
            return new PipelineConfig(this);
        }
    }
}
