package com.entity.reconciliation.core.model;

/**
 * One of the two upstream source systems feeding the pipeline.
 * Display labels (e.g. OMS / VEMS) are configured in {@code PipelineConfig}.
 */
public enum SourceSide {
    A,
    B;

    public SourceSide other() {
        return this == A ? B : A;
    }
}
