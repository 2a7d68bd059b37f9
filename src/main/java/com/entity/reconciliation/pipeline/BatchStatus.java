package com.entity.reconciliation.pipeline;

/**
 * Lifecycle status of a pipeline run.
 */
public enum BatchStatus {
    RUNNING,
    SUCCEEDED,
    FAILED;

    public boolean isTerminal() {
        return this != RUNNING;
    }
}
