package com.entity.reconciliation.pipeline;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Compensating transaction spanning the stages of one pipeline run.
 * Compensations run in reverse order if a step fails or the transaction
 * is closed without {@link #markSuccess()}.
 *
 * <pre>
 * try (BatchTransaction tx = new BatchTransaction()) {
 *     tx.execute("replace crosswalk", () -> repo.replaceBatch(...), () -> restorePrevious(...));
 *     tx.executeNoCompensation("log conflicts", () -> conflictLogger.log(...));
 *     tx.markSuccess();
 * }
 * </pre>
 */
public class BatchTransaction implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(BatchTransaction.class);

    private final Deque<CompensatingAction> compensationStack = new ArrayDeque<>();
    private boolean success = false;
    private boolean closed = false;

    /**
     * Executes a step and registers its compensation.
     * If the step fails, earlier compensations run and the exception is rethrown.
     */
    public void execute(String description, Runnable operation, Runnable compensation) {
        checkOpen();
        try {
            log.debug("batch.step.executing step='{}'", description);
            operation.run();
            compensationStack.push(new CompensatingAction(description, compensation));
        } catch (RuntimeException e) {
            log.warn("batch.step.failed step='{}' error={}", description, e.getMessage());
            runCompensations();
            throw e;
        }
    }

    /**
     * Executes an append-only step that is not undone on failure.
     */
    public void executeNoCompensation(String description, Runnable operation) {
        checkOpen();
        try {
            log.debug("batch.step.executing step='{}' compensation=none", description);
            operation.run();
        } catch (RuntimeException e) {
            log.warn("batch.step.failed step='{}' error={}", description, e.getMessage());
            runCompensations();
            throw e;
        }
    }

    public void markSuccess() {
        this.success = true;
    }

    public boolean isSuccess() {
        return success;
    }

    @Override
    public void close() {
        if (!closed && !success) {
            if (!compensationStack.isEmpty()) {
                log.warn("batch.rollback steps={}", compensationStack.size());
            }
            runCompensations();
        }
        closed = true;
    }

    private void checkOpen() {
        if (closed) {
            throw new IllegalStateException("Transaction is already closed");
        }
    }

    private void runCompensations() {
        while (!compensationStack.isEmpty()) {
            CompensatingAction action = compensationStack.pop();
            try {
                log.debug("batch.compensating step='{}'", action.description());
                action.compensation().run();
            } catch (RuntimeException e) {
                // remaining compensations still run
                log.error("batch.compensation.failed step='{}' error={}", action.description(), e.getMessage());
            }
        }
    }

    private record CompensatingAction(String description, Runnable compensation) {}
}
