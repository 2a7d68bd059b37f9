package com.entity.reconciliation.rest.dto;

import com.entity.reconciliation.error.ReconciliationException;

import java.time.Instant;

/**
 * Error body returned by the reconciliation endpoints.
 * Pipeline failures carry the error type and the entity type, batch and natural key they
 * concern; request errors that never reached the pipeline leave those null.
 */
public record ErrorResponse(
        int status,
        String error,
        String message,
        String path,
        Instant timestamp,
        String errorType,
        String entityType,
        String batchId,
        String naturalKey
) {
    public ErrorResponse(int status, String error, String message, String path) {
        this(status, error, message, path, Instant.now(), null, null, null, null);
    }

    public static ErrorResponse badRequest(String message, String path) {
        return new ErrorResponse(400, "Bad Request", message, path);
    }

    public static ErrorResponse badRequest(ReconciliationException e, String path) {
        return from(400, "Bad Request", e, path);
    }

    public static ErrorResponse notFound(String message, String path) {
        return new ErrorResponse(404, "Not Found", message, path);
    }

    public static ErrorResponse internalError(String message, String path) {
        return new ErrorResponse(500, "Internal Server Error", message, path);
    }

    public static ErrorResponse from(int status, String error, ReconciliationException e, String path) {
        return new ErrorResponse(status, error, e.getMessage(), path, Instant.now(),
                errorType(e),
                e.getEntityType() != null ? e.getEntityType().name() : null,
                e.getBatchId(),
                e.getNaturalKey());
    }

    /**
     * Short error type: pipeline exceptions drop the {@code Exception} suffix
     * ({@code DependencyNotReady}), anything else keeps its simple class name.
     */
    public static String errorType(Throwable error) {
        if (error instanceof ReconciliationException) {
            return error.getClass().getSimpleName().replace("Exception", "");
        }
        return error.getClass().getSimpleName();
    }
}
