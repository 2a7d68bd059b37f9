package com.entity.reconciliation.error;

/**
 * Thrown when reconciliation policies cannot be loaded or are inconsistent.
 */
public class PolicyConfigurationException extends RuntimeException {

    public PolicyConfigurationException(String message) {
        super(message);
    }

    public PolicyConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
