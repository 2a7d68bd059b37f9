package com.entity.reconciliation.quality;

/**
 * Supported data quality checks.
 */
public enum ValidatorType {
    /** Value is present. */
    NOT_NULL,
    /** Value is numeric and within [min, max]. */
    RANGE,
    /** String form of the value matches a regular expression. */
    PATTERN,
    /** String form of the value is one of an allowed set. */
    ONE_OF,
    /** At least one of several fields is present. */
    ANY_OF
}
