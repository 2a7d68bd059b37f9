package com.entity.reconciliation.scd;

/**
 * What historizing one merged record did to its dimension history.
 */
public enum ScdTransition {
    /** First version opened for a new master id. */
    OPENED,
    /** Current version closed and a new one opened. */
    VERSIONED,
    /** Fingerprint matched the current version; nothing written. */
    UNCHANGED
}
