package com.contact.resolution.merge;

/**
 * Lifecycle of a single merge.
 * {@code REQUESTED -> VALIDATED -> MIGRATING -> FINALIZING -> COMPLETED}, or {@code FAILED}
 * from any non-terminal state. Everything from VALIDATED to FINALIZING commits atomically.
 */
public enum MergeState {
    REQUESTED,
    VALIDATED,
    MIGRATING,
    FINALIZING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
