package com.di.compliance.model;

/**
 * Status of a {@link ProcessingRun}.
 *
 * <pre>Status flow:
 *   RUNNING → SUCCESS
 *           → PARTIAL   (some rows failed, at least one succeeded)
 *           → FAILED
 * </pre>
 * {@code PENDING} is reserved for runs queued but not yet started.
 */
public enum RunStatus {
    PENDING,
    RUNNING,
    SUCCESS,
    FAILED,
    PARTIAL;

    /**
     * Derives the terminal status of a row-oriented stage from its counters.
     * No failures is a success (including an empty document); otherwise PARTIAL when
     * at least one row made it, FAILED when none did.
     */
    public static RunStatus fromCounters(int succeeded, int failed) {
        if (failed == 0) {
            return SUCCESS;
        }
        return succeeded > 0 ? PARTIAL : FAILED;
    }

    public boolean isTerminal() {
        return this == SUCCESS || this == FAILED || this == PARTIAL;
    }
}
