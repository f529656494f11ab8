package com.planmarshall.core.model;

/**
 * Per-finding state.
 * <p>
 * Verification findings move {@code NEW -> FIX_TASK_CREATED | SUPPRESSED | ACCEPTED}; {@code STALE}
 * marks findings cleared logically before they were triaged. Gate findings move
 * {@code PENDING -> FIXED | SUPPRESSED | ACCEPTED | TAKEN_INTO_ACCOUNT} and back to {@code PENDING}
 * when they are raised again.
 */
public enum FindingState {
    NEW,
    FIX_TASK_CREATED,
    SUPPRESSED,
    ACCEPTED,
    STALE,
    PENDING,
    FIXED,
    TAKEN_INTO_ACCOUNT;

    /** States a gate finding can be resolved to. */
    public boolean isGateResolution() {
        return this == FIXED || this == SUPPRESSED || this == ACCEPTED || this == TAKEN_INTO_ACCOUNT;
    }
}
