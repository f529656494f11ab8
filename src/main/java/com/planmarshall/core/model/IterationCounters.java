package com.planmarshall.core.model;

/**
 * Per-plan loop counters. Counters only ever increase; every increment returns a new instance.
 *
 * @param refine  self-loops taken by 2-refine
 * @param outline self-loops taken by 3-outline
 * @param verify  verify runs started (loop-backs taken so far are {@code verify - 1})
 */
public record IterationCounters(int refine, int outline, int verify) {

    public static final IterationCounters ZERO = new IterationCounters(0, 0, 0);

    public IterationCounters {
        if (refine < 0 || outline < 0 || verify < 0) {
            throw new IllegalArgumentException("Iteration counters must be non-negative");
        }
    }

    public IterationCounters incrementRefine() {
        return new IterationCounters(refine + 1, outline, verify);
    }

    public IterationCounters incrementOutline() {
        return new IterationCounters(refine, outline + 1, verify);
    }

    public IterationCounters incrementVerify() {
        return new IterationCounters(refine, outline, verify + 1);
    }

    /** Counter a finding raised in {@code phase} is filed under. */
    public int forPhase(PlanPhase phase) {
        return switch (phase) {
            case REFINE -> refine;
            case OUTLINE -> outline;
            default -> verify;
        };
    }

    public int verifyLoopBacks() {
        return Math.max(0, verify - 1);
    }
}
