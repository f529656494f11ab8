package com.planmarshall.core.error;

import com.planmarshall.core.model.PlanPhase;

/**
 * Thrown when a self-loop or loop-back would exceed its configured maximum.
 */
public class IterationLimitExceededException extends PlanMarshallException {

    private final PlanPhase phase;
    private final int limit;

    public IterationLimitExceededException(PlanPhase phase, int limit) {
        super("Iteration limit of " + limit + " reached in phase " + phase);
        this.phase = phase;
        this.limit = limit;
    }

    public PlanPhase getPhase() {
        return phase;
    }

    public int getLimit() {
        return limit;
    }
}
