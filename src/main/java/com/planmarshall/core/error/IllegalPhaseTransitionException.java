package com.planmarshall.core.error;

import com.planmarshall.core.model.PlanPhase;

/**
 * Thrown when a plan is asked to move between phases in a way the lifecycle does not allow.
 */
public class IllegalPhaseTransitionException extends PlanMarshallException {

    public IllegalPhaseTransitionException(String planId, PlanPhase from, PlanPhase to) {
        super("Plan " + planId + " cannot move from " + from + " to " + to);
    }
}
