package com.planmarshall.core.model;

/**
 * Why a plan ended in {@link PlanPhase#FAILED}.
 */
public enum FailureKind {
    ITERATION_LIMIT_EXCEEDED,
    VALIDATION,
    DEPENDENCY_CYCLE,
    TRANSIENT_EXHAUSTED,
    INTERNAL
}
