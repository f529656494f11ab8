package com.planmarshall.core.model;

import java.util.List;

/**
 * Failure details carried by a failed plan so that it can be resumed manually.
 *
 * @param kind                 failure category
 * @param phase                phase in which the failure happened
 * @param message              human-readable explanation
 * @param unresolvedFindingIds unresolved findings, in triage order
 */
public record PlanFailure(FailureKind kind, PlanPhase phase, String message, List<String> unresolvedFindingIds) {

    public PlanFailure {
        unresolvedFindingIds = unresolvedFindingIds == null ? List.of() : List.copyOf(unresolvedFindingIds);
    }
}
