package com.planmarshall.core.model;

import java.time.Instant;

/**
 * One entry of a plan's phase history.
 *
 * @param from   phase left ({@code null} for the initial entry into 1-init)
 * @param to     phase entered
 * @param reason short machine-readable reason, e.g. "advance", "clarification-requested", "fix-tasks"
 * @param at     when the transition was recorded
 */
public record PhaseTransition(PlanPhase from, PlanPhase to, String reason, Instant at) {}
