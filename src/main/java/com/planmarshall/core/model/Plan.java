package com.planmarshall.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.planmarshall.core.error.IllegalPhaseTransitionException;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;

/**
 * The durable record of one plan: identity, phase, loop counters, domains and phase history.
 * <p>
 * Instances are immutable. Phase changes go through {@link #transitionTo} which rejects anything
 * {@link PlanPhase#canTransitionTo} does not allow and appends to {@link #history()}.
 *
 * @param planId          kebab-case identifier
 * @param title           request title
 * @param phase           current phase
 * @param waitingOn       external event the plan is suspended on, {@link WaitReason#NONE} when runnable
 * @param iterations      loop counters
 * @param domains         domains assigned during 2-refine, sorted
 * @param changeType      change type decided during 2-refine (may be {@code null} before that)
 * @param blockedOverride whether 5-execute may close although blocked tasks remain
 * @param openQuestions   clarifying questions from the last refine pass
 * @param reviewFeedback  reviewer feedback from rejected outlines, oldest first
 * @param history         every phase transition, oldest first
 * @param failure         failure details when {@code phase == FAILED}, otherwise {@code null}
 * @param createdAt       creation time
 * @param updatedAt       last modification time
 */
public record Plan(
    String planId,
    String title,
    PlanPhase phase,
    WaitReason waitingOn,
    IterationCounters iterations,
    List<String> domains,
    ChangeType changeType,
    boolean blockedOverride,
    List<String> openQuestions,
    List<String> reviewFeedback,
    List<PhaseTransition> history,
    PlanFailure failure,
    Instant createdAt,
    Instant updatedAt
) {

    public Plan {
        waitingOn = waitingOn == null ? WaitReason.NONE : waitingOn;
        iterations = iterations == null ? IterationCounters.ZERO : iterations;
        domains = domains == null ? List.of() : List.copyOf(new TreeSet<>(domains));
        openQuestions = openQuestions == null ? List.of() : List.copyOf(openQuestions);
        reviewFeedback = reviewFeedback == null ? List.of() : List.copyOf(reviewFeedback);
        history = history == null ? List.of() : List.copyOf(history);
    }

    /** Creates a plan in 1-init. */
    public static Plan create(String planId, String title, Instant now) {
        return new Plan(planId, title, PlanPhase.INIT, WaitReason.NONE, IterationCounters.ZERO,
                List.of(), null, false, List.of(), List.of(),
                List.of(new PhaseTransition(null, PlanPhase.INIT, "created", now)),
                null, now, now);
    }

    @JsonIgnore
    public boolean isTerminal() {
        return phase.isTerminal();
    }

    @JsonIgnore
    public boolean isSuspended() {
        return waitingOn != WaitReason.NONE;
    }

    public Plan transitionTo(PlanPhase next, String reason, Instant now) {
        if (!phase.canTransitionTo(next)) {
            throw new IllegalPhaseTransitionException(planId, phase, next);
        }
        var updatedHistory = new ArrayList<>(history);
        updatedHistory.add(new PhaseTransition(phase, next, reason, now));
        return new Plan(planId, title, next, WaitReason.NONE, iterations, domains, changeType,
                next == PlanPhase.EXECUTE ? false : blockedOverride,
                openQuestions, reviewFeedback, updatedHistory, failure, createdAt, now);
    }

    public Plan fail(PlanFailure planFailure, Instant now) {
        return transitionTo(PlanPhase.FAILED, planFailure.kind().name().toLowerCase(), now)
                .withFailure(planFailure);
    }

    public Plan waitFor(WaitReason reason, Instant now) {
        return new Plan(planId, title, phase, reason, iterations, domains, changeType, blockedOverride,
                openQuestions, reviewFeedback, history, failure, createdAt, now);
    }

    public Plan withIterations(IterationCounters counters, Instant now) {
        return new Plan(planId, title, phase, waitingOn, counters, domains, changeType, blockedOverride,
                openQuestions, reviewFeedback, history, failure, createdAt, now);
    }

    public Plan withDomains(List<String> newDomains, ChangeType newChangeType, Instant now) {
        return new Plan(planId, title, phase, waitingOn, iterations, newDomains, newChangeType, blockedOverride,
                openQuestions, reviewFeedback, history, failure, createdAt, now);
    }

    public Plan withOpenQuestions(List<String> questions, Instant now) {
        return new Plan(planId, title, phase, waitingOn, iterations, domains, changeType, blockedOverride,
                questions, reviewFeedback, history, failure, createdAt, now);
    }

    public Plan withReviewFeedback(String feedback, Instant now) {
        var updated = new ArrayList<>(reviewFeedback);
        updated.add(feedback);
        return new Plan(planId, title, phase, waitingOn, iterations, domains, changeType, blockedOverride,
                openQuestions, updated, history, failure, createdAt, now);
    }

    public Plan withBlockedOverride(boolean override, Instant now) {
        return new Plan(planId, title, phase, waitingOn, iterations, domains, changeType, override,
                openQuestions, reviewFeedback, history, failure, createdAt, now);
    }

    private Plan withFailure(PlanFailure planFailure) {
        return new Plan(planId, title, phase, waitingOn, iterations, domains, changeType, blockedOverride,
                openQuestions, reviewFeedback, history, planFailure, createdAt, updatedAt);
    }

    /** Phases entered, oldest first, including self-loops and loop-backs. */
    public List<PlanPhase> visitedPhases() {
        return history.stream().map(PhaseTransition::to).toList();
    }
}
