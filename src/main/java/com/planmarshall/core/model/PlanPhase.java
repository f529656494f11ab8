package com.planmarshall.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * Lifecycle phase of a plan.
 * <p>
 * The seven working phases run in order; {@code COMPLETE}, {@code FAILED} and
 * {@code CANCELLED} are terminal. Only the transitions accepted by
 * {@link #canTransitionTo(PlanPhase)} are ever recorded.
 */
public enum PlanPhase {
    INIT("1-init", 1),
    REFINE("2-refine", 2),
    OUTLINE("3-outline", 3),
    PLAN("4-plan", 4),
    EXECUTE("5-execute", 5),
    VERIFY("6-verify", 6),
    FINALIZE("7-finalize", 7),
    COMPLETE("complete", 8),
    FAILED("failed", 9),
    CANCELLED("cancelled", 10);

    private final String tag;
    private final int order;

    PlanPhase(String tag, int order) {
        this.tag = tag;
        this.order = order;
    }

    @JsonValue
    public String tag() {
        return tag;
    }

    public int order() {
        return order;
    }

    public boolean isTerminal() {
        return this == COMPLETE || this == FAILED || this == CANCELLED;
    }

    /** Phases that may re-enter themselves. */
    public boolean isSelfLoopEligible() {
        return this == REFINE || this == OUTLINE;
    }

    public boolean canTransitionTo(PlanPhase next) {
        if (isTerminal()) {
            return false;
        }
        if (next == FAILED || next == CANCELLED) {
            return true;
        }
        if (next == this) {
            return isSelfLoopEligible();
        }
        if (this == VERIFY && next == EXECUTE) {
            return true;
        }
        return next.order == order + 1;
    }

    /** A transition to a strictly earlier phase (the verify to execute loop-back). */
    public boolean isLoopBackTo(PlanPhase next) {
        return !next.isTerminal() && next.order < order;
    }

    @JsonCreator
    public static PlanPhase fromTag(String tag) {
        return Arrays.stream(values())
                .filter(p -> p.tag.equals(tag) || p.name().equals(tag))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown plan phase: " + tag));
    }

    @Override
    public String toString() {
        return tag;
    }
}
