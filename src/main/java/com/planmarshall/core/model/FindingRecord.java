package com.planmarshall.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * Entry of a plan's findings log: the finding plus what triage or a phase gate decided about it.
 *
 * @param finding   the finding
 * @param iteration verify run the finding belongs to; for gate findings, the iteration of their phase
 * @param state     triage or gate state
 * @param decision  triage decision, {@code null} while {@code NEW} and for gate findings
 * @param rationale rationale from the triage handler or default policy
 * @param defaulted whether the default policy decided instead of a domain handler
 * @param note      pipeline note, e.g. why a SUPPRESS was rejected or how a gate finding was resolved
 * @param fixTask   number of the fix task created for the finding, otherwise {@code null}
 * @param phase     phase the finding was recorded in, {@code 6-verify} when absent
 * @param reopened  whether the finding came back after it was fixed or resolved
 */
public record FindingRecord(
    Finding finding,
    int iteration,
    FindingState state,
    TriageDecision decision,
    String rationale,
    boolean defaulted,
    String note,
    Integer fixTask,
    PlanPhase phase,
    boolean reopened
) {

    /** Sources of findings raised at a phase gate rather than by verification. */
    public static final String QGATE_SOURCE = "qgate";
    public static final String USER_REVIEW_SOURCE = "user_review";

    public FindingRecord {
        state = state == null ? FindingState.NEW : state;
        phase = phase == null ? PlanPhase.VERIFY : phase;
    }

    public static FindingRecord newFinding(Finding finding, int iteration, PlanPhase phase) {
        return new FindingRecord(finding, iteration, FindingState.NEW, null, null, false, null, null, phase, false);
    }

    public static FindingRecord gateFinding(Finding finding, PlanPhase phase, int iteration) {
        return new FindingRecord(finding, iteration, FindingState.PENDING, null, null, false, null, null, phase, false);
    }

    public static boolean isGateSource(String source) {
        return QGATE_SOURCE.equals(source) || USER_REVIEW_SOURCE.equals(source);
    }

    public String id() {
        return finding.id();
    }

    @JsonIgnore
    public boolean isGateFinding() {
        return isGateSource(finding.source());
    }

    public FindingRecord withState(FindingState newState, String newNote) {
        return new FindingRecord(finding, iteration, newState, decision, rationale, defaulted, newNote, fixTask,
                phase, reopened);
    }

    public FindingRecord withFixTask(Integer newFixTask) {
        return new FindingRecord(finding, iteration, state, decision, rationale, defaulted, note, newFixTask,
                phase, reopened);
    }

    /** Marks the finding as recurring; a gate finding goes back to {@code PENDING}. */
    public FindingRecord reopen(int newIteration, String newNote) {
        return new FindingRecord(finding, newIteration, isGateFinding() ? FindingState.PENDING : state, decision,
                rationale, defaulted, newNote, fixTask, phase, true);
    }
}
