package com.planmarshall.core.model;

/**
 * One ordered step of a task.
 *
 * @param number     1-based position within the task
 * @param target     file path or verification target, e.g. {@code verify:java/unused-import}
 * @param outcome    current outcome
 * @param diagnostic executor diagnostic for failed or skipped steps, otherwise {@code null}
 */
public record TaskStep(int number, String target, StepOutcome outcome, String diagnostic) {

    public TaskStep {
        outcome = outcome == null ? StepOutcome.PENDING : outcome;
    }

    public static TaskStep pending(int number, String target) {
        return new TaskStep(number, target, StepOutcome.PENDING, null);
    }

    public TaskStep withOutcome(StepOutcome newOutcome, String newDiagnostic) {
        return new TaskStep(number, target, newOutcome, newDiagnostic);
    }
}
