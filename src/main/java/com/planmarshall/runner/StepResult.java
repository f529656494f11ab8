package com.planmarshall.runner;

import com.planmarshall.core.model.StepOutcome;

/**
 * @param stepIndex  0-based index into the task's steps
 * @param outcome    DONE, SKIPPED or FAILED
 * @param diagnostic executor message, required for FAILED
 */
public record StepResult(int stepIndex, StepOutcome outcome, String diagnostic) {

    public static StepResult done(int stepIndex) {
        return new StepResult(stepIndex, StepOutcome.DONE, null);
    }

    public static StepResult failed(int stepIndex, String diagnostic) {
        return new StepResult(stepIndex, StepOutcome.FAILED, diagnostic);
    }
}
