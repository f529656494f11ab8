package com.planmarshall.core.model;

public enum StepOutcome {
    PENDING,
    DONE,
    SKIPPED,
    FAILED;

    public boolean isFinished() {
        return this == DONE || this == SKIPPED;
    }
}
