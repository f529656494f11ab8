package com.planmarshall.core.model;

/**
 * External event a suspended plan is waiting for before its current phase is re-evaluated.
 */
public enum WaitReason {
    NONE,
    CLARIFICATION,   // 2-refine: answers to clarifying questions
    REVIEW,          // 3-outline: approval or rejection of the deliverables
    BLOCKED_TASKS    // 5-execute: explicit override to close with blocked tasks
}
