package com.planmarshall.core.model;

/**
 * Where a task came from: derived from a deliverable, or created by triage for one or more findings.
 */
public enum TaskOrigin {
    PLAN,
    FIX
}
