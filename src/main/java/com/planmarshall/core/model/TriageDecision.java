package com.planmarshall.core.model;

/**
 * Classification of a finding by the triage pipeline.
 */
public enum TriageDecision {
    FIX,
    SUPPRESS,
    ACCEPT
}
