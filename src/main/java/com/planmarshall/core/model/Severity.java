package com.planmarshall.core.model;

/**
 * Finding severity, declared from most to least severe.
 */
public enum Severity {
    BLOCKER,
    MAJOR,
    MINOR,
    INFO;

    /** Higher value means more severe. */
    public int rank() {
        return values().length - ordinal();
    }
}
