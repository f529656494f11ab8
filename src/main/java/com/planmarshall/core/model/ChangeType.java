package com.planmarshall.core.model;

/**
 * Kind of change a deliverable introduces. Selects the executor through a domain's change-type agent.
 */
public enum ChangeType {
    FEATURE,
    BUG_FIX,
    ENHANCEMENT,
    TECH_DEBT
}
