package com.planmarshall.core.error;

import java.util.List;

/**
 * Thrown when deliverable dependencies contain a cycle.
 */
public class DependencyCycleException extends PlanMarshallException {

    private final List<Integer> members;

    public DependencyCycleException(List<Integer> members) {
        super("Dependency cycle between deliverables " + members);
        this.members = List.copyOf(members);
    }

    /** Numbers of the deliverables that take part in the cycle, ascending. */
    public List<Integer> getMembers() {
        return members;
    }
}
