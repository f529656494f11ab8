package com.planmarshall.runner;

import java.util.Set;

/**
 * Performs the steps of a task. Invoked once per task during 5-execute.
 */
public interface TaskExecutor {

    /** Reference matched against {@code Task.executor()} as returned by change-type agents. */
    String id();

    /** Profiles this executor handles; empty means any profile. */
    default Set<String> profiles() {
        return Set.of();
    }

    ExecutionReport execute(ExecutionRequest request);
}
