package com.planmarshall.core.model;

/**
 * Strategy for executing tasks within the execute phase.
 * <p>
 * SEQUENTIAL: One task at a time, each sees prior changes (safest, slower).
 * PARALLEL: Independent tasks run concurrently up to maxParallel; dependency order is still respected.
 */
public enum ExecutionStrategy {
    SEQUENTIAL,
    PARALLEL
}
