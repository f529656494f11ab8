package com.planmarshall.core.task;

import com.planmarshall.core.model.Task;

/**
 * Result of recording a step outcome.
 *
 * @param task     the updated task
 * @param blocking whether the outcome blocked the task; 5-execute cannot close while blocked tasks remain
 */
public record StepOutcomeResult(Task task, boolean blocking) {}
