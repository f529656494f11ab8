package com.planmarshall.runner;

import com.planmarshall.core.model.ProjectContext;
import com.planmarshall.core.model.Task;

/**
 * One task handed to a {@link TaskExecutor}. Domain and skills are carried by the task.
 */
public record ExecutionRequest(String planId, Task task, ProjectContext context) {}
