package com.planmarshall.runner;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;

/**
 * Executor registered when the host provides none. Fails every step so that tasks end up blocked
 * instead of being reported as done.
 */
public class UnconfiguredTaskExecutor implements TaskExecutor {

    private static final Logger log = LoggerFactory.getLogger(UnconfiguredTaskExecutor.class);

    public static final String ID = "unconfigured";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public ExecutionReport execute(ExecutionRequest request) {
        log.warn("No task executor configured; failing {} of plan {}", request.task().displayId(), request.planId());
        var results = new ArrayList<StepResult>();
        for (int i = 0; i < request.task().steps().size(); i++) {
            results.add(StepResult.failed(i, "no task executor configured"));
        }
        return new ExecutionReport(results, null);
    }
}
