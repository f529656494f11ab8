package com.planmarshall.runner;

import com.planmarshall.core.model.Finding;

import java.util.List;

/**
 * @param stepResults per-step outcomes; steps without a result are treated as failed
 * @param findings    findings discovered incidentally while executing
 */
public record ExecutionReport(List<StepResult> stepResults, List<Finding> findings) {

    public ExecutionReport {
        stepResults = stepResults == null ? List.of() : List.copyOf(stepResults);
        findings = findings == null ? List.of() : List.copyOf(findings);
    }
}
