package com.planmarshall.core.triage;

import com.planmarshall.core.model.Finding;
import com.planmarshall.core.model.ProjectContext;

import java.util.List;

/**
 * Input of one triage run.
 *
 * @param findings           findings of the current verify iteration, in any order
 * @param context            project context used to resolve a finding's domain from its module
 * @param planDomains        plan domains; the first is used when a finding names neither domain nor module
 * @param iteration          verify iteration the findings belong to
 * @param firstFixTaskNumber number given to the first fix task created
 */
public record TriageRequest(
    List<Finding> findings,
    ProjectContext context,
    List<String> planDomains,
    int iteration,
    int firstFixTaskNumber
) {

    public TriageRequest {
        findings = findings == null ? List.of() : List.copyOf(findings);
        context = context == null ? ProjectContext.empty() : context;
        planDomains = planDomains == null ? List.of() : List.copyOf(planDomains);
    }
}
