package com.planmarshall.core.store;

import com.planmarshall.core.model.Deliverable;
import com.planmarshall.core.model.FindingRecord;
import com.planmarshall.core.model.Plan;
import com.planmarshall.core.model.PlanRequest;
import com.planmarshall.core.model.ProjectContext;
import com.planmarshall.core.model.Task;

import java.util.List;

/**
 * Every persisted artifact of one plan. Committed as a unit by {@link PlanStore#commit}.
 */
public record PlanSnapshot(
    Plan plan,
    PlanRequest request,
    ProjectContext context,
    List<Deliverable> deliverables,
    List<Task> tasks,
    List<FindingRecord> findings
) {

    public PlanSnapshot {
        context = context == null ? ProjectContext.empty() : context;
        deliverables = deliverables == null ? List.of() : List.copyOf(deliverables);
        tasks = tasks == null ? List.of() : List.copyOf(tasks);
        findings = findings == null ? List.of() : List.copyOf(findings);
    }

    public static PlanSnapshot initial(Plan plan, PlanRequest request, ProjectContext context) {
        return new PlanSnapshot(plan, request, context, List.of(), List.of(), List.of());
    }

    public String planId() {
        return plan.planId();
    }

    public PlanSnapshot withPlan(Plan updated) {
        return new PlanSnapshot(updated, request, context, deliverables, tasks, findings);
    }

    public PlanSnapshot withRequest(PlanRequest updated) {
        return new PlanSnapshot(plan, updated, context, deliverables, tasks, findings);
    }

    public PlanSnapshot withDeliverables(List<Deliverable> updated) {
        return new PlanSnapshot(plan, request, context, updated, tasks, findings);
    }

    public PlanSnapshot withTasks(List<Task> updated) {
        return new PlanSnapshot(plan, request, context, deliverables, updated, findings);
    }

    public PlanSnapshot withFindings(List<FindingRecord> updated) {
        return new PlanSnapshot(plan, request, context, deliverables, tasks, updated);
    }
}
