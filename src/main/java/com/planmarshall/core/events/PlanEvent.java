package com.planmarshall.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * An event emitted while a plan moves through its lifecycle.
 *
 * @param eventType  event type, e.g. "plan.created", "phase.entered", "task.blocked"
 * @param planId     the plan this event belongs to
 * @param taskNumber the task this event relates to (nullable for plan-level events)
 * @param payload    arbitrary key-value data associated with the event
 * @param timestamp  when the event occurred
 */
public record PlanEvent(
    String eventType,
    String planId,
    Integer taskNumber,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {

    public static final String PLAN_CREATED = "plan.created";
    public static final String PHASE_ENTERED = "phase.entered";
    public static final String PLAN_SUSPENDED = "plan.suspended";
    public static final String TASK_COMPLETED = "task.completed";
    public static final String TASK_BLOCKED = "task.blocked";
    public static final String FINDING_TRIAGED = "finding.triaged";
    public static final String FINDING_REOPENED = "finding.reopened";
    public static final String GATE_FINDING_RECORDED = "gate-finding.recorded";
    public static final String GATE_FINDING_RESOLVED = "gate-finding.resolved";
    public static final String PLAN_COMPLETED = "plan.completed";
    public static final String PLAN_FAILED = "plan.failed";
    public static final String PLAN_CANCELLED = "plan.cancelled";
}
