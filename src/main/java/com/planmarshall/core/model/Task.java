package com.planmarshall.core.model;

import java.util.ArrayList;
import java.util.List;

/**
 * An executable unit of work derived from a deliverable or created for a group of findings.
 *
 * @param number        plan-scoped sequence number
 * @param title         short title
 * @param deliverable   number of the source deliverable; {@code null} for fix tasks
 * @param status        execution status
 * @param profile       execution mode, e.g. "implementation", "testing"
 * @param domain        domain the task belongs to
 * @param changeType    change type inherited from the deliverable
 * @param executor      executor reference resolved during 4-plan; {@code null} selects by profile
 * @param steps         ordered steps
 * @param skills        skills the executor should load
 * @param origin        plan or fix
 * @param findingIds    findings a fix task addresses; empty for plan tasks
 * @param dependsOn     numbers of tasks that must be done first
 * @param blockedReason why the task is blocked, otherwise {@code null}
 */
public record Task(
    int number,
    String title,
    Integer deliverable,
    TaskStatus status,
    String profile,
    String domain,
    ChangeType changeType,
    String executor,
    List<TaskStep> steps,
    List<String> skills,
    TaskOrigin origin,
    List<String> findingIds,
    List<Integer> dependsOn,
    String blockedReason
) {

    public Task {
        status = status == null ? TaskStatus.PENDING : status;
        origin = origin == null ? TaskOrigin.PLAN : origin;
        steps = steps == null ? List.of() : List.copyOf(steps);
        skills = skills == null ? List.of() : List.copyOf(skills);
        findingIds = findingIds == null ? List.of() : List.copyOf(findingIds);
        dependsOn = dependsOn == null ? List.of() : List.copyOf(dependsOn);
    }

    /** Display id in the {@code TASK-001} form used in logs and events. */
    public String displayId() {
        return String.format("TASK-%03d", number);
    }

    public Task withStatus(TaskStatus newStatus, String reason) {
        return new Task(number, title, deliverable, newStatus, profile, domain, changeType, executor,
                steps, skills, origin, findingIds, dependsOn, reason);
    }

    public Task withStep(int index, TaskStep step) {
        var updated = new ArrayList<>(steps);
        updated.set(index, step);
        return new Task(number, title, deliverable, status, profile, domain, changeType, executor,
                updated, skills, origin, findingIds, dependsOn, blockedReason);
    }

    public List<String> fileTargets() {
        return steps.stream()
                .map(TaskStep::target)
                .filter(t -> !t.startsWith(VERIFY_STEP_PREFIX))
                .toList();
    }

    public static final String VERIFY_STEP_PREFIX = "verify:";
}
