package com.planmarshall.core.task;

import com.planmarshall.core.error.ValidationException;
import com.planmarshall.core.model.ChangeType;
import com.planmarshall.core.model.Deliverable;
import com.planmarshall.core.model.Finding;
import com.planmarshall.core.model.FindingRecord;
import com.planmarshall.core.model.StepOutcome;
import com.planmarshall.core.model.Task;
import com.planmarshall.core.model.TaskOrigin;
import com.planmarshall.core.model.TaskStatus;
import com.planmarshall.core.model.TaskStep;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Task state changes: step outcomes, fix tasks, blocked propagation and referential integrity.
 * All methods return new task instances; callers commit them through the plan store.
 */
@Service
public class TaskLedger {

    private static final Logger log = LoggerFactory.getLogger(TaskLedger.class);

    public static final String FIX_PROFILE = "implementation";

    /**
     * Records the outcome of one step.
     * <p>
     * A failed step blocks the task. Once every step is done or skipped the task is done.
     *
     * @throws ValidationException if the index is out of range, the outcome is {@code PENDING},
     *                             or the task already reached a terminal status
     */
    public StepOutcomeResult recordStepOutcome(Task task, int stepIndex, StepOutcome outcome, String diagnostic) {
        if (task.status().isTerminal()) {
            throw new ValidationException(task.displayId() + " is " + task.status() + " and accepts no step outcomes");
        }
        if (stepIndex < 0 || stepIndex >= task.steps().size()) {
            throw new ValidationException("Step index " + stepIndex + " out of range for " + task.displayId()
                    + " with " + task.steps().size() + " step(s)");
        }
        if (outcome == null || outcome == StepOutcome.PENDING) {
            throw new ValidationException("Step outcome must be DONE, SKIPPED or FAILED");
        }

        TaskStep step = task.steps().get(stepIndex).withOutcome(outcome, diagnostic);
        Task updated = task.withStep(stepIndex, step);

        if (outcome == StepOutcome.FAILED) {
            String reason = "step " + step.number() + " (" + step.target() + ") failed"
                    + (diagnostic == null || diagnostic.isBlank() ? "" : ": " + diagnostic);
            log.warn("{} blocked: {}", task.displayId(), reason);
            return new StepOutcomeResult(updated.withStatus(TaskStatus.BLOCKED, reason), true);
        }
        boolean allFinished = updated.steps().stream().allMatch(s -> s.outcome().isFinished());
        return new StepOutcomeResult(
                updated.withStatus(allFinished ? TaskStatus.DONE : TaskStatus.IN_PROGRESS, null), false);
    }

    /**
     * Builds a fix task for findings that share one target: one step per distinct location, then one
     * {@code verify:<rule>} step per distinct rule re-checking what was reported.
     */
    public Task addFixTask(int number, String target, List<Finding> findings, String executor) {
        if (findings == null || findings.isEmpty()) {
            throw new ValidationException("A fix task needs at least one finding");
        }
        var locations = new LinkedHashSet<String>();
        var rules = new LinkedHashSet<String>();
        for (var f : findings) {
            locations.add(f.file() != null && !f.file().isBlank() ? f.file() : target);
            rules.add(f.rule() == null || f.rule().isBlank() ? "unspecified" : f.rule());
        }
        var steps = new ArrayList<TaskStep>();
        for (String location : locations) {
            steps.add(TaskStep.pending(steps.size() + 1, location));
        }
        for (String rule : rules) {
            steps.add(TaskStep.pending(steps.size() + 1, Task.VERIFY_STEP_PREFIX + rule));
        }

        Finding first = findings.get(0);
        return new Task(number, "Fix " + findings.size() + " finding(s) in " + target, null, TaskStatus.PENDING,
                FIX_PROFILE, first.domain(), ChangeType.BUG_FIX, executor, steps, List.of(), TaskOrigin.FIX,
                findings.stream().map(Finding::id).toList(), List.of(), null);
    }

    /**
     * Marks every unfinished task that (transitively) depends on a blocked task as blocked.
     */
    public List<Task> blockDependents(List<Task> tasks) {
        Map<Integer, Task> byNumber = new HashMap<>();
        tasks.forEach(t -> byNumber.put(t.number(), t));

        boolean changed = true;
        while (changed) {
            changed = false;
            for (var task : List.copyOf(byNumber.values())) {
                if (task.status().isTerminal()) continue;
                for (int dep : task.dependsOn()) {
                    Task prerequisite = byNumber.get(dep);
                    if (prerequisite != null && prerequisite.status() == TaskStatus.BLOCKED) {
                        String reason = "depends on blocked " + prerequisite.displayId();
                        log.info("{} blocked: {}", task.displayId(), reason);
                        byNumber.put(task.number(), task.withStatus(TaskStatus.BLOCKED, reason));
                        changed = true;
                        break;
                    }
                }
            }
        }
        return tasks.stream().map(t -> byNumber.get(t.number())).toList();
    }

    /**
     * Every task resolves to exactly one deliverable, or is a fix task naming logged findings.
     * Task numbers are unique and dependencies point at existing tasks.
     *
     * @throws ValidationException on the first violation
     */
    public void validateReferences(List<Task> tasks, List<Deliverable> deliverables, List<FindingRecord> findings) {
        Set<Integer> deliverableNumbers = deliverables.stream().map(Deliverable::number).collect(Collectors.toSet());
        Set<String> findingIds = findings.stream().map(FindingRecord::id).collect(Collectors.toSet());
        Set<Integer> taskNumbers = new HashSet<>();
        for (var task : tasks) {
            if (!taskNumbers.add(task.number())) {
                throw new ValidationException("Duplicate task number " + task.number());
            }
        }
        for (var task : tasks) {
            if (task.origin() == TaskOrigin.PLAN) {
                if (task.deliverable() == null || !deliverableNumbers.contains(task.deliverable())) {
                    throw new ValidationException(task.displayId() + " references unknown deliverable "
                            + task.deliverable());
                }
            } else {
                if (task.deliverable() != null) {
                    throw new ValidationException(task.displayId() + " is a fix task but references a deliverable");
                }
                if (task.findingIds().isEmpty() || !findingIds.containsAll(task.findingIds())) {
                    throw new ValidationException(task.displayId() + " references unknown findings "
                            + task.findingIds());
                }
            }
            for (int dep : task.dependsOn()) {
                if (!taskNumbers.contains(dep)) {
                    throw new ValidationException(task.displayId() + " depends on unknown task " + dep);
                }
            }
        }
    }

    /** A task may start only once each of its dependencies is done. */
    public boolean dependenciesDone(Task task, List<Task> tasks) {
        Map<Integer, TaskStatus> status = new HashMap<>();
        tasks.forEach(t -> status.put(t.number(), t.status()));
        return task.dependsOn().stream().allMatch(dep -> status.get(dep) == TaskStatus.DONE);
    }

    public int nextTaskNumber(List<Task> tasks) {
        return tasks.stream().mapToInt(Task::number).max().orElse(0) + 1;
    }
}
