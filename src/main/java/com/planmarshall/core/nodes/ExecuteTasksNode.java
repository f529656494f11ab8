package com.planmarshall.core.nodes;

import com.planmarshall.core.config.OrchestratorConfig;
import com.planmarshall.core.error.EscalationException;
import com.planmarshall.core.error.ValidationException;
import com.planmarshall.core.events.PlanEvent;
import com.planmarshall.core.logging.MdcContext;
import com.planmarshall.core.model.ExecutionStrategy;
import com.planmarshall.core.model.Finding;
import com.planmarshall.core.model.Plan;
import com.planmarshall.core.model.PlanPhase;
import com.planmarshall.core.model.StepOutcome;
import com.planmarshall.core.model.Task;
import com.planmarshall.core.model.TaskStatus;
import com.planmarshall.core.model.WaitReason;
import com.planmarshall.core.store.PlanSnapshot;
import com.planmarshall.core.support.ResilientInvoker;
import com.planmarshall.core.task.TaskLedger;
import com.planmarshall.core.task.TaskScheduler;
import com.planmarshall.runner.ExecutionReport;
import com.planmarshall.runner.ExecutionRequest;
import com.planmarshall.runner.StepResult;
import com.planmarshall.runner.TaskExecutor;
import com.planmarshall.runner.TaskExecutorSelector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * 5-execute: runs tasks wave by wave until every task is done or blocked.
 * <p>
 * Each wave holds tasks whose dependencies are done. Under {@link ExecutionStrategy#PARALLEL} a wave
 * runs on a fixed pool bounded by {@code maxParallel}; its results are committed together once the
 * whole wave has finished. Execution failures stay with their task as blocked status and never abort
 * the phase. The phase closes once nothing is runnable: blocked tasks without an override suspend the
 * plan, otherwise it moves to 6-verify.
 */
@Component
public class ExecuteTasksNode extends PhaseNode {

    private static final Logger log = LoggerFactory.getLogger(ExecuteTasksNode.class);

    private final TaskScheduler scheduler;
    private final TaskLedger ledger;
    private final TaskExecutorSelector selector;
    private final ResilientInvoker invoker;
    private final OrchestratorConfig config;

    public ExecuteTasksNode(PhaseSupport support, TaskScheduler scheduler, TaskLedger ledger,
                            TaskExecutorSelector selector, ResilientInvoker invoker, OrchestratorConfig config) {
        super(support);
        this.scheduler = scheduler;
        this.ledger = ledger;
        this.selector = selector;
        this.invoker = invoker;
        this.config = config;
    }

    @Override
    public PlanPhase phase() {
        return PlanPhase.EXECUTE;
    }

    @Override
    protected PlanSnapshot run(PlanSnapshot snapshot) {
        String planId = snapshot.planId();
        PlanSnapshot current = propagateBlocked(snapshot);
        int waveNumber = 0;

        while (true) {
            List<Integer> wave = scheduler.computeNextWave(current.tasks(), config.executionStrategy(),
                    config.maxParallel());
            if (wave.isEmpty()) break;
            if (support.isCancelRequested(planId)) {
                log.info("Cancellation requested for plan {}; stopping before wave {}", planId, waveNumber + 1);
                return current;
            }
            waveNumber++;
            log.info("Plan {} wave {}: tasks {}", planId, waveNumber, wave);
            support.metrics().recordWaveExecution(wave.size(), config.executionStrategy().name().toLowerCase());

            current = support.commit(current, current.withTasks(markInProgress(current.tasks(), wave)));
            List<TaskRun> runs = runWave(current, wave);
            current = support.commit(current, applyRuns(current, runs));
            for (var run : runs) {
                publishTaskOutcome(planId, run.task());
            }
        }

        var plan = current.plan();
        var pending = current.tasks().stream().filter(t -> !t.status().isTerminal()).toList();
        if (!pending.isEmpty()) {
            throw new ValidationException("Tasks " + pending.stream().map(Task::displayId).toList()
                    + " can never run: dependencies are neither done nor blocked");
        }
        long blocked = current.tasks().stream().filter(t -> t.status() == TaskStatus.BLOCKED).count();
        var now = support.now();
        Plan next;
        if (blocked > 0 && !plan.blockedOverride()) {
            log.warn("Plan {} has {} blocked task(s); waiting for override", planId, blocked);
            next = plan.waitFor(WaitReason.BLOCKED_TASKS, now);
        } else {
            next = plan.transitionTo(PlanPhase.VERIFY, blocked > 0 ? "blocked-override" : "tasks-done", now);
        }
        return support.commit(current, current.withPlan(next));
    }

    private PlanSnapshot propagateBlocked(PlanSnapshot snapshot) {
        var tasks = ledger.blockDependents(snapshot.tasks());
        if (tasks.equals(snapshot.tasks())) {
            return snapshot;
        }
        return support.commit(snapshot, snapshot.withTasks(tasks));
    }

    private List<Task> markInProgress(List<Task> tasks, List<Integer> wave) {
        return tasks.stream()
                .map(t -> wave.contains(t.number()) && t.status() == TaskStatus.PENDING
                        ? t.withStatus(TaskStatus.IN_PROGRESS, null) : t)
                .toList();
    }

    private List<TaskRun> runWave(PlanSnapshot snapshot, List<Integer> wave) {
        Map<Integer, Task> byNumber = new HashMap<>();
        snapshot.tasks().forEach(t -> byNumber.put(t.number(), t));
        List<Task> waveTasks = wave.stream().map(byNumber::get).toList();

        if (waveTasks.size() == 1 || config.executionStrategy() == ExecutionStrategy.SEQUENTIAL) {
            var runs = new ArrayList<TaskRun>();
            for (var task : waveTasks) {
                runs.add(runTask(snapshot, task));
            }
            return runs;
        }

        ExecutorService pool = Executors.newFixedThreadPool(Math.min(waveTasks.size(), config.maxParallel()));
        try {
            var futures = new LinkedHashMap<Task, Future<TaskRun>>();
            for (var task : waveTasks) {
                futures.put(task, pool.submit(() -> runTask(snapshot, task)));
            }
            var runs = new ArrayList<TaskRun>();
            for (var entry : futures.entrySet()) {
                runs.add(await(entry.getKey(), entry.getValue()));
            }
            return runs;
        } finally {
            pool.shutdown();
        }
    }

    private TaskRun await(Task task, Future<TaskRun> future) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return blockedRun(task, "interrupted while executing", List.of());
        } catch (ExecutionException e) {
            log.error("{} failed unexpectedly: {}", task.displayId(), e.getCause().getMessage(), e.getCause());
            return blockedRun(task, "executor error: " + e.getCause().getMessage(), List.of());
        }
    }

    private TaskRun runTask(PlanSnapshot snapshot, Task task) {
        String planId = snapshot.planId();
        MdcContext.setTask(planId, task);
        try {
            Optional<TaskExecutor> executor = selector.select(task);
            if (executor.isEmpty()) {
                return blockedRun(task, "no executor for profile '" + task.profile() + "'", List.of());
            }
            log.info("Dispatching {} [{}] to executor {}", task.displayId(), task.profile(), executor.get().id());

            ExecutionReport report;
            try {
                report = invoker.invoke("execute", task.domain(),
                        () -> executor.get().execute(new ExecutionRequest(planId, task, snapshot.context())));
            } catch (EscalationException e) {
                support.metrics().incrementEscalations("execute");
                return blockedRun(task, e.getMessage(), List.of(e.getFinding()));
            } catch (RuntimeException e) {
                log.error("{} executor {} threw: {}", task.displayId(), executor.get().id(), e.getMessage(), e);
                return blockedRun(task, "executor error: " + e.getMessage(), List.of());
            }
            if (report == null) {
                return blockedRun(task, "executor returned no report", List.of());
            }
            return new TaskRun(applyStepResults(task, report.stepResults()), report.findings());
        } finally {
            MdcContext.clearTask();
        }
    }

    /**
     * Applies results in step order. Steps the executor did not report on fail the task.
     */
    private Task applyStepResults(Task task, List<StepResult> results) {
        Task current = task;
        var sorted = results.stream().sorted(Comparator.comparingInt(StepResult::stepIndex)).toList();
        for (var result : sorted) {
            if (current.status().isTerminal()) break;
            try {
                current = ledger.recordStepOutcome(current, result.stepIndex(), result.outcome(),
                        result.diagnostic()).task();
            } catch (ValidationException e) {
                return current.withStatus(TaskStatus.BLOCKED, "invalid executor report: " + e.getMessage());
            }
        }
        for (int i = 0; i < current.steps().size() && !current.status().isTerminal(); i++) {
            if (!current.steps().get(i).outcome().isFinished()) {
                current = ledger.recordStepOutcome(current, i, StepOutcome.FAILED, "executor reported no outcome").task();
            }
        }
        if (current.steps().isEmpty() && !current.status().isTerminal()) {
            current = current.withStatus(TaskStatus.DONE, null);
        }
        return current;
    }

    private PlanSnapshot applyRuns(PlanSnapshot snapshot, List<TaskRun> runs) {
        Map<Integer, Task> updated = new HashMap<>();
        var findings = new ArrayList<Finding>();
        for (var run : runs) {
            updated.put(run.task().number(), run.task());
            findings.addAll(run.findings());
        }
        var tasks = ledger.blockDependents(snapshot.tasks().stream()
                .map(t -> updated.getOrDefault(t.number(), t))
                .toList());
        // Incidental findings are triaged with the next verify run
        int nextVerify = snapshot.plan().iterations().verify() + 1;
        return support.logFindings(snapshot.withTasks(tasks), findings, nextVerify, PlanPhase.EXECUTE);
    }

    private TaskRun blockedRun(Task task, String reason, List<Finding> findings) {
        log.warn("{} blocked: {}", task.displayId(), reason);
        return new TaskRun(task.withStatus(TaskStatus.BLOCKED, reason), findings);
    }

    private void publishTaskOutcome(String planId, Task task) {
        support.metrics().recordTaskOutcome(task.profile(), task.status());
        if (task.status() == TaskStatus.DONE) {
            support.publish(PlanEvent.TASK_COMPLETED, planId, task.number(), Map.of("profile", task.profile()));
        } else if (task.status() == TaskStatus.BLOCKED) {
            support.publish(PlanEvent.TASK_BLOCKED, planId, task.number(), Map.of(
                    "profile", task.profile(),
                    "reason", task.blockedReason() == null ? "" : task.blockedReason()));
        }
    }

    private record TaskRun(Task task, List<Finding> findings) {}
}
