package com.planmarshall.core.nodes;

import com.planmarshall.core.config.OrchestratorConfig;
import com.planmarshall.core.error.EscalationException;
import com.planmarshall.core.error.IterationLimitExceededException;
import com.planmarshall.core.events.PlanEvent;
import com.planmarshall.core.model.CheckCategory;
import com.planmarshall.core.model.Deliverable;
import com.planmarshall.core.model.Finding;
import com.planmarshall.core.model.FindingRecord;
import com.planmarshall.core.model.FindingState;
import com.planmarshall.core.model.Plan;
import com.planmarshall.core.model.PlanPhase;
import com.planmarshall.core.model.Severity;
import com.planmarshall.core.model.Task;
import com.planmarshall.core.model.TaskStatus;
import com.planmarshall.core.store.PlanSnapshot;
import com.planmarshall.core.support.ResilientInvoker;
import com.planmarshall.core.task.TaskLedger;
import com.planmarshall.core.triage.TriageOutcome;
import com.planmarshall.core.triage.TriagePipeline;
import com.planmarshall.core.triage.TriageRequest;
import com.planmarshall.runner.VerificationReport;
import com.planmarshall.runner.VerificationRequest;
import com.planmarshall.runner.VerificationRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * 6-verify: runs the verification checks over what the plan touched, triages the findings and loops
 * back to 5-execute while fix tasks are produced, up to the configured number of loop-backs.
 */
@Component
public class VerifyPlanNode extends PhaseNode {

    private static final Logger log = LoggerFactory.getLogger(VerifyPlanNode.class);

    private final VerificationRunner verifier;
    private final TriagePipeline triage;
    private final TaskLedger ledger;
    private final ResilientInvoker invoker;
    private final OrchestratorConfig config;

    public VerifyPlanNode(PhaseSupport support, VerificationRunner verifier, TriagePipeline triage,
                          TaskLedger ledger, ResilientInvoker invoker, OrchestratorConfig config) {
        super(support);
        this.verifier = verifier;
        this.triage = triage;
        this.ledger = ledger;
        this.invoker = invoker;
        this.config = config;
    }

    @Override
    public PlanPhase phase() {
        return PlanPhase.VERIFY;
    }

    @Override
    protected PlanSnapshot run(PlanSnapshot snapshot) {
        var now = support.now();
        Plan plan = snapshot.plan().withIterations(snapshot.plan().iterations().incrementVerify(), now);
        int iteration = plan.iterations().verify();

        // Incidental findings of this iteration join triage; older untriaged ones are stale
        var carried = new ArrayList<Finding>();
        var findingLog = new ArrayList<FindingRecord>();
        for (var record : snapshot.findings()) {
            if (record.state() == FindingState.NEW && record.iteration() == iteration) {
                carried.add(record.finding());
            } else if (record.state() == FindingState.NEW) {
                findingLog.add(record.withState(FindingState.STALE, "not triaged before verify run " + iteration));
            } else {
                findingLog.add(record);
            }
        }

        var request = new VerificationRequest(plan.planId(), iteration, plan.domains(),
                touchedModules(snapshot.deliverables()), touchedFiles(snapshot.tasks()), snapshot.context());
        var findings = new ArrayList<Finding>();
        try {
            VerificationReport report = invoker.invoke("verify", null, () -> verifier.verify(request));
            if (report == null) {
                report = new VerificationReport(List.of(), Map.of());
            }
            findings.addAll(report.findings());
            findings.addAll(synthesizeFailedChecks(report));
        } catch (EscalationException e) {
            support.metrics().incrementEscalations("verify");
            findings.add(e.getFinding());
        }
        findings.addAll(carried);

        TriageOutcome fresh = triage.triage(new TriageRequest(findings, snapshot.context(), plan.domains(),
                iteration, ledger.nextTaskNumber(snapshot.tasks())));
        var outcome = new TriageOutcome(markReopened(snapshot.findings(), snapshot.tasks(), fresh.records()),
                fresh.fixTasks());
        findingLog.addAll(outcome.records());
        for (var record : outcome.records()) {
            support.metrics().recordTriageDecision(record.decision(), record.defaulted());
        }

        PlanSnapshot triaged = snapshot.withPlan(plan).withFindings(findingLog);
        if (outcome.fixTasks().isEmpty()) {
            log.info("Verify run {} of plan {} produced no fix tasks", iteration, plan.planId());
            var committed = support.commit(snapshot, triaged.withPlan(plan.transitionTo(PlanPhase.FINALIZE, "verified", now)));
            publishTriaged(committed.planId(), outcome);
            return committed;
        }

        if (plan.iterations().verifyLoopBacks() >= config.maxVerifyIterations()) {
            // Keep the triage result so the failure names the findings left unresolved
            support.commit(snapshot, triaged.withTasks(append(snapshot.tasks(), outcome.fixTasks())));
            publishTriaged(plan.planId(), outcome);
            throw new IterationLimitExceededException(PlanPhase.VERIFY, config.maxVerifyIterations());
        }

        log.info("Verify run {} of plan {} produced {} fix task(s); looping back to execute", iteration,
                plan.planId(), outcome.fixTasks().size());
        var committed = support.commit(snapshot, triaged
                .withTasks(append(snapshot.tasks(), outcome.fixTasks()))
                .withPlan(plan.transitionTo(PlanPhase.EXECUTE, "fix-tasks", now)));
        publishTriaged(committed.planId(), outcome);
        return committed;
    }

    /**
     * A failed check category that reported nothing still has to block the plan.
     */
    static List<Finding> synthesizeFailedChecks(VerificationReport report) {
        var synthesized = new ArrayList<Finding>();
        for (CheckCategory category : report.failedCategories()) {
            boolean reported = report.findings().stream().anyMatch(f -> Objects.equals(f.source(), category.source()));
            if (!reported) {
                synthesized.add(new Finding(null, category.source(), "check-failed/" + category.source(), null, null,
                        Severity.BLOCKER, category.source() + " check failed without reporting findings",
                        false, null, null));
            }
        }
        return synthesized;
    }

    /**
     * A finding reported again although the fix task created for it earlier is done is marked reopened.
     */
    static List<FindingRecord> markReopened(List<FindingRecord> history, List<Task> tasks,
                                            List<FindingRecord> triaged) {
        Set<Integer> done = tasks.stream()
                .filter(t -> t.status() == TaskStatus.DONE)
                .map(Task::number)
                .collect(Collectors.toSet());
        Map<String, Integer> fixedBy = new HashMap<>();
        for (var record : history) {
            if (record.state() == FindingState.FIX_TASK_CREATED && record.fixTask() != null
                    && done.contains(record.fixTask())) {
                fixedBy.put(record.id(), record.fixTask());
            }
        }
        var result = new ArrayList<FindingRecord>();
        for (var record : triaged) {
            Integer fixTask = fixedBy.get(record.id());
            if (fixTask == null) {
                result.add(record);
                continue;
            }
            log.warn("Finding {} reported again after fix task {} was done", record.id(), fixTask);
            String note = "reopened: fix task " + fixTask + " did not clear it";
            result.add(record.reopen(record.iteration(), record.note() == null ? note : note + "; " + record.note()));
        }
        return result;
    }

    private void publishTriaged(String planId, TriageOutcome outcome) {
        for (var record : outcome.records()) {
            if (record.reopened()) {
                support.metrics().recordReopenedFinding(PlanPhase.VERIFY);
                support.publish(PlanEvent.FINDING_REOPENED, planId, record.fixTask(), Map.of(
                        "findingId", record.id(),
                        "iteration", record.iteration()));
            }
            support.publish(PlanEvent.FINDING_TRIAGED, planId, record.fixTask(), Map.of(
                    "findingId", record.id(),
                    "decision", record.decision().name(),
                    "defaulted", record.defaulted()));
        }
    }

    private static List<String> touchedModules(List<Deliverable> deliverables) {
        var modules = new TreeSet<String>();
        deliverables.stream().map(Deliverable::module).filter(Objects::nonNull).forEach(modules::add);
        return List.copyOf(modules);
    }

    private static List<String> touchedFiles(List<Task> tasks) {
        var files = new TreeSet<String>();
        tasks.forEach(t -> files.addAll(t.fileTargets()));
        return List.copyOf(files);
    }

    private static List<Task> append(List<Task> tasks, List<Task> more) {
        var all = new ArrayList<>(tasks);
        all.addAll(more);
        return all;
    }
}
