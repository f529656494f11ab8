package com.planmarshall.core.nodes;

import com.planmarshall.core.events.EventBus;
import com.planmarshall.core.events.PlanEvent;
import com.planmarshall.core.metrics.PlanMetrics;
import com.planmarshall.core.model.FailureKind;
import com.planmarshall.core.model.Finding;
import com.planmarshall.core.model.FindingRecord;
import com.planmarshall.core.model.FindingState;
import com.planmarshall.core.model.PhaseTransition;
import com.planmarshall.core.model.Plan;
import com.planmarshall.core.model.PlanFailure;
import com.planmarshall.core.model.PlanPhase;
import com.planmarshall.core.model.Task;
import com.planmarshall.core.model.TaskStatus;
import com.planmarshall.core.store.PlanSnapshot;
import com.planmarshall.core.store.PlanStore;
import com.planmarshall.core.task.TaskLedger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Plan state plumbing shared by the phase nodes and the orchestrator: loading, committing with
 * referential checks, failure and cancellation, and the events and metrics that follow a commit.
 */
@Component
public class PhaseSupport {

    private static final Logger log = LoggerFactory.getLogger(PhaseSupport.class);

    private final PlanStore store;
    private final TaskLedger ledger;
    private final EventBus eventBus;
    private final PlanMetrics metrics;
    private final Clock clock;
    private final Set<String> cancelRequests = ConcurrentHashMap.newKeySet();

    public PhaseSupport(PlanStore store, TaskLedger ledger, EventBus eventBus, PlanMetrics metrics, Clock clock) {
        this.store = store;
        this.ledger = ledger;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.clock = clock;
    }

    public Instant now() {
        return clock.instant();
    }

    public PlanSnapshot load(String planId) {
        return store.load(planId);
    }

    /**
     * Validates task references and commits {@code next} atomically, then publishes events for
     * everything that changed relative to {@code base} ({@code null} for a new plan).
     *
     * @return the committed snapshot
     */
    public PlanSnapshot commit(PlanSnapshot base, PlanSnapshot next) {
        ledger.validateReferences(next.tasks(), next.deliverables(), next.findings());
        store.commit(next);
        publishChanges(base, next);
        return next;
    }

    /**
     * Moves the plan to {@code failed}, recording every unresolved finding id in log order.
     */
    public PlanSnapshot fail(PlanSnapshot snapshot, FailureKind kind, String message) {
        Plan plan = snapshot.plan();
        if (plan.isTerminal()) {
            return snapshot;
        }
        var failure = new PlanFailure(kind, plan.phase(), message, unresolvedFindingIds(snapshot));
        log.error("Plan {} failed in {} ({}): {}; unresolved findings {}", plan.planId(), plan.phase(), kind,
                message, failure.unresolvedFindingIds());
        return commit(snapshot, snapshot.withPlan(plan.fail(failure, now())));
    }

    /** Appends findings raised in {@code phase} to the log as {@code NEW} records of the given verify iteration. */
    public PlanSnapshot logFindings(PlanSnapshot snapshot, List<Finding> findings, int iteration, PlanPhase phase) {
        if (findings.isEmpty()) {
            return snapshot;
        }
        var updated = new ArrayList<>(snapshot.findings());
        for (var finding : findings) {
            updated.add(FindingRecord.newFinding(finding, iteration, phase));
        }
        return snapshot.withFindings(updated);
    }

    public List<String> unresolvedFindingIds(PlanSnapshot snapshot) {
        Map<Integer, TaskStatus> taskStatus = new HashMap<>();
        for (Task task : snapshot.tasks()) {
            taskStatus.put(task.number(), task.status());
        }
        return snapshot.findings().stream()
                .filter(r -> r.state() == FindingState.NEW || r.state() == FindingState.PENDING
                        || (r.state() == FindingState.FIX_TASK_CREATED
                            && (r.fixTask() == null || taskStatus.get(r.fixTask()) != TaskStatus.DONE)))
                .map(FindingRecord::id)
                .distinct()
                .toList();
    }

    public void requestCancel(String planId) {
        cancelRequests.add(planId);
    }

    public boolean isCancelRequested(String planId) {
        return cancelRequests.contains(planId);
    }

    public void clearCancelRequest(String planId) {
        cancelRequests.remove(planId);
    }

    /**
     * Applies a pending cancellation. Only called at phase boundaries, so no task is mid-update.
     */
    public PlanSnapshot cancel(PlanSnapshot snapshot) {
        Plan plan = snapshot.plan();
        cancelRequests.remove(plan.planId());
        if (plan.isTerminal()) {
            return snapshot;
        }
        log.info("Cancelling plan {} in {}", plan.planId(), plan.phase());
        return commit(snapshot, snapshot.withPlan(plan.transitionTo(PlanPhase.CANCELLED, "cancelled", now())));
    }

    public void publish(String eventType, String planId, Integer taskNumber, Map<String, Object> payload) {
        eventBus.publish(new PlanEvent(eventType, planId, taskNumber, payload, now()));
    }

    public PlanMetrics metrics() {
        return metrics;
    }

    private void publishChanges(PlanSnapshot base, PlanSnapshot next) {
        Plan before = base == null ? null : base.plan();
        Plan after = next.plan();
        String planId = after.planId();

        List<PhaseTransition> history = after.history();
        int seen = before == null ? 0 : before.history().size();
        for (var transition : history.subList(Math.min(seen, history.size()), history.size())) {
            var payload = new HashMap<String, Object>();
            payload.put("from", transition.from() == null ? "" : transition.from().tag());
            payload.put("to", transition.to().tag());
            payload.put("reason", transition.reason());
            publish(PlanEvent.PHASE_ENTERED, planId, null, payload);
            if (transition.from() != null
                    && (transition.from() == transition.to() || transition.from().isLoopBackTo(transition.to()))) {
                metrics.recordLoopBack(transition.to());
            }
            if (transition.to().isTerminal()) {
                metrics.recordPlanResult(transition.to());
                publish(terminalEvent(transition.to()), planId, null, terminalPayload(after));
            }
        }

        if (after.isSuspended() && (before == null || before.waitingOn() != after.waitingOn())) {
            publish(PlanEvent.PLAN_SUSPENDED, planId, null, Map.of(
                    "phase", after.phase().tag(),
                    "waitingOn", after.waitingOn().name(),
                    "openQuestions", after.openQuestions()));
            log.info("Plan {} suspended in {} waiting on {}", planId, after.phase(), after.waitingOn());
        }
    }

    private static String terminalEvent(PlanPhase phase) {
        return switch (phase) {
            case COMPLETE -> PlanEvent.PLAN_COMPLETED;
            case FAILED -> PlanEvent.PLAN_FAILED;
            default -> PlanEvent.PLAN_CANCELLED;
        };
    }

    private static Map<String, Object> terminalPayload(Plan plan) {
        var payload = new HashMap<String, Object>();
        payload.put("iterations", plan.iterations().toString());
        if (plan.failure() != null) {
            payload.put("kind", plan.failure().kind().name());
            payload.put("message", plan.failure().message());
            payload.put("unresolvedFindingIds", plan.failure().unresolvedFindingIds());
        }
        return payload;
    }
}
