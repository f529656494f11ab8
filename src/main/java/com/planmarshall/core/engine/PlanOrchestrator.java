package com.planmarshall.core.engine;

import com.planmarshall.core.config.OrchestratorConfig;
import com.planmarshall.core.error.ValidationException;
import com.planmarshall.core.events.PlanEvent;
import com.planmarshall.core.graph.PlanGraph;
import com.planmarshall.core.logging.MdcContext;
import com.planmarshall.core.model.FailureKind;
import com.planmarshall.core.model.Finding;
import com.planmarshall.core.model.FindingRecord;
import com.planmarshall.core.model.FindingState;
import com.planmarshall.core.model.ModuleInfo;
import com.planmarshall.core.model.OutlineReview;
import com.planmarshall.core.model.Plan;
import com.planmarshall.core.model.PlanPhase;
import com.planmarshall.core.model.PlanRequest;
import com.planmarshall.core.model.ProjectContext;
import com.planmarshall.core.model.Severity;
import com.planmarshall.core.model.WaitReason;
import com.planmarshall.core.nodes.PhaseSupport;
import com.planmarshall.core.state.PlanGraphState;
import com.planmarshall.core.store.PlanSnapshot;
import com.planmarshall.core.store.PlanStore;
import com.planmarshall.core.triage.GateFindings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.regex.Pattern;

/**
 * Entry point for plan lifecycle operations and the only writer of plan state.
 * <p>
 * Every mutating operation runs under the plan's lock, so phase transitions and task updates of one
 * plan are serialized while different plans proceed independently. After each operation the plan is
 * driven through the phase graph until it suspends or reaches a terminal phase.
 */
@Service
public class PlanOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(PlanOrchestrator.class);

    static final Pattern PLAN_ID = Pattern.compile("^[a-z][a-z0-9-]*$");

    private final PlanGraph planGraph;
    private final PlanStore store;
    private final PhaseSupport support;
    private final OrchestratorConfig config;
    private final ConcurrentHashMap<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    public PlanOrchestrator(PlanGraph planGraph, PlanStore store, PhaseSupport support, OrchestratorConfig config) {
        this.planGraph = planGraph;
        this.store = store;
        this.support = support;
        this.config = config;
    }

    /**
     * Validates the intake, persists it as a plan in 1-init and drives the plan.
     *
     * @param planId  kebab-case identifier, unique within the store
     * @param request the request document
     * @param context project architecture metadata
     * @return the plan after driving: suspended or terminal
     * @throws ValidationException if the intake is malformed or the plan id is taken
     */
    public Plan start(String planId, PlanRequest request, ProjectContext context) {
        validateIntake(planId, request, context);
        return withPlanLock(planId, () -> {
            if (store.exists(planId)) {
                throw new ValidationException("Plan " + planId + " already exists");
            }
            var plan = Plan.create(planId, request.title().trim(), support.now());
            support.commit(null, PlanSnapshot.initial(plan, request,
                    context == null ? ProjectContext.empty() : context));
            support.publish(PlanEvent.PLAN_CREATED, planId, null, Map.of("title", plan.title()));
            log.info("Created plan {}: {}", planId, plan.title());
            return drive(planId);
        });
    }

    /**
     * Records a clarification answer and re-runs 2-refine.
     */
    public Plan submitClarification(String planId, String answer) {
        if (answer == null || answer.isBlank()) {
            throw new ValidationException("Clarification must not be blank");
        }
        return resume(planId, WaitReason.CLARIFICATION, snapshot -> {
            log.info("Plan {} received clarification", planId);
            return snapshot.withRequest(snapshot.request().withClarification(answer))
                    .withPlan(snapshot.plan().waitFor(WaitReason.NONE, support.now()));
        });
    }

    /**
     * Resolves the 3-outline review gate. Approval moves to 4-plan; rejection re-runs 3-outline with the
     * feedback, or fails the plan once the outline ceiling is reached.
     */
    public Plan submitReview(String planId, OutlineReview review) {
        if (review == null) {
            throw new ValidationException("Review must not be null");
        }
        if (!review.approved() && (review.feedback() == null || review.feedback().isBlank())) {
            throw new ValidationException("A rejected outline needs feedback");
        }
        return resume(planId, WaitReason.REVIEW, snapshot -> {
            var plan = snapshot.plan();
            var now = support.now();
            if (review.approved()) {
                log.info("Plan {} outline approved", planId);
                return GateFindings.resolvePending(
                        snapshot.withPlan(plan.transitionTo(PlanPhase.PLAN, "outline-approved", now)),
                        PlanPhase.OUTLINE, FindingState.TAKEN_INTO_ACCOUNT, "outline approved");
            }
            if (plan.iterations().outline() >= config.maxOutlineIterations()) {
                log.warn("Plan {} outline rejected after {} re-outline(s)", planId, plan.iterations().outline());
                return null;
            }
            log.info("Plan {} outline rejected: {}", planId, review.feedback());
            var rejected = snapshot.withPlan(plan.withIterations(plan.iterations().incrementOutline(), now)
                    .withReviewFeedback(review.feedback(), now)
                    .transitionTo(PlanPhase.OUTLINE, "review-rejected", now));
            return GateFindings.add(rejected, PlanPhase.OUTLINE, reviewFinding(review.feedback()),
                    plan.iterations().outline()).snapshot();
        });
    }

    /**
     * Records a finding raised at the gate of {@code phase}. Raising a pending finding again is a no-op;
     * raising a resolved one reopens it. The plan is not driven.
     *
     * @param finding a finding with source {@code qgate} or {@code user_review}
     * @return the recorded, pending or reopened log entry
     * @throws ValidationException if the plan is terminal, the phase has no gate or the source is wrong
     */
    public FindingRecord addGateFinding(String planId, PlanPhase phase, Finding finding) {
        return withPlanLock(planId, () -> {
            var snapshot = writableSnapshot(planId);
            var added = GateFindings.add(snapshot, phase, finding,
                    snapshot.plan().iterations().forPhase(phase));
            if (added.status() != GateFindings.Status.DEDUPLICATED) {
                support.commit(snapshot, added.snapshot());
                if (added.status() == GateFindings.Status.REOPENED) {
                    support.metrics().recordReopenedFinding(phase);
                }
                support.publish(PlanEvent.GATE_FINDING_RECORDED, planId, null, Map.of(
                        "findingId", added.record().id(),
                        "phase", phase.tag(),
                        "status", added.status().name()));
            }
            return added.record();
        });
    }

    /**
     * Resolves one gate finding of {@code phase} as {@code FIXED}, {@code SUPPRESSED}, {@code ACCEPTED}
     * or {@code TAKEN_INTO_ACCOUNT}.
     */
    public Plan resolveGateFinding(String planId, PlanPhase phase, String findingId, FindingState resolution,
                                   String detail) {
        return withPlanLock(planId, () -> {
            var snapshot = writableSnapshot(planId);
            var committed = support.commit(snapshot,
                    GateFindings.resolve(snapshot, phase, findingId, resolution, detail));
            support.publish(PlanEvent.GATE_FINDING_RESOLVED, planId, null, Map.of(
                    "findingId", findingId,
                    "phase", phase.tag(),
                    "resolution", resolution.name()));
            return committed.plan();
        });
    }

    /**
     * Drops every gate finding of {@code phase}.
     *
     * @return number of findings removed
     */
    public int clearGateFindings(String planId, PlanPhase phase) {
        return withPlanLock(planId, () -> {
            var snapshot = writableSnapshot(planId);
            var cleared = GateFindings.clear(snapshot, phase);
            if (cleared.cleared() > 0) {
                support.commit(snapshot, cleared.snapshot());
            }
            return cleared.cleared();
        });
    }

    /**
     * @param state only findings in this state, or all when {@code null}
     */
    public List<FindingRecord> gateFindings(String planId, PlanPhase phase, FindingState state) {
        return GateFindings.query(store.load(planId), phase, state);
    }

    /**
     * Lets 5-execute close although blocked tasks remain.
     */
    public Plan overrideBlockedTasks(String planId, String reason) {
        if (reason == null || reason.isBlank()) {
            throw new ValidationException("Overriding blocked tasks requires a reason");
        }
        return resume(planId, WaitReason.BLOCKED_TASKS, snapshot -> {
            log.warn("Plan {} closing execute with blocked tasks: {}", planId, reason);
            return snapshot.withPlan(snapshot.plan()
                    .withBlockedOverride(true, support.now())
                    .waitFor(WaitReason.NONE, support.now()));
        });
    }

    /**
     * Requests cancellation. A plan that is not running is cancelled immediately; a running plan stops
     * at its next phase boundary.
     */
    public Plan cancel(String planId) {
        var current = store.load(planId).plan();
        if (current.isTerminal()) {
            return current;
        }
        support.requestCancel(planId);
        ReentrantLock lock = lockFor(planId);
        if (lock.isHeldByCurrentThread() || !lock.tryLock()) {
            // The holder may have finished the plan just before the request was recorded
            var latest = store.load(planId).plan();
            if (latest.isTerminal()) {
                support.clearCancelRequest(planId);
                return latest;
            }
            log.info("Plan {} is running; cancellation will apply at the next phase boundary", planId);
            return current;
        }
        Plan result = null;
        try {
            MdcContext.setPlan(planId);
            store.recover(planId);
            result = support.cancel(store.load(planId)).plan();
            return result;
        } finally {
            MdcContext.clear();
            lock.unlock();
            releaseIfSettled(planId, lock, result != null && result.isTerminal());
        }
    }

    public Plan status(String planId) {
        return store.load(planId).plan();
    }

    /** All artifacts of a plan: deliverables, tasks and the findings log. */
    public PlanSnapshot snapshot(String planId) {
        return store.load(planId);
    }

    public List<Plan> listPlans() {
        return store.listPlanIds().stream().map(id -> store.load(id).plan()).toList();
    }

    /**
     * Applies {@code change} to a plan suspended on {@code expected} and drives it. A {@code null} result
     * from {@code change} means the loop ceiling was hit and fails the plan.
     */
    private Plan resume(String planId, WaitReason expected, Function<PlanSnapshot, PlanSnapshot> change) {
        return withPlanLock(planId, () -> {
            var snapshot = store.load(planId);
            var plan = snapshot.plan();
            if (plan.isTerminal() || plan.waitingOn() != expected) {
                throw new ValidationException("Plan " + planId + " is " + plan.phase()
                        + (plan.isSuspended() ? " waiting on " + plan.waitingOn() : "")
                        + ", not waiting on " + expected);
            }
            if (support.isCancelRequested(planId)) {
                return support.cancel(snapshot).plan();
            }
            var changed = change.apply(snapshot);
            if (changed == null) {
                return support.fail(snapshot, FailureKind.ITERATION_LIMIT_EXCEEDED,
                        "Iteration limit of " + config.maxOutlineIterations() + " reached in phase "
                                + PlanPhase.OUTLINE).plan();
            }
            support.commit(snapshot, changed);
            return drive(planId);
        });
    }

    /**
     * Invokes the phase graph until the plan suspends or terminates. Each invocation ends at a
     * suspension, a terminal phase or a verify loop-back.
     */
    private Plan drive(String planId) {
        int maxSegments = config.maxVerifyIterations() + 3;
        for (int segment = 1; segment <= maxSegments; segment++) {
            var snapshot = store.load(planId);
            var plan = snapshot.plan();
            if (plan.isTerminal()) {
                return plan;
            }
            if (plan.isSuspended()) {
                return support.isCancelRequested(planId) ? support.cancel(snapshot).plan() : plan;
            }
            try {
                planGraph.getCompiledGraph().invoke(PlanGraphState.initial(planId, plan.phase()));
            } catch (Exception e) {
                log.error("Plan {} failed unexpectedly in {}: {}", planId, plan.phase(), e.getMessage(), e);
                return support.fail(store.load(planId), FailureKind.INTERNAL, rootMessage(e)).plan();
            }
        }
        var plan = store.load(planId).plan();
        if (plan.isTerminal() || plan.isSuspended()) {
            return plan;
        }
        return support.fail(store.load(planId), FailureKind.INTERNAL,
                "Plan did not settle after " + maxSegments + " graph runs").plan();
    }

    private <T> T withPlanLock(String planId, Supplier<T> action) {
        ReentrantLock lock = lockFor(planId);
        lock.lock();
        MdcContext.setPlan(planId);
        boolean settled = false;
        try {
            store.recover(planId);
            T result = action.get();
            if (result instanceof Plan plan && plan.isTerminal()) {
                settled = true;
                support.clearCancelRequest(planId);
            }
            return result;
        } catch (RuntimeException e) {
            // A rejected operation on a finished or unknown plan must not leave a lock behind
            settled = isSettled(planId);
            throw e;
        } finally {
            MdcContext.clear();
            lock.unlock();
            releaseIfSettled(planId, lock, settled);
        }
    }

    private PlanSnapshot writableSnapshot(String planId) {
        var snapshot = store.load(planId);
        if (snapshot.plan().isTerminal()) {
            throw new ValidationException("Plan " + planId + " is " + snapshot.plan().phase() + " and accepts no findings");
        }
        return snapshot;
    }

    private static Finding reviewFinding(String feedback) {
        return new Finding(null, FindingRecord.USER_REVIEW_SOURCE, "outline-review", null, null, Severity.MAJOR,
                feedback.trim(), false, null, null);
    }

    private boolean isSettled(String planId) {
        try {
            return !store.exists(planId) || store.load(planId).plan().isTerminal();
        } catch (RuntimeException e) {
            log.debug("Keeping lock of plan {}: state unreadable ({})", planId, e.getMessage());
            return false;
        }
    }

    /** A terminal plan accepts no further writes, so its lock can be dropped. */
    private void releaseIfSettled(String planId, ReentrantLock lock, boolean settled) {
        if (settled && !lock.isHeldByCurrentThread() && !lock.hasQueuedThreads()) {
            locks.remove(planId, lock);
        }
    }

    /** Number of plans holding a lock entry. */
    int lockCount() {
        return locks.size();
    }

    private ReentrantLock lockFor(String planId) {
        return locks.computeIfAbsent(planId, k -> new ReentrantLock());
    }

    private static void validateIntake(String planId, PlanRequest request, ProjectContext context) {
        if (planId == null || !PLAN_ID.matcher(planId).matches()) {
            throw new ValidationException("Plan id must be kebab-case: " + planId);
        }
        if (request == null) {
            throw new ValidationException("Request must not be null");
        }
        if (request.title() == null || request.title().isBlank()) {
            throw new ValidationException("Request title must not be blank");
        }
        if (request.description() == null || request.description().isBlank()) {
            throw new ValidationException("Request description must not be blank");
        }
        if (context != null) {
            for (ModuleInfo module : context.modules()) {
                if (module.name() == null || module.name().isBlank()) {
                    throw new ValidationException("Project module without a name");
                }
                if (module.domain() == null || module.domain().isBlank()) {
                    throw new ValidationException("Module " + module.name() + " has no domain");
                }
            }
        }
    }

    private static String rootMessage(Throwable e) {
        Throwable root = e;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        return root.getClass().getSimpleName() + ": " + root.getMessage();
    }
}
