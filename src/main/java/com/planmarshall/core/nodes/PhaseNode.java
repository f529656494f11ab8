package com.planmarshall.core.nodes;

import com.planmarshall.core.error.DependencyCycleException;
import com.planmarshall.core.error.EscalationException;
import com.planmarshall.core.error.IterationLimitExceededException;
import com.planmarshall.core.error.ValidationException;
import com.planmarshall.core.logging.MdcContext;
import com.planmarshall.core.model.FailureKind;
import com.planmarshall.core.model.Plan;
import com.planmarshall.core.model.PlanPhase;
import com.planmarshall.core.state.PlanGraphState;
import com.planmarshall.core.store.PlanSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

/**
 * Base of the per-phase graph nodes.
 * <p>
 * Loads the plan, applies a pending cancellation (a phase boundary), runs the phase and maps
 * structural errors to a failed plan. Errors from the phase body never leave the plan without state:
 * the failure is committed against a freshly loaded snapshot so that work committed earlier in the
 * phase is kept.
 */
public abstract class PhaseNode {

    private static final Logger log = LoggerFactory.getLogger(PhaseNode.class);

    protected final PhaseSupport support;

    protected PhaseNode(PhaseSupport support) {
        this.support = support;
    }

    public abstract PlanPhase phase();

    /**
     * Runs the phase and returns the committed snapshot.
     */
    protected abstract PlanSnapshot run(PlanSnapshot snapshot);

    public Map<String, Object> apply(PlanGraphState state) {
        String planId = state.planId();
        MdcContext.setPhase(planId, phase());
        long start = System.currentTimeMillis();
        try {
            PlanSnapshot snapshot = support.load(planId);
            if (snapshot.plan().phase() != phase()) {
                throw new IllegalStateException("Plan " + planId + " is in " + snapshot.plan().phase()
                        + ", not " + phase());
            }

            PlanSnapshot result;
            if (support.isCancelRequested(planId)) {
                result = support.cancel(snapshot);
            } else {
                log.info("Entering {} for plan {}", phase(), planId);
                result = runGuarded(planId, snapshot);
            }

            Plan plan = result.plan();
            return PlanGraphState.update(plan.phase(), plan.waitingOn(), phase().isLoopBackTo(plan.phase()));
        } finally {
            support.metrics().recordPhaseDuration(phase(), System.currentTimeMillis() - start);
            MdcContext.clear();
            MdcContext.setPlan(planId);
        }
    }

    private PlanSnapshot runGuarded(String planId, PlanSnapshot snapshot) {
        try {
            return run(snapshot);
        } catch (IterationLimitExceededException e) {
            return support.fail(support.load(planId), FailureKind.ITERATION_LIMIT_EXCEEDED, e.getMessage());
        } catch (DependencyCycleException e) {
            return support.fail(support.load(planId), FailureKind.DEPENDENCY_CYCLE, e.getMessage());
        } catch (ValidationException e) {
            return support.fail(support.load(planId), FailureKind.VALIDATION, e.getMessage());
        } catch (EscalationException e) {
            support.metrics().incrementEscalations(phase().tag());
            PlanSnapshot current = support.load(planId);
            PlanSnapshot logged = support.logFindings(current, List.of(e.getFinding()),
                    current.plan().iterations().verify(), phase());
            return support.fail(logged, FailureKind.TRANSIENT_EXHAUSTED, e.getMessage());
        }
    }
}
