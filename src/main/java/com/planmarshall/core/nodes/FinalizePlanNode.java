package com.planmarshall.core.nodes;

import com.planmarshall.core.model.FindingRecord;
import com.planmarshall.core.model.PlanPhase;
import com.planmarshall.core.model.SuppressionNote;
import com.planmarshall.core.model.TriageDecision;
import com.planmarshall.core.store.PlanSnapshot;
import com.planmarshall.core.support.ResilientInvoker;
import com.planmarshall.runner.FinalizationSummary;
import com.planmarshall.runner.Finalizer;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * 7-finalize: hands the plan summary, including suppression notes, to the finalizer and completes the plan.
 */
@Component
public class FinalizePlanNode extends PhaseNode {

    private final Finalizer finalizer;
    private final ResilientInvoker invoker;

    public FinalizePlanNode(PhaseSupport support, Finalizer finalizer, ResilientInvoker invoker) {
        super(support);
        this.finalizer = finalizer;
        this.invoker = invoker;
    }

    @Override
    public PlanPhase phase() {
        return PlanPhase.FINALIZE;
    }

    @Override
    protected PlanSnapshot run(PlanSnapshot snapshot) {
        var plan = snapshot.plan();
        var summary = new FinalizationSummary(plan.planId(), plan.title(), plan.domains(), plan.iterations(),
                snapshot.deliverables(), snapshot.tasks(), snapshot.findings(), suppressions(snapshot.findings()));
        invoker.run("finalize", null, () -> finalizer.finalizePlan(summary));
        return support.commit(snapshot, snapshot.withPlan(plan.transitionTo(PlanPhase.COMPLETE, "finalized",
                support.now())));
    }

    static List<SuppressionNote> suppressions(List<FindingRecord> findings) {
        return findings.stream()
                .filter(r -> r.decision() == TriageDecision.SUPPRESS)
                .map(r -> new SuppressionNote(r.id(), r.finding().file(), r.finding().line(), r.finding().rule(),
                        r.rationale()))
                .toList();
    }
}
