package com.planmarshall.core.nodes;

import com.planmarshall.core.model.PlanPhase;
import com.planmarshall.core.store.PlanSnapshot;
import org.springframework.stereotype.Component;

/**
 * 1-init: intake artifacts are already persisted when the plan is started, so the plan moves on.
 */
@Component
public class InitPlanNode extends PhaseNode {

    public InitPlanNode(PhaseSupport support) {
        super(support);
    }

    @Override
    public PlanPhase phase() {
        return PlanPhase.INIT;
    }

    @Override
    protected PlanSnapshot run(PlanSnapshot snapshot) {
        var plan = snapshot.plan().transitionTo(PlanPhase.REFINE, "intake-persisted", support.now());
        return support.commit(snapshot, snapshot.withPlan(plan));
    }
}
