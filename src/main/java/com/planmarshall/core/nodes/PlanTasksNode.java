package com.planmarshall.core.nodes;

import com.planmarshall.core.error.EscalationException;
import com.planmarshall.core.model.Deliverable;
import com.planmarshall.core.model.PlanPhase;
import com.planmarshall.core.store.PlanSnapshot;
import com.planmarshall.core.support.ResilientInvoker;
import com.planmarshall.core.task.TaskPlanner;
import com.planmarshall.extension.ExtensionRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * 4-plan: derives tasks from the approved deliverables. Deliverables and tasks are committed together.
 */
@Component
public class PlanTasksNode extends PhaseNode {

    private static final Logger log = LoggerFactory.getLogger(PlanTasksNode.class);

    private final TaskPlanner planner;
    private final ExtensionRegistry registry;
    private final ResilientInvoker invoker;

    public PlanTasksNode(PhaseSupport support, TaskPlanner planner, ExtensionRegistry registry,
                         ResilientInvoker invoker) {
        super(support);
        this.planner = planner;
        this.registry = registry;
        this.invoker = invoker;
    }

    @Override
    public PlanPhase phase() {
        return PlanPhase.PLAN;
    }

    @Override
    protected PlanSnapshot run(PlanSnapshot snapshot) {
        var tasks = planner.deriveTasks(snapshot.deliverables(), this::resolveExecutor);
        var plan = snapshot.plan().transitionTo(PlanPhase.EXECUTE, "tasks-derived", support.now());
        return support.commit(snapshot, snapshot.withPlan(plan).withTasks(tasks));
    }

    private String resolveExecutor(Deliverable deliverable) {
        var agent = registry.findChangeTypeAgent(deliverable.domain());
        if (agent.isEmpty()) {
            return null;
        }
        try {
            String executor = invoker.invoke("change-type-agent", deliverable.domain(),
                    () -> agent.get().executorFor(deliverable.changeType()));
            log.debug("Deliverable {} ({}) assigned executor {}", deliverable.number(), deliverable.changeType(), executor);
            return executor;
        } catch (EscalationException e) {
            log.warn("Change-type agent for {} unavailable; deliverable {} will select executor by profile",
                    deliverable.domain(), deliverable.number());
            return null;
        }
    }
}
