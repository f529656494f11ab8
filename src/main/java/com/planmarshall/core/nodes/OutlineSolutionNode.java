package com.planmarshall.core.nodes;

import com.planmarshall.core.config.OrchestratorConfig;
import com.planmarshall.core.error.ValidationException;
import com.planmarshall.core.model.Deliverable;
import com.planmarshall.core.model.FindingRecord;
import com.planmarshall.core.model.FindingState;
import com.planmarshall.core.model.Plan;
import com.planmarshall.core.model.PlanPhase;
import com.planmarshall.core.model.WaitReason;
import com.planmarshall.core.store.PlanSnapshot;
import com.planmarshall.core.support.ResilientInvoker;
import com.planmarshall.core.task.TaskPlanner;
import com.planmarshall.extension.ExtensionRegistry;
import com.planmarshall.extension.GenericOutliner;
import com.planmarshall.extension.OutlineRequest;
import com.planmarshall.extension.Outliner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 3-outline: asks each plan domain's outliner for deliverables, merges them into one plan-wide
 * numbering and rejects malformed or cyclic outlines. Suspends for review unless review is disabled.
 */
@Component
public class OutlineSolutionNode extends PhaseNode {

    private static final Logger log = LoggerFactory.getLogger(OutlineSolutionNode.class);

    private final ExtensionRegistry registry;
    private final GenericOutliner genericOutliner;
    private final TaskPlanner planner;
    private final ResilientInvoker invoker;
    private final OrchestratorConfig config;

    public OutlineSolutionNode(PhaseSupport support, ExtensionRegistry registry, GenericOutliner genericOutliner,
                               TaskPlanner planner, ResilientInvoker invoker, OrchestratorConfig config) {
        super(support);
        this.registry = registry;
        this.genericOutliner = genericOutliner;
        this.planner = planner;
        this.invoker = invoker;
        this.config = config;
    }

    @Override
    public PlanPhase phase() {
        return PlanPhase.OUTLINE;
    }

    @Override
    protected PlanSnapshot run(PlanSnapshot snapshot) {
        Plan plan = snapshot.plan();
        var deliverables = new ArrayList<Deliverable>();
        for (String domain : plan.domains()) {
            Outliner outliner = registry.findOutliner(domain).orElse(genericOutliner);
            var request = new OutlineRequest(plan.planId(), domain, plan.changeType(), snapshot.request(),
                    snapshot.context(), plan.reviewFeedback());
            List<Deliverable> local = invoker.invoke("outline", domain, () -> outliner.outline(request));
            if (local == null || local.isEmpty()) {
                throw new ValidationException("Outliner for domain '" + domain + "' returned no deliverables");
            }
            deliverables.addAll(renumber(local, deliverables.size(), domain));
        }

        planner.validate(deliverables);
        planner.topologicalOrder(deliverables);
        log.info("Outline for plan {}: {} deliverable(s) across domains {}", plan.planId(), deliverables.size(),
                plan.domains());

        var now = support.now();
        Plan next = config.requireOutlineReview()
                ? plan.waitFor(WaitReason.REVIEW, now)
                : plan.transitionTo(PlanPhase.PLAN, "outline-complete", now);
        return support.commit(snapshot, snapshot.withPlan(next)
                .withDeliverables(deliverables)
                .withFindings(clearStale(snapshot.findings())));
    }

    /**
     * Maps an outliner's local numbers and references into the plan-wide sequence after {@code offset}.
     */
    static List<Deliverable> renumber(List<Deliverable> local, int offset, String domain) {
        Map<Integer, Integer> mapping = new HashMap<>();
        for (int i = 0; i < local.size(); i++) {
            if (mapping.put(local.get(i).number(), offset + i + 1) != null) {
                throw new ValidationException("Outliner for domain '" + domain + "' reused deliverable number "
                        + local.get(i).number());
            }
        }
        var result = new ArrayList<Deliverable>();
        for (int i = 0; i < local.size(); i++) {
            var deliverable = local.get(i);
            var deps = new ArrayList<Integer>();
            for (int dep : deliverable.dependsOn()) {
                Integer mapped = mapping.get(dep);
                if (mapped == null) {
                    throw new ValidationException("Deliverable '" + deliverable.title() + "' of domain '" + domain
                            + "' depends on unknown deliverable " + dep);
                }
                deps.add(mapped);
            }
            result.add(deliverable.withNumbering(offset + i + 1, deps));
        }
        return result;
    }

    /** Findings never triaged are cleared logically when a new outline cycle starts. */
    private static List<FindingRecord> clearStale(List<FindingRecord> findings) {
        return findings.stream()
                .map(r -> r.state() == FindingState.NEW ? r.withState(FindingState.STALE, "cleared by re-outline") : r)
                .toList();
    }
}
