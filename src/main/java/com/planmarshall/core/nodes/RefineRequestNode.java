package com.planmarshall.core.nodes;

import com.planmarshall.core.config.OrchestratorConfig;
import com.planmarshall.core.error.IterationLimitExceededException;
import com.planmarshall.core.error.ValidationException;
import com.planmarshall.core.model.ChangeType;
import com.planmarshall.core.model.ClarityAssessment;
import com.planmarshall.core.model.PlanPhase;
import com.planmarshall.core.model.PlanRequest;
import com.planmarshall.core.model.ProjectContext;
import com.planmarshall.core.model.WaitReason;
import com.planmarshall.core.store.PlanSnapshot;
import com.planmarshall.core.support.ResilientInvoker;
import com.planmarshall.runner.RequestAnalyzer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.TreeSet;

/**
 * 2-refine: assesses the request, assigns domains and either advances to 3-outline or loops and
 * suspends for clarification.
 */
@Component
public class RefineRequestNode extends PhaseNode {

    private static final Logger log = LoggerFactory.getLogger(RefineRequestNode.class);

    static final String GENERIC_DOMAIN = "generic";

    private final RequestAnalyzer analyzer;
    private final ResilientInvoker invoker;
    private final OrchestratorConfig config;

    public RefineRequestNode(PhaseSupport support, RequestAnalyzer analyzer, ResilientInvoker invoker,
                             OrchestratorConfig config) {
        super(support);
        this.analyzer = analyzer;
        this.invoker = invoker;
        this.config = config;
    }

    @Override
    public PlanPhase phase() {
        return PlanPhase.REFINE;
    }

    @Override
    protected PlanSnapshot run(PlanSnapshot snapshot) {
        var plan = snapshot.plan();
        ClarityAssessment assessment = invoker.invoke("refine", null,
                () -> analyzer.assess(snapshot.request(), snapshot.context()));
        if (assessment == null) {
            throw new ValidationException("Request analyzer returned no assessment");
        }
        if (assessment.confidence() < 0 || assessment.confidence() > 100) {
            throw new ValidationException("Confidence " + assessment.confidence() + " outside 0-100");
        }

        List<String> domains = assignDomains(assessment, snapshot.context());
        ChangeType changeType = changeType(assessment, snapshot.request());
        var now = support.now();
        plan = plan.withDomains(domains, changeType, now);
        log.info("Plan {} confidence {} (threshold {}), domains {}, change type {}", plan.planId(),
                assessment.confidence(), config.refineConfidenceThreshold(), domains, changeType);

        if (assessment.confidence() >= config.refineConfidenceThreshold()) {
            plan = plan.withOpenQuestions(List.of(), now)
                    .transitionTo(PlanPhase.OUTLINE, "confidence-" + assessment.confidence(), now);
            return support.commit(snapshot, snapshot.withPlan(plan));
        }

        if (plan.iterations().refine() >= config.maxRefineIterations()) {
            throw new IterationLimitExceededException(PlanPhase.REFINE, config.maxRefineIterations());
        }
        plan = plan.withIterations(plan.iterations().incrementRefine(), now)
                .transitionTo(PlanPhase.REFINE, "clarification-requested", now)
                .withOpenQuestions(assessment.questions(), now)
                .waitFor(WaitReason.CLARIFICATION, now);
        return support.commit(snapshot, snapshot.withPlan(plan));
    }

    /**
     * Assessment domains known to the project, else every project domain, else {@value #GENERIC_DOMAIN}.
     */
    static List<String> assignDomains(ClarityAssessment assessment, ProjectContext context) {
        var known = context.allDomains();
        var assigned = new TreeSet<String>();
        for (String domain : assessment.domains()) {
            if (domain != null && !domain.isBlank() && (known.isEmpty() || known.contains(domain))) {
                assigned.add(domain);
            }
        }
        if (assigned.isEmpty()) assigned.addAll(known);
        if (assigned.isEmpty()) assigned.add(GENERIC_DOMAIN);
        return List.copyOf(assigned);
    }

    private static ChangeType changeType(ClarityAssessment assessment, PlanRequest request) {
        if (assessment.changeType() != null) return assessment.changeType();
        if (request.changeType() != null) return request.changeType();
        return ChangeType.FEATURE;
    }
}
