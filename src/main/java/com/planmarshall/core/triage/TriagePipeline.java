package com.planmarshall.core.triage;

import com.planmarshall.core.error.EscalationException;
import com.planmarshall.core.model.ChangeType;
import com.planmarshall.core.model.Finding;
import com.planmarshall.core.model.FindingRecord;
import com.planmarshall.core.model.FindingState;
import com.planmarshall.core.model.ModuleInfo;
import com.planmarshall.core.model.PlanPhase;
import com.planmarshall.core.model.Task;
import com.planmarshall.core.model.TriageDecision;
import com.planmarshall.core.support.ResilientInvoker;
import com.planmarshall.core.task.TaskLedger;
import com.planmarshall.extension.ExtensionRegistry;
import com.planmarshall.extension.TriageResult;
import com.planmarshall.extension.Triager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Classifies findings into FIX, SUPPRESS or ACCEPT and turns FIX decisions into fix tasks.
 * <p>
 * Findings are processed in {@link FindingOrder#TRIAGE_ORDER}, so identical input in any order yields
 * identical records and identical fix task numbering. FIX decisions sharing a target (file, else module,
 * else the whole plan) are coalesced into one fix task.
 */
@Service
public class TriagePipeline {

    private static final Logger log = LoggerFactory.getLogger(TriagePipeline.class);

    static final String PLAN_TARGET = "plan";
    static final String MODULE_TARGET_PREFIX = "module:";

    private final ExtensionRegistry registry;
    private final DefaultTriagePolicy defaultPolicy;
    private final TaskLedger ledger;
    private final ResilientInvoker invoker;

    public TriagePipeline(ExtensionRegistry registry, DefaultTriagePolicy defaultPolicy,
                          TaskLedger ledger, ResilientInvoker invoker) {
        this.registry = registry;
        this.defaultPolicy = defaultPolicy;
        this.ledger = ledger;
        this.invoker = invoker;
    }

    public TriageOutcome triage(TriageRequest request) {
        var ids = new HashMap<String, Finding>();
        List<Finding> ordered = distinct(request.findings().stream()
                .map(f -> f.withDomain(resolveDomain(f, request)))
                .sorted(FindingOrder.TRIAGE_ORDER)
                .toList(), ids);

        var records = new ArrayList<FindingRecord>();
        var escalations = new ArrayList<Finding>();
        Map<String, List<Finding>> fixGroups = new LinkedHashMap<>();

        for (var finding : ordered) {
            record(finding, decide(finding, escalations), request.iteration(), records, fixGroups);
        }
        // A handler that failed its retry leaves a blocker, triaged like any other finding without a handler
        for (var escalation : distinct(escalations.stream().sorted(FindingOrder.TRIAGE_ORDER).toList(), ids)) {
            record(escalation, new Decision(defaultPolicy.decide(escalation), true, "triage handler escalated"),
                    request.iteration(), records, fixGroups);
        }

        var fixTasks = new ArrayList<Task>();
        var fixTaskByFinding = new HashMap<String, Integer>();
        int number = request.firstFixTaskNumber();
        for (var group : fixGroups.entrySet()) {
            String domain = group.getValue().get(0).domain();
            Task task = ledger.addFixTask(number, group.getKey(), group.getValue(), fixExecutor(domain));
            fixTasks.add(task);
            group.getValue().forEach(f -> fixTaskByFinding.put(f.id(), task.number()));
            number++;
        }

        var linked = new ArrayList<FindingRecord>();
        for (var record : records) {
            Integer fixTask = fixTaskByFinding.get(record.id());
            linked.add(fixTask == null ? record : record.withFixTask(fixTask));
        }

        var outcome = new TriageOutcome(linked, fixTasks);
        log.info("Triage of {} finding(s): {} fix task(s), {} suppressed, {} accepted", linked.size(),
                fixTasks.size(), outcome.count(TriageDecision.SUPPRESS), outcome.count(TriageDecision.ACCEPT));
        return outcome;
    }

    /**
     * Drops exact repeats. A finding reusing the id of a different finding gets the first free
     * {@code <id>-<n>} instead, so it is still triaged.
     */
    private static List<Finding> distinct(List<Finding> findings, Map<String, Finding> ids) {
        var result = new ArrayList<Finding>();
        for (var finding : findings) {
            Finding existing = ids.get(finding.id());
            if (existing == null) {
                ids.put(finding.id(), finding);
                result.add(finding);
                continue;
            }
            if (existing.equals(finding)) {
                log.debug("Dropping repeated finding {}", finding.id());
                continue;
            }
            int n = 2;
            while (ids.containsKey(finding.id() + "-" + n)) {
                n++;
            }
            Finding renamed = finding.withId(finding.id() + "-" + n);
            log.warn("Finding id {} from {} already names a different finding from {}; triaging it as {}",
                    finding.id(), finding.source(), existing.source(), renamed.id());
            ids.put(renamed.id(), renamed);
            result.add(renamed);
        }
        return result;
    }

    private void record(Finding finding, Decision decision, int iteration, List<FindingRecord> records,
                        Map<String, List<Finding>> fixGroups) {
        if (decision.result().decision() == TriageDecision.FIX) {
            fixGroups.computeIfAbsent(fixTarget(finding), k -> new ArrayList<>()).add(finding);
        }
        records.add(new FindingRecord(finding, iteration, stateFor(decision.result().decision()),
                decision.result().decision(), decision.result().rationale(), decision.defaulted(),
                decision.note(), null, PlanPhase.VERIFY, false));
        log.info("Finding {} [{} {} {}] -> {}{}", finding.id(), finding.source(), finding.severity(),
                finding.rule(), decision.result().decision(), decision.defaulted() ? " (default policy)" : "");
    }

    private Decision decide(Finding finding, List<Finding> escalations) {
        String domain = finding.domain();
        Optional<Triager> triager = domain == null ? Optional.empty() : registry.findTriager(domain);
        if (triager.isEmpty()) {
            log.info("No triage handler for domain {}; applying default policy to {}", domain, finding.id());
            return new Decision(defaultPolicy.decide(finding), true, null);
        }

        TriageResult result;
        try {
            result = invoker.invoke("triage", domain, () -> triager.get().triage(finding));
        } catch (EscalationException e) {
            escalations.add(e.getFinding());
            return new Decision(defaultPolicy.decide(finding), true,
                    "triage handler failed: " + e.getMessage());
        }

        if (result == null || result.decision() == null) {
            log.warn("Triage handler for {} returned no decision for {}; applying default policy", domain, finding.id());
            return new Decision(defaultPolicy.decide(finding), true, "triage handler returned no decision");
        }
        if (result.decision() == TriageDecision.SUPPRESS && !result.hasRationale()) {
            log.warn("SUPPRESS of {} rejected: no rationale given; applying default policy", finding.id());
            return new Decision(defaultPolicy.decide(finding), true, "SUPPRESS rejected: missing rationale");
        }
        return new Decision(result, false, null);
    }

    private String fixExecutor(String domain) {
        if (domain == null) {
            return null;
        }
        var agent = registry.findChangeTypeAgent(domain);
        if (agent.isEmpty()) {
            return null;
        }
        try {
            return invoker.invoke("change-type-agent", domain, () -> agent.get().executorFor(ChangeType.BUG_FIX));
        } catch (EscalationException e) {
            log.warn("Change-type agent for {} unavailable; fix task will select executor by profile", domain);
            return null;
        }
    }

    private String resolveDomain(Finding finding, TriageRequest request) {
        if (finding.domain() != null && !finding.domain().isBlank()) {
            return finding.domain();
        }
        Optional<String> fromModule = request.context().module(finding.module()).map(ModuleInfo::domain);
        if (fromModule.isPresent()) {
            return fromModule.get();
        }
        return request.planDomains().isEmpty() ? null : request.planDomains().get(0);
    }

    static String fixTarget(Finding finding) {
        if (finding.file() != null && !finding.file().isBlank()) {
            return finding.file();
        }
        if (finding.module() != null && !finding.module().isBlank()) {
            return MODULE_TARGET_PREFIX + finding.module();
        }
        return PLAN_TARGET;
    }

    private static FindingState stateFor(TriageDecision decision) {
        return switch (decision) {
            case FIX -> FindingState.FIX_TASK_CREATED;
            case SUPPRESS -> FindingState.SUPPRESSED;
            case ACCEPT -> FindingState.ACCEPTED;
        };
    }

    private record Decision(TriageResult result, boolean defaulted, String note) {}
}
