package com.planmarshall.core.metrics;

import com.planmarshall.core.model.PlanPhase;
import com.planmarshall.core.model.TaskStatus;
import com.planmarshall.core.model.TriageDecision;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for plan orchestration.
 */
@Service
public class PlanMetrics {

    private final MeterRegistry registry;

    public PlanMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordPhaseDuration(PlanPhase phase, long ms) {
        Timer.builder("planmarshall.phase.duration")
                .tag("phase", phase.tag())
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordTaskOutcome(String profile, TaskStatus status) {
        Counter.builder("planmarshall.tasks.total")
                .tag("profile", profile == null ? "none" : profile)
                .tag("status", status.name())
                .register(registry)
                .increment();
    }

    public void recordTriageDecision(TriageDecision decision, boolean defaulted) {
        Counter.builder("planmarshall.triage.decisions")
                .tag("decision", decision.name())
                .tag("defaulted", String.valueOf(defaulted))
                .register(registry)
                .increment();
    }

    public void recordLoopBack(PlanPhase phase) {
        Counter.builder("planmarshall.loopbacks.total")
                .description("Self-loops and verify to execute loop-backs")
                .tag("phase", phase.tag())
                .register(registry)
                .increment();
    }

    public void recordPlanResult(PlanPhase terminal) {
        Counter.builder("planmarshall.plans.total")
                .tag("status", terminal.tag())
                .register(registry)
                .increment();
    }

    public void recordReopenedFinding(PlanPhase phase) {
        Counter.builder("planmarshall.findings.reopened")
                .tag("phase", phase.tag())
                .register(registry)
                .increment();
    }

    public void incrementEscalations(String operation) {
        Counter.builder("planmarshall.escalations.total")
                .tag("operation", operation)
                .register(registry)
                .increment();
    }

    /**
     * Records wave execution metrics for parallel vs sequential analysis.
     *
     * @param taskCount number of tasks in the wave
     * @param strategy  "parallel" or "sequential"
     */
    public void recordWaveExecution(int taskCount, String strategy) {
        DistributionSummary.builder("planmarshall.wave.task_count")
                .description("Number of tasks per wave")
                .tag("strategy", strategy)
                .register(registry)
                .record(taskCount);
    }
}
