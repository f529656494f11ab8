package com.planmarshall.core.engine;

import com.planmarshall.core.config.OrchestratorConfig;
import com.planmarshall.core.events.EventBus;
import com.planmarshall.core.events.PlanEvent;
import com.planmarshall.core.graph.PlanGraph;
import com.planmarshall.core.metrics.PlanMetrics;
import com.planmarshall.core.model.ClarityAssessment;
import com.planmarshall.core.model.ModuleInfo;
import com.planmarshall.core.model.ProjectContext;
import com.planmarshall.core.nodes.ExecuteTasksNode;
import com.planmarshall.core.nodes.FinalizePlanNode;
import com.planmarshall.core.nodes.InitPlanNode;
import com.planmarshall.core.nodes.OutlineSolutionNode;
import com.planmarshall.core.nodes.PhaseSupport;
import com.planmarshall.core.nodes.PlanTasksNode;
import com.planmarshall.core.nodes.RefineRequestNode;
import com.planmarshall.core.nodes.VerifyPlanNode;
import com.planmarshall.core.store.FilePlanStore;
import com.planmarshall.core.support.ResilientInvoker;
import com.planmarshall.core.task.TaskLedger;
import com.planmarshall.core.task.TaskPlanner;
import com.planmarshall.core.task.TaskScheduler;
import com.planmarshall.core.triage.DefaultTriagePolicy;
import com.planmarshall.core.triage.TriagePipeline;
import com.planmarshall.extension.DomainExtension;
import com.planmarshall.extension.ExtensionRegistry;
import com.planmarshall.extension.GenericOutliner;
import com.planmarshall.runner.ExecutionReport;
import com.planmarshall.runner.ExecutionRequest;
import com.planmarshall.runner.FinalizationSummary;
import com.planmarshall.runner.Finalizer;
import com.planmarshall.runner.RequestAnalyzer;
import com.planmarshall.runner.StepResult;
import com.planmarshall.runner.TaskExecutor;
import com.planmarshall.runner.TaskExecutorSelector;
import com.planmarshall.runner.VerificationReport;
import com.planmarshall.runner.VerificationRunner;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;

/**
 * Wires the real orchestrator over a file store with scripted external collaborators.
 */
class PlanHarness {

    static final ProjectContext CONTEXT = new ProjectContext("/repo",
            List.of(new ModuleInfo("api", "java", "services/api")), List.of());

    final FilePlanStore store;
    final EventBus eventBus = new EventBus();
    final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    final List<PlanEvent> events = new CopyOnWriteArrayList<>();
    final List<FinalizationSummary> finalized = new CopyOnWriteArrayList<>();
    final TaskLedger ledger = new TaskLedger();
    final PhaseSupport support;
    final PlanOrchestrator orchestrator;

    PlanHarness(Path baseDir, OrchestratorConfig config, List<DomainExtension> extensions,
                RequestAnalyzer analyzer, TaskExecutor executor, VerificationRunner verifier, Finalizer finalizer)
            throws Exception {
        this.store = new FilePlanStore(baseDir);
        eventBus.subscribeAll(events::add);
        this.support = new PhaseSupport(store, ledger, eventBus, new PlanMetrics(meterRegistry), Clock.systemUTC());
        var invoker = new ResilientInvoker(Duration.ZERO);
        var registry = new ExtensionRegistry(extensions);
        var planner = new TaskPlanner();
        var triage = new TriagePipeline(registry, new DefaultTriagePolicy(config), ledger, invoker);
        Finalizer recording = summary -> {
            finalizer.finalizePlan(summary);
            finalized.add(summary);
        };

        var graph = new PlanGraph(
                new InitPlanNode(support),
                new RefineRequestNode(support, analyzer, invoker, config),
                new OutlineSolutionNode(support, registry, new GenericOutliner(), planner, invoker, config),
                new PlanTasksNode(support, planner, registry, invoker),
                new ExecuteTasksNode(support, new TaskScheduler(), ledger,
                        new TaskExecutorSelector(List.of(executor)), invoker, config),
                new VerifyPlanNode(support, verifier, triage, ledger, invoker, config),
                new FinalizePlanNode(support, recording, invoker));
        this.orchestrator = new PlanOrchestrator(graph, store, support, config);
    }

    static OrchestratorConfig config(Path baseDir, boolean review) {
        return OrchestratorConfig.defaults().withStoreBaseDir(baseDir).withRequireOutlineReview(review);
    }

    /** Analyzer answering with the given confidences in turn, repeating the last one. */
    static RequestAnalyzer confidences(int... values) {
        Deque<Integer> queue = new ArrayDeque<>();
        for (int v : values) queue.add(v);
        return (request, context) -> {
            int confidence = queue.size() > 1 ? queue.poll() : queue.peek();
            return new ClarityAssessment(confidence,
                    confidence < 95 ? List.of("Which users may log in?") : List.of(),
                    List.of("java"), null);
        };
    }

    /** Verifier returning the given reports in turn, then passing. */
    static VerificationRunner reports(VerificationReport... scripted) {
        Deque<VerificationReport> queue = new ArrayDeque<>(List.of(scripted));
        return request -> queue.isEmpty() ? VerificationReport.passed() : queue.poll();
    }

    static Finalizer noOpFinalizer() {
        return summary -> { };
    }

    /** Executor reporting every step of every task as done. */
    static ScriptedExecutor allDone() {
        return new ScriptedExecutor(request -> {
            var results = new ArrayList<StepResult>();
            for (int i = 0; i < request.task().steps().size(); i++) {
                results.add(StepResult.done(i));
            }
            return new ExecutionReport(results, List.of());
        });
    }

    static final class ScriptedExecutor implements TaskExecutor {

        private final Function<ExecutionRequest, ExecutionReport> behaviour;
        final List<Integer> executed = new CopyOnWriteArrayList<>();

        ScriptedExecutor(Function<ExecutionRequest, ExecutionReport> behaviour) {
            this.behaviour = behaviour;
        }

        @Override
        public String id() {
            return "scripted";
        }

        @Override
        public ExecutionReport execute(ExecutionRequest request) {
            executed.add(request.task().number());
            return behaviour.apply(request);
        }
    }
}
