package com.planmarshall.core.engine;

import com.planmarshall.core.config.OrchestratorConfig;
import com.planmarshall.core.error.PlanNotFoundException;
import com.planmarshall.core.error.TransientException;
import com.planmarshall.core.error.ValidationException;
import com.planmarshall.core.events.PlanEvent;
import com.planmarshall.core.model.ChangeType;
import com.planmarshall.core.model.CheckCategory;
import com.planmarshall.core.model.Deliverable;
import com.planmarshall.core.model.ExecutionStrategy;
import com.planmarshall.core.model.FailureKind;
import com.planmarshall.core.model.Finding;
import com.planmarshall.core.model.FindingRecord;
import com.planmarshall.core.model.FindingState;
import com.planmarshall.core.model.OutlineReview;
import com.planmarshall.core.model.PhaseTransition;
import com.planmarshall.core.model.PlanPhase;
import com.planmarshall.core.model.PlanRequest;
import com.planmarshall.core.model.Severity;
import com.planmarshall.core.model.Task;
import com.planmarshall.core.model.TaskOrigin;
import com.planmarshall.core.model.TaskStatus;
import com.planmarshall.core.model.WaitReason;
import com.planmarshall.extension.DomainExtension;
import com.planmarshall.extension.Outliner;
import com.planmarshall.runner.ExecutionReport;
import com.planmarshall.runner.StepResult;
import com.planmarshall.runner.VerificationReport;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import static com.planmarshall.core.engine.PlanHarness.CONTEXT;
import static com.planmarshall.core.engine.PlanHarness.allDone;
import static com.planmarshall.core.engine.PlanHarness.confidences;
import static com.planmarshall.core.engine.PlanHarness.config;
import static com.planmarshall.core.engine.PlanHarness.noOpFinalizer;
import static com.planmarshall.core.engine.PlanHarness.reports;
import static org.junit.jupiter.api.Assertions.*;

class PlanOrchestratorTest {

    private static final PlanRequest REQUEST = new PlanRequest("Add login", "Users can log in with a password");

    @TempDir
    Path baseDir;

    private static Finding major(String file, String rule) {
        return new Finding(null, "quality", rule, file, 4, Severity.MAJOR, rule + " violated", false, "java", "api");
    }

    private static long selfLoops(List<PhaseTransition> history, PlanPhase phase) {
        return history.stream().filter(t -> t.from() == phase && t.to() == phase).count();
    }

    private static void assertMonotonic(List<PhaseTransition> history) {
        for (var transition : history.subList(1, history.size())) {
            assertTrue(transition.from().canTransitionTo(transition.to()),
                    "illegal transition " + transition.from() + " -> " + transition.to());
        }
    }

    // ===================================================================
    // Happy path and lifecycle scenarios
    // ===================================================================

    @Nested
    @DisplayName("lifecycle")
    class Lifecycle {

        @Test
        @DisplayName("clear request runs straight through to complete")
        void straightThrough() throws Exception {
            var executor = allDone();
            var h = new PlanHarness(baseDir, config(baseDir, false), List.of(), confidences(100), executor,
                    reports(), noOpFinalizer());

            var plan = h.orchestrator.start("add-login", REQUEST, CONTEXT);

            assertEquals(PlanPhase.COMPLETE, plan.phase());
            assertEquals(List.of(PlanPhase.INIT, PlanPhase.REFINE, PlanPhase.OUTLINE, PlanPhase.PLAN,
                    PlanPhase.EXECUTE, PlanPhase.VERIFY, PlanPhase.FINALIZE, PlanPhase.COMPLETE), plan.visitedPhases());
            assertEquals(List.of("java"), plan.domains());
            assertEquals(1, plan.iterations().verify());

            var snapshot = h.orchestrator.snapshot("add-login");
            assertEquals(1, snapshot.deliverables().size());
            assertEquals(List.of("services/api"), snapshot.deliverables().get(0).affectedFiles());
            assertEquals(List.of(TaskStatus.DONE), snapshot.tasks().stream().map(Task::status).toList());
            assertEquals(List.of(1), executor.executed);
            assertEquals(1, h.finalized.size());
        }

        @Test
        @DisplayName("two clarifications: refine loops exactly twice before advancing")
        void clarificationLoop() throws Exception {
            var h = new PlanHarness(baseDir, config(baseDir, false), List.of(), confidences(40, 70, 98), allDone(),
                    reports(), noOpFinalizer());

            var plan = h.orchestrator.start("add-login", REQUEST, CONTEXT);
            assertEquals(PlanPhase.REFINE, plan.phase());
            assertEquals(WaitReason.CLARIFICATION, plan.waitingOn());
            assertEquals(List.of("Which users may log in?"), plan.openQuestions());

            plan = h.orchestrator.submitClarification("add-login", "Only employees");
            assertEquals(WaitReason.CLARIFICATION, plan.waitingOn());

            plan = h.orchestrator.submitClarification("add-login", "Via the staff directory");

            assertEquals(PlanPhase.COMPLETE, plan.phase());
            assertEquals(2, plan.iterations().refine());
            assertEquals(2, selfLoops(plan.history(), PlanPhase.REFINE));
            assertEquals(List.of("Only employees", "Via the staff directory"),
                    h.orchestrator.snapshot("add-login").request().clarifications());
            assertMonotonic(plan.history());
        }

        @Test
        @DisplayName("verify findings loop back to execute once, second run is clean")
        void verifyLoopBack() throws Exception {
            var first = new VerificationReport(
                    List.of(major("services/api/Login.java", "null-check"),
                            major("services/api/Session.java", "resource-leak")),
                    Map.of(CheckCategory.QUALITY, false));
            var executor = allDone();
            var h = new PlanHarness(baseDir, config(baseDir, false), List.of(), confidences(100), executor,
                    reports(first), noOpFinalizer());

            var plan = h.orchestrator.start("add-login", REQUEST, CONTEXT);

            assertEquals(PlanPhase.COMPLETE, plan.phase());
            assertEquals(2, plan.iterations().verify());
            assertTrue(plan.history().stream()
                    .anyMatch(t -> t.from() == PlanPhase.VERIFY && t.to() == PlanPhase.EXECUTE));

            var snapshot = h.orchestrator.snapshot("add-login");
            var fixTasks = snapshot.tasks().stream().filter(t -> t.origin() == TaskOrigin.FIX).toList();
            assertEquals(2, fixTasks.size());
            assertEquals(List.of(2, 3), fixTasks.stream().map(Task::number).toList());
            assertTrue(snapshot.tasks().stream().allMatch(t -> t.status() == TaskStatus.DONE));
            assertEquals(List.of(1, 2, 3), executor.executed);
            assertEquals(2, snapshot.findings().stream()
                    .filter(r -> r.state() == FindingState.FIX_TASK_CREATED).count());
            assertEquals(2, h.finalized.get(0).iterations().verify());

            // Every fix task points at logged findings and every task at a deliverable or finding
            assertDoesNotThrow(() -> h.ledger.validateReferences(snapshot.tasks(), snapshot.deliverables(),
                    snapshot.findings()));
            assertMonotonic(plan.history());
            assertEquals(1.0, h.meterRegistry.find("planmarshall.loopbacks.total")
                    .tag("phase", "5-execute").counter().count());
        }

        @Test
        @DisplayName("events follow the lifecycle from creation to completion")
        void events() throws Exception {
            var h = new PlanHarness(baseDir, config(baseDir, false), List.of(), confidences(100), allDone(),
                    reports(), noOpFinalizer());

            h.orchestrator.start("add-login", REQUEST, CONTEXT);

            var types = h.events.stream().map(PlanEvent::eventType).toList();
            // the initial commit announces 1-init just before the creation event
            assertEquals(List.of(PlanEvent.PHASE_ENTERED, PlanEvent.PLAN_CREATED), types.subList(0, 2));
            assertEquals(PlanEvent.PLAN_COMPLETED, types.get(types.size() - 1));
            assertEquals(8, types.stream().filter(PlanEvent.PHASE_ENTERED::equals).count());
            assertTrue(types.contains(PlanEvent.TASK_COMPLETED));
        }

        @Test
        @DisplayName("parallel strategy runs independent deliverables and completes")
        void parallelExecution() throws Exception {
            Outliner twoIndependent = r -> List.of(
                    new Deliverable(1, "Login API", "", ChangeType.FEATURE, "java", "api",
                            List.of("services/api/Login.java"), List.of("implementation"), List.of(), List.of()),
                    new Deliverable(2, "Audit log", "", ChangeType.FEATURE, "java", "api",
                            List.of("services/api/Audit.java"), List.of("implementation", "module_testing"),
                            List.of(), List.of()));
            var config = config(baseDir, false).withExecution(ExecutionStrategy.PARALLEL, 4);
            var executor = allDone();
            var h = new PlanHarness(baseDir, config, List.of(DomainExtension.of("java").withOutliner(twoIndependent)),
                    confidences(100), executor, reports(), noOpFinalizer());

            var plan = h.orchestrator.start("add-login", REQUEST, CONTEXT);

            assertEquals(PlanPhase.COMPLETE, plan.phase());
            assertEquals(3, executor.executed.size());
            assertTrue(h.orchestrator.snapshot("add-login").tasks().stream()
                    .allMatch(t -> t.status() == TaskStatus.DONE));
        }
    }

    // ===================================================================
    // Review gate
    // ===================================================================

    @Nested
    @DisplayName("outline review")
    class Review {

        @Test
        @DisplayName("rejection re-outlines with feedback, approval continues")
        void rejectThenApprove() throws Exception {
            var feedback = new ArrayList<List<String>>();
            Outliner recording = r -> {
                feedback.add(r.reviewFeedback());
                return List.of(new Deliverable(1, "Login", "", ChangeType.FEATURE, "java", "api",
                        List.of("services/api/Login.java"), List.of("implementation"), List.of(), List.of()));
            };
            var h = new PlanHarness(baseDir, config(baseDir, true),
                    List.of(DomainExtension.of("java").withOutliner(recording)),
                    confidences(100), allDone(), reports(), noOpFinalizer());

            var plan = h.orchestrator.start("add-login", REQUEST, CONTEXT);
            assertEquals(PlanPhase.OUTLINE, plan.phase());
            assertEquals(WaitReason.REVIEW, plan.waitingOn());

            plan = h.orchestrator.submitReview("add-login", OutlineReview.reject("Split API and UI work"));
            assertEquals(WaitReason.REVIEW, plan.waitingOn());
            assertEquals(1, plan.iterations().outline());
            assertEquals(List.of(List.of(), List.of("Split API and UI work")), feedback);

            plan = h.orchestrator.submitReview("add-login", OutlineReview.approve());
            assertEquals(PlanPhase.COMPLETE, plan.phase());
            assertEquals(1, selfLoops(plan.history(), PlanPhase.OUTLINE));
        }

        @Test
        @DisplayName("rejection beyond the outline ceiling fails the plan")
        void outlineCeiling() throws Exception {
            var h = new PlanHarness(baseDir, config(baseDir, true), List.of(), confidences(100), allDone(),
                    reports(), noOpFinalizer());
            h.orchestrator.start("add-login", REQUEST, CONTEXT);

            for (int i = 0; i < 3; i++) {
                assertEquals(WaitReason.REVIEW,
                        h.orchestrator.submitReview("add-login", OutlineReview.reject("again " + i)).waitingOn());
            }
            var plan = h.orchestrator.submitReview("add-login", OutlineReview.reject("still wrong"));

            assertEquals(PlanPhase.FAILED, plan.phase());
            assertEquals(FailureKind.ITERATION_LIMIT_EXCEEDED, plan.failure().kind());
            assertEquals(PlanPhase.OUTLINE, plan.failure().phase());
            assertEquals(3, plan.iterations().outline());
        }

        @Test
        @DisplayName("rejection without feedback is refused")
        void rejectionNeedsFeedback() throws Exception {
            var h = new PlanHarness(baseDir, config(baseDir, true), List.of(), confidences(100), allDone(),
                    reports(), noOpFinalizer());
            h.orchestrator.start("add-login", REQUEST, CONTEXT);

            assertThrows(ValidationException.class,
                    () -> h.orchestrator.submitReview("add-login", new OutlineReview(false, " ")));
            assertEquals(WaitReason.REVIEW, h.orchestrator.status("add-login").waitingOn());
        }
    }

    // ===================================================================
    // Failures and ceilings
    // ===================================================================

    @Nested
    @DisplayName("failures")
    class Failures {

        @Test
        @DisplayName("refine ceiling fails the plan on the next unclear pass")
        void refineCeiling() throws Exception {
            var h = new PlanHarness(baseDir, config(baseDir, false), List.of(), confidences(10), allDone(),
                    reports(), noOpFinalizer());
            h.orchestrator.start("add-login", REQUEST, CONTEXT);
            h.orchestrator.submitClarification("add-login", "a");
            h.orchestrator.submitClarification("add-login", "b");

            var plan = h.orchestrator.submitClarification("add-login", "c");

            assertEquals(PlanPhase.FAILED, plan.phase());
            assertEquals(FailureKind.ITERATION_LIMIT_EXCEEDED, plan.failure().kind());
            assertEquals(3, plan.iterations().refine());
        }

        @Test
        @DisplayName("verify ceiling fails with the unresolved findings named")
        void verifyCeiling() throws Exception {
            var finding = major("services/api/Login.java", "null-check");
            VerificationReport failing = new VerificationReport(List.of(finding), Map.of(CheckCategory.QUALITY, false));
            var config = new OrchestratorConfig(95, 3, 3, 1, false, ExecutionStrategy.SEQUENTIAL, 4,
                    EnumSet.of(Severity.BLOCKER, Severity.MAJOR), Duration.ZERO, baseDir);
            var h = new PlanHarness(baseDir, config, List.of(), confidences(100), allDone(),
                    request -> failing, noOpFinalizer());

            var plan = h.orchestrator.start("add-login", REQUEST, CONTEXT);

            assertEquals(PlanPhase.FAILED, plan.phase());
            assertEquals(FailureKind.ITERATION_LIMIT_EXCEEDED, plan.failure().kind());
            assertEquals(PlanPhase.VERIFY, plan.failure().phase());
            assertEquals(2, plan.iterations().verify());
            assertEquals(List.of(finding.id()), plan.failure().unresolvedFindingIds());
        }

        @Test
        @DisplayName("failed check without findings gets a synthesized blocker")
        void synthesizedBlocker() throws Exception {
            var buildFailed = new VerificationReport(List.of(), Map.of(CheckCategory.BUILD, false));
            var h = new PlanHarness(baseDir, config(baseDir, false), List.of(), confidences(100), allDone(),
                    reports(buildFailed), noOpFinalizer());

            var plan = h.orchestrator.start("add-login", REQUEST, CONTEXT);

            assertEquals(PlanPhase.COMPLETE, plan.phase());
            FindingRecord synthesized = h.orchestrator.snapshot("add-login").findings().get(0);
            assertEquals("check-failed/build", synthesized.finding().rule());
            assertEquals(Severity.BLOCKER, synthesized.finding().severity());
            assertNotNull(synthesized.fixTask());
        }

        @Test
        @DisplayName("cyclic outline fails with dependency-cycle")
        void dependencyCycle() throws Exception {
            Outliner cyclic = r -> List.of(
                    new Deliverable(1, "A", "", ChangeType.FEATURE, "java", null, List.of("a"),
                            List.of("implementation"), List.of(), List.of(2)),
                    new Deliverable(2, "B", "", ChangeType.FEATURE, "java", null, List.of("b"),
                            List.of("implementation"), List.of(), List.of(1)));
            var h = new PlanHarness(baseDir, config(baseDir, false),
                    List.of(DomainExtension.of("java").withOutliner(cyclic)),
                    confidences(100), allDone(), reports(), noOpFinalizer());

            var plan = h.orchestrator.start("add-login", REQUEST, CONTEXT);

            assertEquals(PlanPhase.FAILED, plan.phase());
            assertEquals(FailureKind.DEPENDENCY_CYCLE, plan.failure().kind());
            assertTrue(h.orchestrator.snapshot("add-login").tasks().isEmpty());
        }

        @Test
        @DisplayName("finalizer failing twice fails the plan with its escalation finding")
        void finalizerEscalation() throws Exception {
            var h = new PlanHarness(baseDir, config(baseDir, false), List.of(), confidences(100), allDone(),
                    reports(), summary -> { throw new TransientException("git remote unavailable"); });

            var plan = h.orchestrator.start("add-login", REQUEST, CONTEXT);

            assertEquals(PlanPhase.FAILED, plan.phase());
            assertEquals(FailureKind.TRANSIENT_EXHAUSTED, plan.failure().kind());
            var escalation = h.orchestrator.snapshot("add-login").findings().stream()
                    .filter(r -> r.finding().rule().equals("escalation/finalize"))
                    .findFirst().orElseThrow();
            assertEquals(List.of(escalation.id()), plan.failure().unresolvedFindingIds());
            assertTrue(h.events.stream().anyMatch(e -> e.eventType().equals(PlanEvent.PLAN_FAILED)));
        }
    }

    // ===================================================================
    // Blocked tasks and cancellation
    // ===================================================================

    @Nested
    @DisplayName("blocked tasks and cancellation")
    class BlockedAndCancel {

        @Test
        @DisplayName("blocked tasks suspend execute until overridden")
        void blockedOverride() throws Exception {
            var failing = new PlanHarness.ScriptedExecutor(request ->
                    new ExecutionReport(List.of(StepResult.failed(0, "compile error")), List.of()));
            var h = new PlanHarness(baseDir, config(baseDir, false), List.of(), confidences(100), failing,
                    reports(), noOpFinalizer());

            var plan = h.orchestrator.start("add-login", REQUEST, CONTEXT);
            assertEquals(PlanPhase.EXECUTE, plan.phase());
            assertEquals(WaitReason.BLOCKED_TASKS, plan.waitingOn());
            assertTrue(h.events.stream().anyMatch(e -> e.eventType().equals(PlanEvent.TASK_BLOCKED)));

            plan = h.orchestrator.overrideBlockedTasks("add-login", "ship without it");

            assertEquals(PlanPhase.COMPLETE, plan.phase());
            assertEquals(TaskStatus.BLOCKED, h.orchestrator.snapshot("add-login").tasks().get(0).status());
            assertTrue(plan.history().stream().anyMatch(t -> "blocked-override".equals(t.reason())));
        }

        @Test
        @DisplayName("suspended plan is cancelled immediately")
        void cancelSuspended() throws Exception {
            var h = new PlanHarness(baseDir, config(baseDir, false), List.of(), confidences(10), allDone(),
                    reports(), noOpFinalizer());
            h.orchestrator.start("add-login", REQUEST, CONTEXT);

            var plan = h.orchestrator.cancel("add-login");

            assertEquals(PlanPhase.CANCELLED, plan.phase());
            assertThrows(ValidationException.class, () -> h.orchestrator.submitClarification("add-login", "late"));
            assertEquals(PlanPhase.CANCELLED, h.orchestrator.cancel("add-login").phase());
        }

        @Test
        @DisplayName("cancel while executing stops at the next boundary")
        void cancelRunning() throws Exception {
            Outliner two = r -> List.of(
                    new Deliverable(1, "A", "", ChangeType.FEATURE, "java", null, List.of("a"),
                            List.of("implementation"), List.of(), List.of()),
                    new Deliverable(2, "B", "", ChangeType.FEATURE, "java", null, List.of("b"),
                            List.of("implementation"), List.of(), List.of(1)));
            var orchestratorRef = new AtomicReference<PlanOrchestrator>();
            var executor = new PlanHarness.ScriptedExecutor(request -> {
                orchestratorRef.get().cancel(request.planId());
                return new ExecutionReport(List.of(StepResult.done(0)), List.of());
            });
            var h = new PlanHarness(baseDir, config(baseDir, false),
                    List.of(DomainExtension.of("java").withOutliner(two)),
                    confidences(100), executor, reports(), noOpFinalizer());
            orchestratorRef.set(h.orchestrator);

            var plan = h.orchestrator.start("add-login", REQUEST, CONTEXT);

            assertEquals(PlanPhase.CANCELLED, plan.phase());
            assertEquals(List.of(1), executor.executed);
            var tasks = h.orchestrator.snapshot("add-login").tasks();
            assertEquals(TaskStatus.DONE, tasks.get(0).status());
            assertEquals(TaskStatus.PENDING, tasks.get(1).status());
        }
    }

    // ===================================================================
    // Phase gate findings and reopened verification findings
    // ===================================================================

    @Nested
    @DisplayName("gate findings")
    class GateFindingLog {

        private FindingRecord reviewRecord(PlanHarness h, String feedback) {
            return h.orchestrator.gateFindings("add-login", PlanPhase.OUTLINE, null).stream()
                    .filter(r -> r.finding().message().equals(feedback))
                    .findFirst().orElseThrow();
        }

        @Test
        @DisplayName("outline rejection is logged as a pending review finding, approval resolves it")
        void reviewRejectionLogged() throws Exception {
            var h = new PlanHarness(baseDir, config(baseDir, true), List.of(), confidences(100), allDone(),
                    reports(), noOpFinalizer());
            h.orchestrator.start("add-login", REQUEST, CONTEXT);

            h.orchestrator.submitReview("add-login", OutlineReview.reject("Split API and UI work"));

            var pending = reviewRecord(h, "Split API and UI work");
            assertEquals(FindingRecord.USER_REVIEW_SOURCE, pending.finding().source());
            assertEquals(PlanPhase.OUTLINE, pending.phase());
            assertEquals(FindingState.PENDING, pending.state());
            assertEquals(0, pending.iteration());
            assertNull(pending.decision());

            var plan = h.orchestrator.submitReview("add-login", OutlineReview.approve());

            assertEquals(PlanPhase.COMPLETE, plan.phase());
            var resolved = h.orchestrator.snapshot("add-login").findings().stream()
                    .filter(r -> r.id().equals(pending.id())).findFirst().orElseThrow();
            assertEquals(FindingState.TAKEN_INTO_ACCOUNT, resolved.state());
            assertEquals("outline approved", resolved.note());
        }

        @Test
        @DisplayName("pending review findings are named when the outline ceiling fails the plan")
        void pendingReviewFindingsUnresolved() throws Exception {
            var h = new PlanHarness(baseDir, config(baseDir, true), List.of(), confidences(100), allDone(),
                    reports(), noOpFinalizer());
            h.orchestrator.start("add-login", REQUEST, CONTEXT);
            for (int i = 0; i < 3; i++) {
                h.orchestrator.submitReview("add-login", OutlineReview.reject("again " + i));
            }

            var plan = h.orchestrator.submitReview("add-login", OutlineReview.reject("still wrong"));

            assertEquals(PlanPhase.FAILED, plan.phase());
            assertEquals(List.of(reviewRecord(h, "again 0").id(), reviewRecord(h, "again 1").id(),
                    reviewRecord(h, "again 2").id()), plan.failure().unresolvedFindingIds());
        }

        @Test
        @DisplayName("quality gate findings are deduplicated, resolved, reopened and cleared per phase")
        void qualityGateLifecycle() throws Exception {
            var h = new PlanHarness(baseDir, config(baseDir, false), List.of(), confidences(10), allDone(),
                    reports(), noOpFinalizer());
            h.orchestrator.start("add-login", REQUEST, CONTEXT);
            var gap = new Finding(null, FindingRecord.QGATE_SOURCE, "missing-acceptance", null, null,
                    Severity.MAJOR, "Request names no acceptance criteria", false, null, null);

            var added = h.orchestrator.addGateFinding("add-login", PlanPhase.REFINE, gap);
            assertEquals(FindingState.PENDING, added.state());
            assertEquals(added, h.orchestrator.addGateFinding("add-login", PlanPhase.REFINE, gap));
            assertEquals(1, h.orchestrator.gateFindings("add-login", PlanPhase.REFINE, null).size());

            h.orchestrator.resolveGateFinding("add-login", PlanPhase.REFINE, added.id(), FindingState.FIXED,
                    "criteria added");
            assertEquals(List.of(), h.orchestrator.gateFindings("add-login", PlanPhase.REFINE, FindingState.PENDING));

            var reopened = h.orchestrator.addGateFinding("add-login", PlanPhase.REFINE, gap);
            assertEquals(added.id(), reopened.id());
            assertEquals(FindingState.PENDING, reopened.state());
            assertTrue(reopened.reopened());
            assertEquals(1.0, h.meterRegistry.find("planmarshall.findings.reopened")
                    .tag("phase", "2-refine").counter().count());

            // The same finding at another gate is its own entry
            h.orchestrator.addGateFinding("add-login", PlanPhase.OUTLINE, gap);

            assertEquals(1, h.orchestrator.clearGateFindings("add-login", PlanPhase.REFINE));
            assertEquals(List.of(), h.orchestrator.gateFindings("add-login", PlanPhase.REFINE, null));
            assertEquals(1, h.orchestrator.gateFindings("add-login", PlanPhase.OUTLINE, null).size());
            assertEquals(WaitReason.CLARIFICATION, h.orchestrator.status("add-login").waitingOn());
            assertTrue(h.events.stream().anyMatch(e -> e.eventType().equals(PlanEvent.GATE_FINDING_RESOLVED)));
        }

        @Test
        @DisplayName("gate findings need a gate source, a gate phase, a gate resolution and a live plan")
        void gateValidation() throws Exception {
            var h = new PlanHarness(baseDir, config(baseDir, false), List.of(), confidences(10), allDone(),
                    reports(), noOpFinalizer());
            h.orchestrator.start("add-login", REQUEST, CONTEXT);
            var gap = new Finding(null, FindingRecord.QGATE_SOURCE, "gap", null, null, Severity.MINOR, "gap",
                    false, null, null);

            assertThrows(ValidationException.class, () -> h.orchestrator.addGateFinding("add-login",
                    PlanPhase.REFINE, major("services/api/Login.java", "null-check")));
            assertThrows(ValidationException.class,
                    () -> h.orchestrator.addGateFinding("add-login", PlanPhase.VERIFY, gap));
            var added = h.orchestrator.addGateFinding("add-login", PlanPhase.REFINE, gap);
            assertThrows(ValidationException.class, () -> h.orchestrator.resolveGateFinding("add-login",
                    PlanPhase.REFINE, added.id(), FindingState.FIX_TASK_CREATED, null));
            assertThrows(ValidationException.class, () -> h.orchestrator.resolveGateFinding("add-login",
                    PlanPhase.REFINE, "F-unknown", FindingState.ACCEPTED, null));

            h.orchestrator.cancel("add-login");
            assertThrows(ValidationException.class,
                    () -> h.orchestrator.addGateFinding("add-login", PlanPhase.REFINE, gap));
            assertEquals(0, h.orchestrator.lockCount());
        }

        @Test
        @DisplayName("a finding reported again after its fix task is done is marked reopened")
        void verifyFindingReopened() throws Exception {
            var finding = major("services/api/Login.java", "null-check");
            var other = major("services/api/Session.java", "resource-leak");
            var h = new PlanHarness(baseDir, config(baseDir, false), List.of(), confidences(100), allDone(),
                    reports(new VerificationReport(List.of(finding, other), Map.of(CheckCategory.QUALITY, false)),
                            new VerificationReport(List.of(finding), Map.of(CheckCategory.QUALITY, false))),
                    noOpFinalizer());

            var plan = h.orchestrator.start("add-login", REQUEST, CONTEXT);

            assertEquals(PlanPhase.COMPLETE, plan.phase());
            var records = h.orchestrator.snapshot("add-login").findings();
            var first = records.stream().filter(r -> r.id().equals(finding.id()) && r.iteration() == 1)
                    .findFirst().orElseThrow();
            var second = records.stream().filter(r -> r.id().equals(finding.id()) && r.iteration() == 2)
                    .findFirst().orElseThrow();
            assertFalse(first.reopened());
            assertTrue(second.reopened());
            assertTrue(second.note().startsWith("reopened: fix task " + first.fixTask()));
            assertEquals(FindingState.FIX_TASK_CREATED, second.state());
            assertTrue(records.stream().filter(r -> r.id().equals(other.id())).noneMatch(FindingRecord::reopened));
            assertEquals(1, h.events.stream()
                    .filter(e -> e.eventType().equals(PlanEvent.FINDING_REOPENED)).count());
        }
    }

    // ===================================================================
    // Per-plan bookkeeping released at terminal phases
    // ===================================================================

    @Nested
    @DisplayName("terminal cleanup")
    class TerminalCleanup {

        @Test
        @DisplayName("completed plans keep no lock or cancel request")
        void completedPlan() throws Exception {
            var h = new PlanHarness(baseDir, config(baseDir, false), List.of(), confidences(100), allDone(),
                    reports(), noOpFinalizer());

            for (int i = 0; i < 5; i++) {
                assertEquals(PlanPhase.COMPLETE, h.orchestrator.start("plan-" + i, REQUEST, CONTEXT).phase());
            }

            assertEquals(0, h.orchestrator.lockCount());
            assertEquals(PlanPhase.COMPLETE, h.orchestrator.cancel("plan-0").phase());
            assertFalse(h.support.isCancelRequested("plan-0"));
            assertEquals(0, h.orchestrator.lockCount());
        }

        @Test
        @DisplayName("suspended plans keep their lock until they terminate")
        void suspendedPlan() throws Exception {
            var h = new PlanHarness(baseDir, config(baseDir, false), List.of(), confidences(10), allDone(),
                    reports(), noOpFinalizer());
            h.orchestrator.start("add-login", REQUEST, CONTEXT);
            assertEquals(1, h.orchestrator.lockCount());

            h.orchestrator.cancel("add-login");

            assertFalse(h.support.isCancelRequested("add-login"));
            assertEquals(0, h.orchestrator.lockCount());
        }

        @Test
        @DisplayName("cancel requested mid-run is cleared once the plan is cancelled")
        void cancelledWhileRunning() throws Exception {
            var orchestratorRef = new AtomicReference<PlanOrchestrator>();
            var executor = new PlanHarness.ScriptedExecutor(request -> {
                orchestratorRef.get().cancel(request.planId());
                return new ExecutionReport(List.of(StepResult.done(0)), List.of());
            });
            var h = new PlanHarness(baseDir, config(baseDir, false), List.of(), confidences(100), executor,
                    reports(), noOpFinalizer());
            orchestratorRef.set(h.orchestrator);

            assertEquals(PlanPhase.CANCELLED, h.orchestrator.start("add-login", REQUEST, CONTEXT).phase());

            assertFalse(h.support.isCancelRequested("add-login"));
            assertEquals(0, h.orchestrator.lockCount());
        }
    }

    // ===================================================================
    // Intake validation and queries
    // ===================================================================

    @Nested
    @DisplayName("intake and queries")
    class Intake {

        @Test
        @DisplayName("malformed intake is rejected before anything is stored")
        void invalidIntake() throws Exception {
            var h = new PlanHarness(baseDir, config(baseDir, false), List.of(), confidences(100), allDone(),
                    reports(), noOpFinalizer());

            assertThrows(ValidationException.class, () -> h.orchestrator.start("Add_Login", REQUEST, CONTEXT));
            assertThrows(ValidationException.class,
                    () -> h.orchestrator.start("add-login", new PlanRequest(" ", "d"), CONTEXT));
            assertThrows(ValidationException.class,
                    () -> h.orchestrator.start("add-login", new PlanRequest("t", null), CONTEXT));
            assertTrue(h.orchestrator.listPlans().isEmpty());
        }

        @Test
        @DisplayName("plan ids are unique and wrong-state resumes are refused")
        void duplicatesAndWrongState() throws Exception {
            var h = new PlanHarness(baseDir, config(baseDir, false), List.of(), confidences(100), allDone(),
                    reports(), noOpFinalizer());
            h.orchestrator.start("add-login", REQUEST, CONTEXT);

            assertThrows(ValidationException.class, () -> h.orchestrator.start("add-login", REQUEST, CONTEXT));
            assertThrows(ValidationException.class, () -> h.orchestrator.submitClarification("add-login", "x"));
            assertThrows(ValidationException.class,
                    () -> h.orchestrator.overrideBlockedTasks("add-login", "because"));
            assertThrows(PlanNotFoundException.class, () -> h.orchestrator.status("nope"));
        }

        @Test
        @DisplayName("plans survive a restart of the orchestrator")
        void resumesFromStore() throws Exception {
            var first = new PlanHarness(baseDir, config(baseDir, false), List.of(), confidences(10), allDone(),
                    reports(), noOpFinalizer());
            first.orchestrator.start("add-login", REQUEST, CONTEXT);

            var second = new PlanHarness(baseDir, config(baseDir, false), List.of(), confidences(100), allDone(),
                    reports(), noOpFinalizer());
            var plan = second.orchestrator.submitClarification("add-login", "Employees only");

            assertEquals(PlanPhase.COMPLETE, plan.phase());
            assertEquals(List.of("add-login"), second.orchestrator.listPlans().stream().map(p -> p.planId()).toList());
        }
    }
}
