package com.planmarshall;

import com.planmarshall.core.config.OrchestratorConfig;
import com.planmarshall.core.engine.PlanOrchestrator;
import com.planmarshall.core.model.ModuleInfo;
import com.planmarshall.core.model.OutlineReview;
import com.planmarshall.core.model.PlanPhase;
import com.planmarshall.core.model.PlanRequest;
import com.planmarshall.core.model.ProjectContext;
import com.planmarshall.core.model.Severity;
import com.planmarshall.core.model.TaskStatus;
import com.planmarshall.core.model.WaitReason;
import com.planmarshall.core.store.FilePlanStore;
import com.planmarshall.core.store.PlanStore;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumSet;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Boots the application with its default collaborators and drives one plan through the wired beans.
 */
@SpringBootTest
class PlanMarshallApplicationTest {

    private static final Path STORE_DIR = createStoreDir();

    @DynamicPropertySource
    static void storeProperties(DynamicPropertyRegistry registry) {
        registry.add("planmarshall.store.base-dir", STORE_DIR::toString);
        registry.add("planmarshall.verify.max-iterations", () -> "2");
    }

    private static Path createStoreDir() {
        try {
            return Files.createTempDirectory("plan-marshall-it");
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    @Autowired
    private OrchestratorConfig config;

    @Autowired
    private PlanStore store;

    @Autowired
    private PlanOrchestrator orchestrator;

    @Test
    @DisplayName("properties are bound into the orchestrator config")
    void bindsConfiguration() {
        assertEquals(95, config.refineConfidenceThreshold());
        assertEquals(2, config.maxVerifyIterations());
        assertTrue(config.requireOutlineReview());
        assertEquals(EnumSet.of(Severity.BLOCKER, Severity.MAJOR), config.defaultFixSeverities());
        assertEquals(STORE_DIR, config.storeBaseDir());
        assertInstanceOf(FilePlanStore.class, store);
    }

    @Test
    @DisplayName("default collaborators: review gate, then blocked tasks until overridden")
    void defaultCollaborators() {
        var context = new ProjectContext("/repo", List.of(new ModuleInfo("api", "java", "services/api")), List.of());

        var plan = orchestrator.start("wired-plan", new PlanRequest("Add audit log", "Record logins"), context);
        assertEquals(WaitReason.REVIEW, plan.waitingOn());
        assertEquals(List.of("java"), plan.domains());

        // the unconfigured executor fails every step
        plan = orchestrator.submitReview("wired-plan", OutlineReview.approve());
        assertEquals(PlanPhase.EXECUTE, plan.phase());
        assertEquals(WaitReason.BLOCKED_TASKS, plan.waitingOn());
        assertEquals(TaskStatus.BLOCKED, orchestrator.snapshot("wired-plan").tasks().get(0).status());

        plan = orchestrator.overrideBlockedTasks("wired-plan", "executor not installed yet");
        assertEquals(PlanPhase.COMPLETE, plan.phase());
        assertTrue(Files.isDirectory(STORE_DIR.resolve("plans").resolve("wired-plan")));
    }
}
