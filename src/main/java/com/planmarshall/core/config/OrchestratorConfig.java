package com.planmarshall.core.config;

import com.planmarshall.core.error.ValidationException;
import com.planmarshall.core.model.ExecutionStrategy;
import com.planmarshall.core.model.Severity;

import java.nio.file.Path;
import java.time.Duration;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * Immutable orchestrator configuration: loop ceilings, thresholds, scheduling and store location.
 *
 * @param refineConfidenceThreshold confidence (0-100) at which 2-refine advances
 * @param maxRefineIterations       maximum refine self-loops
 * @param maxOutlineIterations      maximum outline self-loops
 * @param maxVerifyIterations       maximum verify to execute loop-backs
 * @param requireOutlineReview      whether 3-outline suspends for review
 * @param executionStrategy         how 5-execute dispatches independent tasks
 * @param maxParallel               wave size limit for {@link ExecutionStrategy#PARALLEL}
 * @param defaultFixSeverities      severities the default triage policy fixes
 * @param invocationTimeout         wall-clock timeout per external call, {@link Duration#ZERO} for none
 * @param storeBaseDir              root directory of persisted plans
 */
public record OrchestratorConfig(
    int refineConfidenceThreshold,
    int maxRefineIterations,
    int maxOutlineIterations,
    int maxVerifyIterations,
    boolean requireOutlineReview,
    ExecutionStrategy executionStrategy,
    int maxParallel,
    Set<Severity> defaultFixSeverities,
    Duration invocationTimeout,
    Path storeBaseDir
) {

    public OrchestratorConfig {
        if (refineConfidenceThreshold < 0 || refineConfidenceThreshold > 100) {
            throw new ValidationException("refine confidence threshold must be between 0 and 100");
        }
        if (maxRefineIterations < 0 || maxOutlineIterations < 0 || maxVerifyIterations < 0) {
            throw new ValidationException("iteration maximums must not be negative");
        }
        if (maxParallel < 1) {
            throw new ValidationException("max parallel must be at least 1");
        }
        executionStrategy = executionStrategy == null ? ExecutionStrategy.SEQUENTIAL : executionStrategy;
        defaultFixSeverities = defaultFixSeverities == null || defaultFixSeverities.isEmpty()
                ? Set.of() : Set.copyOf(EnumSet.copyOf(defaultFixSeverities));
        invocationTimeout = invocationTimeout == null ? Duration.ZERO : invocationTimeout;
        storeBaseDir = storeBaseDir == null ? Path.of(".plan") : storeBaseDir;
    }

    public static OrchestratorConfig defaults() {
        return from(new PlanMarshallProperties());
    }

    public static OrchestratorConfig from(PlanMarshallProperties props) {
        Set<Severity> fixSeverities = EnumSet.noneOf(Severity.class);
        for (String raw : props.getTriage().getDefaultFixSeverities()) {
            try {
                fixSeverities.add(Severity.valueOf(raw.trim().toUpperCase(Locale.ROOT)));
            } catch (IllegalArgumentException e) {
                throw new ValidationException("Unknown severity in planmarshall.triage.default-fix-severities: " + raw);
            }
        }
        int timeout = props.getInvocation().getTimeoutSeconds();
        return new OrchestratorConfig(
                props.getRefine().getConfidenceThreshold(),
                props.getRefine().getMaxIterations(),
                props.getOutline().getMaxIterations(),
                props.getVerify().getMaxIterations(),
                props.getOutline().isRequireReview(),
                props.getExecute().getStrategy(),
                props.getExecute().getMaxParallel(),
                fixSeverities,
                timeout > 0 ? Duration.ofSeconds(timeout) : Duration.ZERO,
                Path.of(props.getStore().getBaseDir()));
    }

    public OrchestratorConfig withRequireOutlineReview(boolean review) {
        return new OrchestratorConfig(refineConfidenceThreshold, maxRefineIterations, maxOutlineIterations,
                maxVerifyIterations, review, executionStrategy, maxParallel, defaultFixSeverities,
                invocationTimeout, storeBaseDir);
    }

    public OrchestratorConfig withStoreBaseDir(Path dir) {
        return new OrchestratorConfig(refineConfidenceThreshold, maxRefineIterations, maxOutlineIterations,
                maxVerifyIterations, requireOutlineReview, executionStrategy, maxParallel, defaultFixSeverities,
                invocationTimeout, dir);
    }

    public OrchestratorConfig withExecution(ExecutionStrategy strategy, int parallel) {
        return new OrchestratorConfig(refineConfidenceThreshold, maxRefineIterations, maxOutlineIterations,
                maxVerifyIterations, requireOutlineReview, strategy, parallel, defaultFixSeverities,
                invocationTimeout, storeBaseDir);
    }

    public OrchestratorConfig withInvocationTimeout(Duration timeout) {
        return new OrchestratorConfig(refineConfidenceThreshold, maxRefineIterations, maxOutlineIterations,
                maxVerifyIterations, requireOutlineReview, executionStrategy, maxParallel, defaultFixSeverities,
                timeout, storeBaseDir);
    }
}
