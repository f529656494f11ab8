package com.planmarshall.core.config;

import com.planmarshall.core.model.ExecutionStrategy;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Bound {@code planmarshall.*} configuration. Converted once into {@link OrchestratorConfig}.
 */
@Component
@ConfigurationProperties(prefix = "planmarshall")
public class PlanMarshallProperties {

    private Refine refine = new Refine();
    private Outline outline = new Outline();
    private Verify verify = new Verify();
    private Execute execute = new Execute();
    private Triage triage = new Triage();
    private Invocation invocation = new Invocation();
    private Store store = new Store();

    public Refine getRefine() { return refine; }
    public void setRefine(Refine refine) { this.refine = refine; }
    public Outline getOutline() { return outline; }
    public void setOutline(Outline outline) { this.outline = outline; }
    public Verify getVerify() { return verify; }
    public void setVerify(Verify verify) { this.verify = verify; }
    public Execute getExecute() { return execute; }
    public void setExecute(Execute execute) { this.execute = execute; }
    public Triage getTriage() { return triage; }
    public void setTriage(Triage triage) { this.triage = triage; }
    public Invocation getInvocation() { return invocation; }
    public void setInvocation(Invocation invocation) { this.invocation = invocation; }
    public Store getStore() { return store; }
    public void setStore(Store store) { this.store = store; }

    public static class Refine {
        private int confidenceThreshold = 95;
        private int maxIterations = 3;

        public int getConfidenceThreshold() { return confidenceThreshold; }
        public void setConfidenceThreshold(int confidenceThreshold) { this.confidenceThreshold = confidenceThreshold; }
        public int getMaxIterations() { return maxIterations; }
        public void setMaxIterations(int maxIterations) { this.maxIterations = maxIterations; }
    }

    public static class Outline {
        private int maxIterations = 3;
        private boolean requireReview = true;

        public int getMaxIterations() { return maxIterations; }
        public void setMaxIterations(int maxIterations) { this.maxIterations = maxIterations; }
        public boolean isRequireReview() { return requireReview; }
        public void setRequireReview(boolean requireReview) { this.requireReview = requireReview; }
    }

    public static class Verify {
        private int maxIterations = 5;

        public int getMaxIterations() { return maxIterations; }
        public void setMaxIterations(int maxIterations) { this.maxIterations = maxIterations; }
    }

    public static class Execute {
        private ExecutionStrategy strategy = ExecutionStrategy.SEQUENTIAL;
        private int maxParallel = 4;

        public ExecutionStrategy getStrategy() { return strategy; }
        public void setStrategy(ExecutionStrategy strategy) { this.strategy = strategy; }
        public int getMaxParallel() { return maxParallel; }
        public void setMaxParallel(int maxParallel) { this.maxParallel = maxParallel; }
    }

    public static class Triage {
        private List<String> defaultFixSeverities = new ArrayList<>(List.of("BLOCKER", "MAJOR"));

        public List<String> getDefaultFixSeverities() { return defaultFixSeverities; }
        public void setDefaultFixSeverities(List<String> defaultFixSeverities) { this.defaultFixSeverities = defaultFixSeverities; }
    }

    public static class Invocation {
        /** Wall-clock timeout for external calls in seconds; 0 disables it. */
        private int timeoutSeconds = 0;

        public int getTimeoutSeconds() { return timeoutSeconds; }
        public void setTimeoutSeconds(int timeoutSeconds) { this.timeoutSeconds = timeoutSeconds; }
    }

    public static class Store {
        private String baseDir = ".plan";

        public String getBaseDir() { return baseDir; }
        public void setBaseDir(String baseDir) { this.baseDir = baseDir; }
    }
}
