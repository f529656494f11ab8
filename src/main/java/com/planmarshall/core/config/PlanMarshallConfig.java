package com.planmarshall.core.config;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Converts the bound properties into the immutable {@link OrchestratorConfig} and supplies
 * infrastructure beans the host application may not provide.
 */
@Configuration
public class PlanMarshallConfig {

    private static final Logger log = LoggerFactory.getLogger(PlanMarshallConfig.class);

    @Bean
    public OrchestratorConfig orchestratorConfig(PlanMarshallProperties properties) {
        var config = OrchestratorConfig.from(properties);
        log.info("Orchestrator config: refine threshold={}, max iterations refine={} outline={} verify={}, "
                        + "outline review={}, strategy={} (max {}), default fix severities={}",
                config.refineConfidenceThreshold(), config.maxRefineIterations(), config.maxOutlineIterations(),
                config.maxVerifyIterations(), config.requireOutlineReview(), config.executionStrategy(),
                config.maxParallel(), config.defaultFixSeverities());
        return config;
    }

    @Bean
    @ConditionalOnMissingBean(Clock.class)
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Metrics fallback when no actuator registry is on the classpath.
     */
    @Bean
    @ConditionalOnMissingBean(MeterRegistry.class)
    public MeterRegistry simpleMeterRegistry() {
        return new SimpleMeterRegistry();
    }
}
