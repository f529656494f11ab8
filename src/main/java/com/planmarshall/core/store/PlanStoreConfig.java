package com.planmarshall.core.store;

import com.planmarshall.core.config.OrchestratorConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Provides the {@link PlanStore} bean. A host application may replace it with its own store.
 */
@Configuration
public class PlanStoreConfig {

    private static final Logger log = LoggerFactory.getLogger(PlanStoreConfig.class);

    @Bean
    @ConditionalOnMissingBean(PlanStore.class)
    public PlanStore filePlanStore(OrchestratorConfig config) {
        log.info("Persisting plans under {}", config.storeBaseDir().toAbsolutePath());
        return new FilePlanStore(config.storeBaseDir());
    }
}
