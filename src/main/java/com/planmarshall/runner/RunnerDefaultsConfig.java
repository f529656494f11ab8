package com.planmarshall.runner;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Conservative collaborators used only when the host application declares none.
 */
@Configuration
public class RunnerDefaultsConfig {

    private static final Logger log = LoggerFactory.getLogger(RunnerDefaultsConfig.class);

    @Bean
    @ConditionalOnMissingBean(RequestAnalyzer.class)
    public RequestAnalyzer contextRequestAnalyzer() {
        log.info("No RequestAnalyzer bean; requests are accepted as stated");
        return new ContextRequestAnalyzer();
    }

    @Bean
    @ConditionalOnMissingBean(TaskExecutor.class)
    public TaskExecutor unconfiguredTaskExecutor() {
        log.warn("No TaskExecutor bean; every task will be blocked");
        return new UnconfiguredTaskExecutor();
    }

    @Bean
    @ConditionalOnMissingBean(VerificationRunner.class)
    public VerificationRunner noOpVerificationRunner() {
        log.warn("No VerificationRunner bean; verification always passes");
        return new NoOpVerificationRunner();
    }

    @Bean
    @ConditionalOnMissingBean(Finalizer.class)
    public Finalizer loggingFinalizer() {
        return new LoggingFinalizer();
    }
}
