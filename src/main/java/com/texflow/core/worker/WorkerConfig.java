package com.texflow.core.worker;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class WorkerConfig {

    private static final Logger log = LoggerFactory.getLogger(WorkerConfig.class);

    /**
     * Logging-only project hook, used when the web tier does not provide one.
     */
    @Bean
    @ConditionalOnMissingBean(ProjectPersistenceHook.class)
    public ProjectPersistenceHook loggingProjectPersistenceHook() {
        log.info("No ProjectPersistenceHook bean found; project build transitions will only be logged");
        return new LoggingProjectPersistenceHook();
    }
}
