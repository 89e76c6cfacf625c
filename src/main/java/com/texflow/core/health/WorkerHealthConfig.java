package com.texflow.core.health;

import com.texflow.core.worker.CompileWorker;
import com.texflow.core.worker.WorkerProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Single place where the deployment mode selects the worker health strategy.
 */
@Configuration
public class WorkerHealthConfig {

    private static final Logger log = LoggerFactory.getLogger(WorkerHealthConfig.class);

    @Bean
    public WorkerHealthCheck workerHealthCheck(WorkerProperties properties,
                                               ObjectProvider<CompileWorker> worker,
                                               HeartbeatStore heartbeatStore) {
        log.info("Worker deployment mode: {}", properties.getMode());
        return switch (properties.getMode()) {
            case EMBEDDED -> new EmbeddedWorkerHealth(worker.getObject());
            case DEDICATED -> new DedicatedWorkerHealth(heartbeatStore, properties.getHeartbeatMaxAgeMs());
        };
    }
}
