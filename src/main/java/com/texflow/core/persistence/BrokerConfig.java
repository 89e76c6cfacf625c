package com.texflow.core.persistence;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.texflow.core.cancel.CancellationRegistry;
import com.texflow.core.cancel.InMemoryCancellationRegistry;
import com.texflow.core.cancel.JdbcCancellationRegistry;
import com.texflow.core.events.JdbcNotifyChannel;
import com.texflow.core.health.HeartbeatStore;
import com.texflow.core.health.InMemoryHeartbeatStore;
import com.texflow.core.health.JdbcHeartbeatStore;
import com.texflow.core.queue.InMemoryJobQueue;
import com.texflow.core.queue.JdbcJobQueue;
import com.texflow.core.queue.JobQueue;
import com.texflow.core.queue.QueueProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;

/**
 * Spring {@link Configuration} for the shared broker: job queue, cancel
 * markers, worker heartbeats and the status channel.
 * <p>
 * With {@code texflow.broker.provider=jdbc} (the default) all four live in
 * PostgreSQL and every web and worker process sees the same state. With
 * {@code memory} they are process-local, which only works when the worker
 * is embedded in the web process.
 */
@Configuration
public class BrokerConfig {

    private static final Logger log = LoggerFactory.getLogger(BrokerConfig.class);

    @Bean
    @ConditionalOnProperty(name = "texflow.broker.provider", havingValue = "jdbc", matchIfMissing = true)
    public CancellationRegistry jdbcCancellationRegistry(DataSource dataSource) throws Exception {
        log.info("Configuring JDBC cancellation registry (PostgreSQL)");
        var registry = new JdbcCancellationRegistry(dataSource);
        registry.createTables();
        return registry;
    }

    @Bean
    @ConditionalOnProperty(name = "texflow.broker.provider", havingValue = "jdbc", matchIfMissing = true)
    public JobQueue jdbcJobQueue(DataSource dataSource, ObjectMapper objectMapper,
                                 CancellationRegistry cancellationRegistry,
                                 QueueProperties properties) throws Exception {
        log.info("Configuring JDBC job queue '{}'", properties.getName());
        var queue = new JdbcJobQueue(dataSource, objectMapper, cancellationRegistry,
                properties.getName(), properties.getCancelTtl());
        queue.createTables();
        return queue;
    }

    @Bean
    @ConditionalOnProperty(name = "texflow.broker.provider", havingValue = "jdbc", matchIfMissing = true)
    public HeartbeatStore jdbcHeartbeatStore(DataSource dataSource) throws Exception {
        var store = new JdbcHeartbeatStore(dataSource);
        store.createTables();
        return store;
    }

    @Bean
    @ConditionalOnProperty(name = "texflow.broker.provider", havingValue = "jdbc", matchIfMissing = true)
    public JdbcNotifyChannel jdbcNotifyChannel(DataSource dataSource) throws Exception {
        var channel = new JdbcNotifyChannel(dataSource);
        channel.createTables();
        return channel;
    }

    /**
     * Process-local fallbacks. State is lost on restart and invisible to
     * other processes.
     */
    @Bean
    @ConditionalOnMissingBean(CancellationRegistry.class)
    public CancellationRegistry memoryCancellationRegistry() {
        log.info("Using in-memory broker (queue state will not persist across restarts)");
        return new InMemoryCancellationRegistry();
    }

    @Bean
    @ConditionalOnMissingBean(JobQueue.class)
    public JobQueue memoryJobQueue(CancellationRegistry cancellationRegistry, QueueProperties properties) {
        return new InMemoryJobQueue(cancellationRegistry, properties.getCancelTtl());
    }

    @Bean
    @ConditionalOnMissingBean(HeartbeatStore.class)
    public HeartbeatStore memoryHeartbeatStore() {
        return new InMemoryHeartbeatStore();
    }
}
