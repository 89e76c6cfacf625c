package com.texflow.core.health;

import com.texflow.core.worker.WorkerProperties;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Periodically writes this process's heartbeat while a dedicated worker is
 * running. Started and stopped by the worker command, not at context startup,
 * so a web process never advertises itself as a worker.
 */
@Component
public class HeartbeatPublisher {

    private static final Logger log = LoggerFactory.getLogger(HeartbeatPublisher.class);

    private final HeartbeatStore store;
    private final String instanceId;
    private final long intervalMs;
    private final long pid = ProcessHandle.current().pid();
    private final String host = resolveHost();

    private ScheduledExecutorService scheduler;
    private ScheduledFuture<?> task;

    public HeartbeatPublisher(HeartbeatStore store, WorkerProperties properties) {
        this(store, properties.getInstanceId(), properties.getHeartbeatIntervalMs());
    }

    HeartbeatPublisher(HeartbeatStore store, String instanceId, long intervalMs) {
        this.store = store;
        this.instanceId = instanceId;
        this.intervalMs = intervalMs;
    }

    public synchronized void start() {
        if (task != null) {
            return;
        }
        beat();
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "worker-heartbeat");
            t.setDaemon(true);
            return t;
        });
        task = scheduler.scheduleAtFixedRate(this::beat, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        log.info("Heartbeat started for worker {} (interval={}ms)", instanceId, intervalMs);
    }

    public synchronized boolean isRunning() {
        return task != null;
    }

    @PreDestroy
    public synchronized void stop() {
        if (task != null) {
            task.cancel(false);
            task = null;
            try {
                store.remove(instanceId);
            } catch (RuntimeException e) {
                log.warn("Failed to remove heartbeat for worker {}: {}", instanceId, e.getMessage());
            }
            log.info("Heartbeat stopped for worker {}", instanceId);
        }
        if (scheduler != null) {
            scheduler.shutdownNow();
            scheduler = null;
        }
    }

    public String getInstanceId() {
        return instanceId;
    }

    void beat() {
        try {
            store.publishHeartbeat(new Heartbeat(instanceId, pid, host, System.currentTimeMillis()));
        } catch (RuntimeException e) {
            log.warn("Heartbeat publish failed for worker {}: {}", instanceId, e.getMessage());
        }
    }

    private static String resolveHost() {
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            return "unknown";
        }
    }
}
