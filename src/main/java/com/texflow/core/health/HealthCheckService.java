package com.texflow.core.health;

import com.texflow.core.ephemeral.StorageProperties;
import com.texflow.core.queue.JobQueue;
import com.texflow.core.queue.QueueState;
import com.texflow.sandbox.CompileExecutionEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Component checks behind {@code GET /api/v1/health} and {@code texflow health}.
 * Container runtime and image checks only run where compiles run in-process;
 * a dedicated worker is judged by its heartbeat alone.
 */
@Service
public class HealthCheckService {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckService.class);

    private final JobQueue queue;
    private final CompileExecutionEngine engine;
    private final WorkerHealthCheck workerHealth;
    private final Path storageRoot;

    public HealthCheckService(JobQueue queue, CompileExecutionEngine engine,
                              WorkerHealthCheck workerHealth, StorageProperties storageProperties) {
        this(queue, engine, workerHealth, Path.of(storageProperties.getRoot()));
    }

    HealthCheckService(JobQueue queue, CompileExecutionEngine engine,
                       WorkerHealthCheck workerHealth, Path storageRoot) {
        this.queue = queue;
        this.engine = engine;
        this.workerHealth = workerHealth;
        this.storageRoot = storageRoot;
    }

    public List<HealthStatus> checkAll() {
        var results = new ArrayList<HealthStatus>();
        results.add(checkQueue());
        if (workerHealth.mode() == DeploymentMode.EMBEDDED) {
            results.add(checkDocker());
            results.add(checkImage());
        }
        results.add(checkStorage());
        results.add(checkWorker());
        return results;
    }

    public static boolean allUp(List<HealthStatus> checks) {
        return checks.stream().allMatch(c -> c.status() == HealthStatus.Status.UP);
    }

    private HealthStatus checkQueue() {
        try {
            Map<QueueState, Long> counts = queue.counts();
            var metadata = new LinkedHashMap<String, String>();
            counts.forEach((state, count) -> metadata.put(state.dbValue(), String.valueOf(count)));
            return new HealthStatus("queue", HealthStatus.Status.UP, "Broker reachable", metadata);
        } catch (Exception e) {
            log.warn("Queue health check failed: {}", e.getMessage());
            return new HealthStatus("queue", HealthStatus.Status.DOWN,
                    "Broker error: " + e.getMessage(), Map.of());
        }
    }

    private HealthStatus checkDocker() {
        if (engine.isRuntimeReachable()) {
            return new HealthStatus("docker", HealthStatus.Status.UP,
                    "Container runtime reachable", Map.of());
        }
        return new HealthStatus("docker", HealthStatus.Status.DOWN,
                "Container runtime not reachable", Map.of());
    }

    private HealthStatus checkImage() {
        String image = engine.getImage();
        if (engine.isImageAvailable()) {
            return new HealthStatus("image", HealthStatus.Status.UP,
                    "Compiler image present", Map.of("image", image));
        }
        return new HealthStatus("image", HealthStatus.Status.DOWN,
                "Compiler image missing: " + image, Map.of("image", image));
    }

    private HealthStatus checkStorage() {
        if (Files.isDirectory(storageRoot) && Files.isWritable(storageRoot)) {
            return new HealthStatus("storage", HealthStatus.Status.UP,
                    "Storage root writable", Map.of("root", storageRoot.toString()));
        }
        return new HealthStatus("storage", HealthStatus.Status.DOWN,
                "Storage root missing or read-only: " + storageRoot, Map.of("root", storageRoot.toString()));
    }

    private HealthStatus checkWorker() {
        var metadata = new LinkedHashMap<String, String>();
        metadata.put("mode", workerHealth.mode().name().toLowerCase());
        workerHealth.details().forEach((k, v) -> metadata.put(k, String.valueOf(v)));
        if (workerHealth.isAvailable()) {
            return new HealthStatus("worker", HealthStatus.Status.UP, "Worker available", metadata);
        }
        return new HealthStatus("worker", HealthStatus.Status.DOWN, "Worker unavailable", metadata);
    }
}
