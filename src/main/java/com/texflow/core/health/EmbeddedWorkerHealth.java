package com.texflow.core.health;

import com.texflow.core.worker.CompileWorker;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Worker health for the embedded topology, read from the in-process
 * worker's counters. Never consults the heartbeat store.
 */
public class EmbeddedWorkerHealth implements WorkerHealthCheck {

    private final CompileWorker worker;

    public EmbeddedWorkerHealth(CompileWorker worker) {
        this.worker = worker;
    }

    @Override
    public DeploymentMode mode() {
        return DeploymentMode.EMBEDDED;
    }

    @Override
    public boolean isAvailable() {
        return worker.isRunning();
    }

    @Override
    public Map<String, Object> details() {
        var stats = worker.stats();
        var details = new LinkedHashMap<String, Object>();
        details.put("running", stats.running());
        details.put("activeJobs", stats.activeJobs());
        details.put("maxConcurrent", stats.maxConcurrent());
        details.put("totalProcessed", stats.totalProcessed());
        details.put("totalErrors", stats.totalErrors());
        details.put("uptimeMs", stats.uptimeMs());
        return details;
    }
}
