package com.texflow.core.health;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.LongSupplier;

/**
 * Worker health for the dedicated topology, derived purely from heartbeat
 * freshness since this process has no view into the worker.
 */
public class DedicatedWorkerHealth implements WorkerHealthCheck {

    private static final Logger log = LoggerFactory.getLogger(DedicatedWorkerHealth.class);

    private final HeartbeatStore store;
    private final long maxAgeMs;
    private final LongSupplier clock;

    public DedicatedWorkerHealth(HeartbeatStore store, long maxAgeMs) {
        this(store, maxAgeMs, System::currentTimeMillis);
    }

    DedicatedWorkerHealth(HeartbeatStore store, long maxAgeMs, LongSupplier clock) {
        this.store = store;
        this.maxAgeMs = maxAgeMs;
        this.clock = clock;
    }

    @Override
    public DeploymentMode mode() {
        return DeploymentMode.DEDICATED;
    }

    @Override
    public boolean isAvailable() {
        try {
            return store.isHealthy(clock.getAsLong(), maxAgeMs);
        } catch (RuntimeException e) {
            log.warn("Heartbeat check failed: {}", e.getMessage());
            return false;
        }
    }

    @Override
    public Map<String, Object> details() {
        var details = new LinkedHashMap<String, Object>();
        details.put("maxAgeMs", maxAgeMs);
        try {
            store.latest().ifPresentOrElse(hb -> {
                details.put("instanceId", hb.instanceId());
                details.put("host", hb.host());
                details.put("ageMs", hb.ageMs(clock.getAsLong()));
            }, () -> details.put("heartbeat", "none"));
        } catch (RuntimeException e) {
            details.put("heartbeat", "unreadable: " + e.getMessage());
        }
        return details;
    }
}
