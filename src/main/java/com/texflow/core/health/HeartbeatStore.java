package com.texflow.core.health;

import java.util.Optional;

/**
 * Shared store of worker heartbeats, one record per worker instance.
 */
public interface HeartbeatStore {

    void publishHeartbeat(Heartbeat heartbeat);

    /** Most recent heartbeat across all instances. */
    Optional<Heartbeat> latest();

    /**
     * Removes the record of {@code instanceId} only; a newer worker that
     * took over under another id is left alone.
     */
    void remove(String instanceId);

    default boolean isHealthy(long maxAgeMs) {
        return isHealthy(System.currentTimeMillis(), maxAgeMs);
    }

    default boolean isHealthy(long nowMs, long maxAgeMs) {
        return latest().map(hb -> hb.isFresh(nowMs, maxAgeMs)).orElse(false);
    }
}
