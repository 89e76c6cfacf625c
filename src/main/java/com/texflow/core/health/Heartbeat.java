package com.texflow.core.health;

/**
 * Liveness signal written by a running worker, overwritten on every beat.
 */
public record Heartbeat(String instanceId, long pid, String host, long timestampMs) {

    public long ageMs(long nowMs) {
        return nowMs - timestampMs;
    }

    /** A heartbeat from the future (clock skew) is not treated as fresh. */
    public boolean isFresh(long nowMs, long maxAgeMs) {
        long age = ageMs(nowMs);
        return age >= 0 && age <= maxAgeMs;
    }
}
