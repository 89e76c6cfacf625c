package com.texflow.core.cancel;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local registry for the embedded single-process setup and tests.
 * Markers are not visible to other processes.
 */
public class InMemoryCancellationRegistry implements CancellationRegistry {

    private final Map<String, Instant> markers = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryCancellationRegistry() {
        this(Clock.systemUTC());
    }

    public InMemoryCancellationRegistry(Clock clock) {
        this.clock = clock;
    }

    @Override
    public void setCancel(String jobId, Duration ttl) {
        markers.put(jobId, clock.instant().plus(ttl));
    }

    @Override
    public boolean isCanceled(String jobId) {
        Instant expiresAt = markers.get(jobId);
        if (expiresAt == null) {
            return false;
        }
        if (!expiresAt.isAfter(clock.instant())) {
            markers.remove(jobId, expiresAt);
            return false;
        }
        return true;
    }

    @Override
    public void clear(String jobId) {
        markers.remove(jobId);
    }

    @Override
    public int purgeExpired() {
        Instant now = clock.instant();
        int before = markers.size();
        markers.values().removeIf(expiresAt -> !expiresAt.isAfter(now));
        return before - markers.size();
    }
}
