package com.texflow.core.cancel;

import java.time.Duration;

/**
 * Shared, TTL-bearing store of cancel requests keyed by job id.
 *
 * <p>A marker is a request, never a confirmation that work stopped. Any
 * worker process can observe a marker set by any other process. Once the
 * TTL elapses a marker is indistinguishable from one that was never set;
 * the TTL must therefore exceed the longest compile timeout.
 */
public interface CancellationRegistry {

    /** Sets or refreshes the marker. Setting it twice is harmless. */
    void setCancel(String jobId, Duration ttl);

    boolean isCanceled(String jobId);

    void clear(String jobId);

    /**
     * Drops markers whose TTL has passed.
     *
     * @return number of markers removed
     */
    int purgeExpired();
}
