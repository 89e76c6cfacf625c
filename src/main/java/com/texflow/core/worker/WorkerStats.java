package com.texflow.core.worker;

/**
 * Point-in-time counters of an in-process worker.
 */
public record WorkerStats(
        boolean running,
        int activeJobs,
        int maxConcurrent,
        long totalProcessed,
        long totalErrors,
        long uptimeMs
) {}
