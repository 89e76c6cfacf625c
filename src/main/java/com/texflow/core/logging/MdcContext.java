package com.texflow.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing TexFlow-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setJob(String jobId, String kind) {
        MDC.put("jobId", jobId);
        MDC.put("jobKind", kind);
    }

    public static void setEngine(String engine) {
        MDC.put("engine", engine);
    }

    public static void setWorker(String workerId) {
        MDC.put("workerId", workerId);
    }

    public static void clear() {
        MDC.remove("jobId");
        MDC.remove("jobKind");
        MDC.remove("engine");
        MDC.remove("workerId");
    }
}
