package com.texflow.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for compile job processing.
 */
@Service
public class TexflowMetrics {

    private final MeterRegistry registry;

    public TexflowMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordCompileDuration(String engine, long ms) {
        Timer.builder("texflow.compile.duration")
                .tag("engine", engine)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordJobResult(String status) {
        Counter.builder("texflow.jobs.total")
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public void recordEnqueued(String kind) {
        Counter.builder("texflow.queue.enqueued")
                .tag("kind", kind)
                .register(registry)
                .increment();
    }

    /**
     * @param outcome "removed", "running", "not_found" or "unconfirmed"
     */
    public void recordCancelRequest(String outcome) {
        Counter.builder("texflow.cancel.requests")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public void recordPublishFailure() {
        Counter.builder("texflow.publish.failures")
                .description("Status events that could not be delivered to the pub/sub channel")
                .register(registry)
                .increment();
    }

    public void recordLogEntries(int errors, int warnings) {
        DistributionSummary.builder("texflow.compile.log_errors")
                .register(registry)
                .record(errors);
        DistributionSummary.builder("texflow.compile.log_warnings")
                .register(registry)
                .record(warnings);
    }
}
