package com.texflow.core.metrics;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class TexflowMetricsTest {

    private SimpleMeterRegistry registry;
    private TexflowMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new TexflowMetrics(registry);
    }

    @Test
    @DisplayName("recordCompileDuration creates a timer per engine")
    void recordCompileDuration() {
        metrics.recordCompileDuration("pdflatex", 1500);
        metrics.recordCompileDuration("xelatex", 300);

        var timer = registry.find("texflow.compile.duration").tag("engine", "pdflatex").timer();
        assertNotNull(timer);
        assertEquals(1, timer.count());
        assertEquals(1500.0, timer.totalTime(TimeUnit.MILLISECONDS));
    }

    @Test
    @DisplayName("recordJobResult counts by status")
    void recordJobResult() {
        metrics.recordJobResult("success");
        metrics.recordJobResult("success");
        metrics.recordJobResult("timeout");

        assertEquals(2.0, registry.find("texflow.jobs.total").tag("status", "success").counter().count());
        assertEquals(1.0, registry.find("texflow.jobs.total").tag("status", "timeout").counter().count());
    }

    @Test
    @DisplayName("recordCancelRequest counts by outcome")
    void recordCancelRequest() {
        metrics.recordCancelRequest("removed");
        metrics.recordCancelRequest("unconfirmed");

        assertEquals(1.0, registry.find("texflow.cancel.requests").tag("outcome", "removed").counter().count());
        assertEquals(1.0, registry.find("texflow.cancel.requests").tag("outcome", "unconfirmed").counter().count());
    }

    @Test
    @DisplayName("recordEnqueued and recordPublishFailure increment counters")
    void counters() {
        metrics.recordEnqueued("ephemeral");
        metrics.recordPublishFailure();
        metrics.recordPublishFailure();

        assertEquals(1.0, registry.find("texflow.queue.enqueued").tag("kind", "ephemeral").counter().count());
        assertEquals(2.0, registry.find("texflow.publish.failures").counter().count());
    }

    @Test
    @DisplayName("recordLogEntries records distributions")
    void recordLogEntries() {
        metrics.recordLogEntries(2, 5);

        assertEquals(2.0, registry.find("texflow.compile.log_errors").summary().totalAmount());
        assertEquals(5.0, registry.find("texflow.compile.log_warnings").summary().totalAmount());
    }
}
