package com.texflow.core.events;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.texflow.core.logparser.LatexLogParser;
import com.texflow.core.metrics.TexflowMetrics;
import com.texflow.core.model.CompileJob;
import com.texflow.core.model.JobStatus;
import com.texflow.core.model.JobStatusChange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Fire-and-forget broadcast of job lifecycle transitions.
 * <p>
 * Every event goes to the in-process {@link EventBus} and, when one is
 * configured, to the shared {@link PubSubChannel}. Publishing never throws
 * and never blocks job processing on the outcome; failures are logged and
 * counted, not retried.
 */
@Service
public class StatusPublisher {

    private static final Logger log = LoggerFactory.getLogger(StatusPublisher.class);

    public static final String CHANNEL = "texflow_build_status";

    private final EventBus eventBus;
    private final ObjectMapper objectMapper;
    private final PubSubChannel channel;
    private final TexflowMetrics metrics;

    public StatusPublisher(EventBus eventBus, ObjectMapper objectMapper,
                           @Autowired(required = false) PubSubChannel channel,
                           @Autowired(required = false) TexflowMetrics metrics) {
        this.eventBus = eventBus;
        this.objectMapper = objectMapper;
        this.channel = channel;
        this.metrics = metrics;
    }

    public void publishStatus(CompileJob job, JobStatus status) {
        publish(StatusEvent.statusOnly(job.jobId(), job.projectId(), status));
    }

    public void publishComplete(CompileJob job, JobStatusChange change, String pdfUrl) {
        long durationMs = change.durationMs() != null ? change.durationMs() : 0L;
        publish(StatusEvent.complete(job.jobId(), job.projectId(), change.status(), change.engineUsed(),
                change.status() == JobStatus.SUCCESS ? pdfUrl : null,
                change.logs(), durationMs, LatexLogParser.errorsOnly(change.entries()), job.triggeredBy()));
    }

    public void publish(StatusEvent event) {
        try {
            eventBus.publish(event);
        } catch (RuntimeException e) {
            log.warn("Local delivery of {} for job {} failed: {}", event.eventType(), event.jobId(), e.getMessage());
        }
        if (channel == null) {
            return;
        }
        try {
            channel.publish(CHANNEL, objectMapper.writeValueAsString(event));
        } catch (Exception e) {
            log.warn("Failed to publish {} for job {}: {}", event.eventType(), event.jobId(), e.getMessage());
            if (metrics != null) {
                metrics.recordPublishFailure();
            }
        }
    }
}
