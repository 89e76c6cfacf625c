package com.texflow.core.events;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.texflow.core.model.Engine;
import com.texflow.core.model.JobStatus;
import com.texflow.core.model.ParsedLogEntry;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;

/**
 * A job lifecycle broadcast. Status-only events ({@code queued},
 * {@code compiling}) carry just the identifiers and status; complete events
 * add logs, duration, parsed errors and the artifact reference.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record StatusEvent(
        String eventType,
        String jobId,
        String projectId,
        JobStatus status,
        Engine engineUsed,
        String pdfUrl,
        String logs,
        Long durationMs,
        List<ParsedLogEntry> errors,
        String triggeredBy,
        Instant timestamp
) implements Serializable {

    public static final String STATUS = "build:status";
    public static final String COMPLETE = "build:complete";

    public static StatusEvent statusOnly(String jobId, String projectId, JobStatus status) {
        return new StatusEvent(STATUS, jobId, projectId, status, null, null, null, null, null, null,
                Instant.now());
    }

    public static StatusEvent complete(String jobId, String projectId, JobStatus status, Engine engineUsed,
                                       String pdfUrl, String logs, long durationMs,
                                       List<ParsedLogEntry> errors, String triggeredBy) {
        return new StatusEvent(COMPLETE, jobId, projectId, status, engineUsed, pdfUrl, logs, durationMs,
                errors == null ? List.of() : List.copyOf(errors), triggeredBy, Instant.now());
    }

    public boolean isComplete() {
        return COMPLETE.equals(eventType);
    }
}
