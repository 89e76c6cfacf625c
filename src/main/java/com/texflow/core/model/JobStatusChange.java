package com.texflow.core.model;

import java.time.Instant;
import java.util.List;

/**
 * A single lifecycle transition of a job together with the fields that
 * changed with it. Fields that do not apply to a transition are null.
 */
public record JobStatusChange(
        String jobId,
        JobStatus status,
        Engine engineUsed,
        String logs,
        Integer exitCode,
        Long durationMs,
        Instant startedAt,
        Instant completedAt,
        String message,
        List<ParsedLogEntry> entries,
        String pdfPath
) {

    public JobStatusChange {
        if (jobId == null || status == null) {
            throw new IllegalArgumentException("jobId and status are required");
        }
        entries = entries == null ? List.of() : List.copyOf(entries);
    }

    public static JobStatusChange compiling(String jobId, Instant startedAt, Engine engineUsed) {
        return new JobStatusChange(jobId, JobStatus.COMPILING, engineUsed, null, null, null,
                startedAt, null, null, List.of(), null);
    }

    /** Canceled before a container was ever started. */
    public static JobStatusChange canceledBeforeStart(String jobId, Instant completedAt) {
        return new JobStatusChange(jobId, JobStatus.CANCELED, null, "", -1, 0L,
                null, completedAt, "Build canceled before starting.", List.of(), null);
    }

    /** Failure of the pipeline itself rather than of the user's LaTeX. */
    public static JobStatusChange infrastructureError(String jobId, Engine engineUsed, String detail,
                                                      long durationMs, Instant completedAt) {
        String message = "Compilation infrastructure error: " + detail;
        return new JobStatusChange(jobId, JobStatus.ERROR, engineUsed, message, -1, durationMs,
                null, completedAt, message,
                List.of(ParsedLogEntry.error("system", 0, message)), null);
    }

    public long warningCount() {
        return entries.stream().filter(e -> e.type() == ParsedLogEntry.Type.WARNING).count();
    }

    public long errorCount() {
        return entries.stream().filter(ParsedLogEntry::isError).count();
    }
}
