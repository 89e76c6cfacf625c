package com.texflow.core.ephemeral;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.texflow.core.model.Engine;
import com.texflow.core.model.JobStatus;
import com.texflow.core.model.JobStatusChange;

import java.time.Duration;
import java.time.Instant;

/**
 * Metadata of a one-shot compile, persisted as {@code metadata.json} next to
 * its artifacts. Expires {@code ttl} after creation, or after completion once
 * the job reaches a terminal state.
 */
public record EphemeralJobRecord(
        String id,
        String userId,
        JobStatus status,
        int statusSchemaVersion,
        Engine requestedEngine,
        Engine engineUsed,
        String mainFile,
        long warningCount,
        long errorCount,
        Long durationMs,
        Integer exitCode,
        String message,
        Instant createdAt,
        Instant startedAt,
        Instant completedAt,
        Instant expiresAt
) {

    public static EphemeralJobRecord queued(String id, String userId, Engine requestedEngine,
                                            String mainFile, Instant now, Duration ttl) {
        return new EphemeralJobRecord(id, userId, JobStatus.QUEUED, JobStatus.SCHEMA_VERSION,
                requestedEngine, null, mainFile, 0, 0, null, null, null,
                now, null, null, now.plus(ttl));
    }

    @JsonIgnore
    public boolean isTerminal() {
        return status.isTerminal();
    }

    /**
     * Anonymous submissions are visible to any caller; owned ones only to
     * their owner.
     */
    public boolean isVisibleTo(String callerId) {
        return userId == null || userId.equals(callerId);
    }

    public boolean isExpired(Instant now) {
        return expiresAt != null && !expiresAt.isAfter(now);
    }

    /**
     * Applies a transition. Fields absent from the change keep their values;
     * reaching a terminal state restarts the TTL from completion.
     */
    EphemeralJobRecord apply(JobStatusChange change, Duration ttl, Instant now) {
        boolean terminal = change.status().isTerminal();
        Instant completed = terminal
                ? (change.completedAt() != null ? change.completedAt() : now)
                : completedAt;
        return new EphemeralJobRecord(
                id,
                userId,
                change.status(),
                JobStatus.SCHEMA_VERSION,
                requestedEngine,
                change.engineUsed() != null ? change.engineUsed() : engineUsed,
                mainFile,
                terminal ? change.warningCount() : warningCount,
                terminal ? change.errorCount() : errorCount,
                change.durationMs() != null ? change.durationMs() : durationMs,
                change.exitCode() != null ? change.exitCode() : exitCode,
                change.message() != null ? change.message() : message,
                createdAt,
                change.startedAt() != null ? change.startedAt() : startedAt,
                completed,
                terminal ? completed.plus(ttl) : expiresAt);
    }
}
