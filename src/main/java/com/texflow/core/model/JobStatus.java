package com.texflow.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Lifecycle status of a compile job.
 *
 * <p>The set of states is versioned. Schema version 1 knew only
 * {@code queued}, {@code compiling}, {@code success} and {@code error};
 * version 2 added {@code timeout} and {@code canceled}. Readers decoding a
 * status written under an older schema pass that version to
 * {@link #fromWire(String, int)} so states it did not define are rejected
 * instead of being silently accepted.
 */
public enum JobStatus {
    QUEUED("queued", 1, false),
    COMPILING("compiling", 1, false),
    SUCCESS("success", 1, true),
    ERROR("error", 1, true),
    TIMEOUT("timeout", 2, true),
    CANCELED("canceled", 2, true);

    /** Schema version written by this build. */
    public static final int SCHEMA_VERSION = 2;

    private final String wireName;
    private final int sinceSchemaVersion;
    private final boolean terminal;

    JobStatus(String wireName, int sinceSchemaVersion, boolean terminal) {
        this.wireName = wireName;
        this.sinceSchemaVersion = sinceSchemaVersion;
        this.terminal = terminal;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public int sinceSchemaVersion() {
        return sinceSchemaVersion;
    }

    public boolean isTerminal() {
        return terminal;
    }

    /**
     * Transitions only move forward: queued to compiling, compiling to a
     * terminal state, or queued straight to canceled. Nothing leaves a
     * terminal state.
     */
    public boolean canTransitionTo(JobStatus next) {
        if (terminal || next == null) {
            return false;
        }
        return switch (this) {
            case QUEUED -> next == COMPILING || next == CANCELED;
            case COMPILING -> next.terminal;
            default -> false;
        };
    }

    public static JobStatus fromWire(String value, int schemaVersion) {
        if (value == null) {
            throw new IllegalArgumentException("Job status is required");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (JobStatus status : values()) {
            if (status.wireName.equals(normalized)) {
                if (status.sinceSchemaVersion > schemaVersion) {
                    throw new IllegalArgumentException("Status '" + value
                            + "' is not defined in status schema v" + schemaVersion);
                }
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown job status: " + value);
    }

    @JsonCreator
    static JobStatus fromJson(String value) {
        return fromWire(value, SCHEMA_VERSION);
    }
}
