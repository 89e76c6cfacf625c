package com.texflow.core.model;

/**
 * Where a job's source lives and who owns its persisted state.
 */
public enum JobKind {
    /** One-shot API compile backed by the ephemeral store. */
    EPHEMERAL,
    /** Build of a project directory; persisted through the caller's hook. */
    PROJECT
}
