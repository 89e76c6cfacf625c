package com.texflow.core.worker;

/**
 * Persistence hook for project builds, supplied by the web tier that owns
 * the relational build records. Declare a bean of this type to replace
 * {@link LoggingProjectPersistenceHook}.
 */
public interface ProjectPersistenceHook extends JobPersistenceHook {
}
