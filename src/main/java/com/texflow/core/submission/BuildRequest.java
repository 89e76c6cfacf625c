package com.texflow.core.submission;

/**
 * Request to build a project directory.
 *
 * @param buildId     optional caller id, generated when blank
 * @param projectDir  absolute host directory holding the sources
 * @param mainFile    entry point relative to {@code projectDir}, {@code main.tex} if blank
 * @param engine      engine name, {@code auto} if blank
 * @param projectId   owning project, echoed in status events
 * @param triggeredBy requesting user, echoed in status events
 */
public record BuildRequest(
        String buildId,
        String projectDir,
        String mainFile,
        String engine,
        String projectId,
        String triggeredBy
) {}
