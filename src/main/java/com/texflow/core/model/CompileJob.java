package com.texflow.core.model;

import java.time.Instant;

/**
 * A unit of compilation work as carried on the job queue.
 *
 * @param jobId           caller-supplied unique id, also the queue idempotency key
 * @param kind            ephemeral one-shot compile or project build
 * @param sourceLocation  absolute directory holding the sources
 * @param mainFile        entry point, relative to {@code sourceLocation}
 * @param requestedEngine engine asked for by the caller, possibly {@link Engine#AUTO}
 * @param projectId       owning project for builds; null for ephemeral jobs
 * @param triggeredBy     user that requested the compile, if known
 * @param createdAt       submission time
 */
public record CompileJob(
        String jobId,
        JobKind kind,
        String sourceLocation,
        String mainFile,
        Engine requestedEngine,
        String projectId,
        String triggeredBy,
        Instant createdAt
) {

    public static final String DEFAULT_MAIN_FILE = "main.tex";

    public CompileJob {
        if (jobId == null || jobId.isBlank()) {
            throw new IllegalArgumentException("jobId is required");
        }
        if (kind == null) {
            throw new IllegalArgumentException("kind is required");
        }
        if (mainFile == null || mainFile.isBlank()) {
            mainFile = DEFAULT_MAIN_FILE;
        }
        if (requestedEngine == null) {
            requestedEngine = Engine.AUTO;
        }
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }

    /** Name of the PDF latexmk writes next to the main file. */
    public String pdfFileName() {
        String base = mainFile.endsWith(".tex")
                ? mainFile.substring(0, mainFile.length() - 4)
                : mainFile;
        return base + ".pdf";
    }
}
