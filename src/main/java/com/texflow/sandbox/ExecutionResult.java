package com.texflow.sandbox;

import com.texflow.core.model.Engine;

import java.nio.file.Path;

/**
 * Outcome of a single container run.
 *
 * @param logs           combined compiler output
 * @param exitCode       container exit code, -1 when killed or never run
 * @param exitedNormally the container exited on its own with code 0
 * @param timedOut       the wall-clock ceiling was hit and the container killed
 * @param canceled       a cancel marker was observed and the run abandoned
 * @param engineUsed     the resolved engine, known even on timeout
 * @param pdfPath        produced PDF; always null unless the run completed
 * @param durationMs     wall time of the attempt
 * @param containerError set when the container runtime itself failed; the
 *                       other fields then say nothing about the document
 */
public record ExecutionResult(
        String logs,
        int exitCode,
        boolean exitedNormally,
        boolean timedOut,
        boolean canceled,
        Engine engineUsed,
        Path pdfPath,
        long durationMs,
        String containerError
) {

    public ExecutionResult(String logs, int exitCode, boolean exitedNormally, boolean timedOut, boolean canceled,
                           Engine engineUsed, Path pdfPath, long durationMs) {
        this(logs, exitCode, exitedNormally, timedOut, canceled, engineUsed, pdfPath, durationMs, null);
    }

    public boolean isContainerFailure() {
        return containerError != null;
    }

    public boolean hasPdf() {
        return pdfPath != null;
    }
}
