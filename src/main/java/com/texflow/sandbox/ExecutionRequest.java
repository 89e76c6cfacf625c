package com.texflow.sandbox;

import com.texflow.core.model.CompileJob;
import com.texflow.core.model.Engine;

import java.nio.file.Path;

/**
 * One compile attempt: the job id used for cancel polling, the staged
 * directory to mount, and what to compile in it.
 */
public record ExecutionRequest(String jobId, Path workDir, String mainFile, Engine requestedEngine) {

    public static ExecutionRequest of(CompileJob job, Path workDir) {
        return new ExecutionRequest(job.jobId(), workDir, job.mainFile(), job.requestedEngine());
    }

    public String pdfFileName() {
        String base = mainFile.endsWith(".tex") ? mainFile.substring(0, mainFile.length() - 4) : mainFile;
        return base + ".pdf";
    }
}
