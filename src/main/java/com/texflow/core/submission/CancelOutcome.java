package com.texflow.core.submission;

import com.texflow.core.model.JobStatus;

/**
 * Answer to a cancel request for a one-shot compile.
 *
 * @param accepted false when the job had already finished and nothing was done
 */
public record CancelOutcome(String jobId, JobStatus status, boolean accepted, String message) {

    static CancelOutcome alreadyFinished(String jobId, JobStatus status) {
        return new CancelOutcome(jobId, status, false, "Compile job already completed");
    }

    static CancelOutcome accepted(String jobId) {
        return new CancelOutcome(jobId, JobStatus.CANCELED, true, "Cancel request accepted");
    }
}
