package com.texflow.core.queue;

import com.texflow.core.model.CompileJob;

/**
 * A job handed to exactly one worker by {@link JobQueue#claimNext}.
 *
 * @param attempts how many times the job has been claimed, including this one;
 *                 above 1 only after a stalled worker's lease expired
 */
public record ClaimedJob(CompileJob job, int attempts) {

    public String jobId() {
        return job.jobId();
    }
}
