package com.texflow.core.worker;

import com.texflow.core.model.JobStatusChange;

/**
 * Receives every lifecycle transition of a job the worker owns.
 * Called once per transition, in order, from the worker thread running the job.
 */
public interface JobPersistenceHook {

    void onStatusChange(JobStatusChange change);
}
