package com.texflow.core.worker;

import com.texflow.core.ephemeral.EphemeralJobStore;
import com.texflow.core.model.JobStatusChange;
import org.springframework.stereotype.Component;

/**
 * Persists one-shot compile transitions into the {@link EphemeralJobStore}.
 * Artifacts are written before the terminal metadata so a poller that sees
 * the terminal status can always read them.
 */
@Component
public class EphemeralJobPersistence implements JobPersistenceHook {

    private final EphemeralJobStore store;

    public EphemeralJobPersistence(EphemeralJobStore store) {
        this.store = store;
    }

    @Override
    public void onStatusChange(JobStatusChange change) {
        if (change.status().isTerminal()) {
            store.writeLogs(change.jobId(), change.logs());
            store.writeErrors(change.jobId(), change.entries());
        }
        store.patch(change.jobId(), change);
    }

    /** True when a redelivered job already reached a terminal state. */
    public boolean isAlreadyFinished(String jobId) {
        return store.read(jobId).map(record -> record.isTerminal()).orElse(false);
    }
}
