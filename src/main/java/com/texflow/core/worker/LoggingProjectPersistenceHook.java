package com.texflow.core.worker;

import com.texflow.core.model.JobStatusChange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fallback project hook used when no relational store is wired in: records
 * transitions in the log only.
 */
public class LoggingProjectPersistenceHook implements ProjectPersistenceHook {

    private static final Logger log = LoggerFactory.getLogger(LoggingProjectPersistenceHook.class);

    @Override
    public void onStatusChange(JobStatusChange change) {
        if (change.status().isTerminal()) {
            log.info("Build {} finished: status={} exitCode={} durationMs={} errors={} warnings={}",
                    change.jobId(), change.status().wireName(), change.exitCode(), change.durationMs(),
                    change.errorCount(), change.warningCount());
        } else {
            log.info("Build {} is {}{}", change.jobId(), change.status().wireName(),
                    change.engineUsed() != null ? " (" + change.engineUsed().wireName() + ")" : "");
        }
    }
}
