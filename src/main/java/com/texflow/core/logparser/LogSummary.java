package com.texflow.core.logparser;

/**
 * Per-type counts of parsed log entries.
 */
public record LogSummary(int errors, int warnings, int infos) {

    public boolean hasErrors() {
        return errors > 0;
    }
}
