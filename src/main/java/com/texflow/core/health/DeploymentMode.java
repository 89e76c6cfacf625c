package com.texflow.core.health;

/**
 * Where compile jobs are executed relative to the request-serving process.
 */
public enum DeploymentMode {
    /** The worker runs inside the web process. */
    EMBEDDED,
    /** A separate worker process pulls from the shared queue. */
    DEDICATED
}
