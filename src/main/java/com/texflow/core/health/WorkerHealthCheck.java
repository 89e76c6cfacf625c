package com.texflow.core.health;

import java.util.Map;

/**
 * Answers "is there a worker able to pick up compile jobs?".
 * Exactly one variant is active per deployment, chosen by
 * {@link WorkerHealthConfig} from {@link DeploymentMode}.
 */
public interface WorkerHealthCheck {

    DeploymentMode mode();

    boolean isAvailable();

    /** Diagnostic values for health endpoints and logs. */
    Map<String, Object> details();
}
