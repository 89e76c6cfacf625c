package com.texflow.core.worker;

import com.texflow.core.health.DeploymentMode;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.UUID;

@Component
@ConfigurationProperties(prefix = "texflow.worker")
public class WorkerProperties {

    static final long MIN_HEARTBEAT_INTERVAL_MS = 1_000;
    static final long MIN_HEARTBEAT_MAX_AGE_MS = 5_000;

    private DeploymentMode mode = DeploymentMode.EMBEDDED;
    private String instanceId = "";
    private long heartbeatIntervalMs = 5_000;
    private long heartbeatMaxAgeMs = 30_000;
    private long idlePollIntervalMs = 1_000;
    private long healthLogIntervalMs = 30_000;
    private long leaseMarginMs = 60_000;

    public DeploymentMode getMode() { return mode; }
    public void setMode(DeploymentMode mode) { this.mode = mode; }

    public boolean isDedicated() {
        return mode == DeploymentMode.DEDICATED;
    }

    /** Configured id, or a fresh random one per process when blank. */
    public String getInstanceId() {
        if (instanceId == null || instanceId.isBlank()) {
            instanceId = UUID.randomUUID().toString();
        }
        return instanceId;
    }
    public void setInstanceId(String instanceId) { this.instanceId = instanceId; }

    public long getHeartbeatIntervalMs() { return Math.max(MIN_HEARTBEAT_INTERVAL_MS, heartbeatIntervalMs); }
    public void setHeartbeatIntervalMs(long heartbeatIntervalMs) { this.heartbeatIntervalMs = heartbeatIntervalMs; }

    public long getHeartbeatMaxAgeMs() { return Math.max(MIN_HEARTBEAT_MAX_AGE_MS, heartbeatMaxAgeMs); }
    public void setHeartbeatMaxAgeMs(long heartbeatMaxAgeMs) { this.heartbeatMaxAgeMs = heartbeatMaxAgeMs; }

    public long getIdlePollIntervalMs() { return idlePollIntervalMs; }
    public void setIdlePollIntervalMs(long idlePollIntervalMs) { this.idlePollIntervalMs = idlePollIntervalMs; }

    public long getHealthLogIntervalMs() { return healthLogIntervalMs; }
    public void setHealthLogIntervalMs(long healthLogIntervalMs) { this.healthLogIntervalMs = healthLogIntervalMs; }

    public long getLeaseMarginMs() { return leaseMarginMs; }
    public void setLeaseMarginMs(long leaseMarginMs) { this.leaseMarginMs = leaseMarginMs; }
}
