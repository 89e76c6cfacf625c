package com.texflow.core.queue;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "texflow.queue")
public class QueueProperties {

    private String name = "compile-jobs";
    private long cancelTtlSeconds = 900;
    private long retentionMinutes = 60;
    private long maintenanceIntervalMs = 30_000;
    private int maxStalledCount = 2;

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }
    public long getCancelTtlSeconds() { return cancelTtlSeconds; }
    public void setCancelTtlSeconds(long cancelTtlSeconds) { this.cancelTtlSeconds = cancelTtlSeconds; }
    public long getRetentionMinutes() { return retentionMinutes; }
    public void setRetentionMinutes(long retentionMinutes) { this.retentionMinutes = retentionMinutes; }
    public long getMaintenanceIntervalMs() { return maintenanceIntervalMs; }
    public void setMaintenanceIntervalMs(long maintenanceIntervalMs) { this.maintenanceIntervalMs = maintenanceIntervalMs; }
    public int getMaxStalledCount() { return maxStalledCount; }
    public void setMaxStalledCount(int maxStalledCount) { this.maxStalledCount = maxStalledCount; }

    public Duration getCancelTtl() {
        return Duration.ofSeconds(cancelTtlSeconds);
    }

    public Duration getRetention() {
        return Duration.ofMinutes(retentionMinutes);
    }
}
