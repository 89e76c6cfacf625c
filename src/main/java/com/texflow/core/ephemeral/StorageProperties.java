package com.texflow.core.ephemeral;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "texflow.storage")
public class StorageProperties {

    static final long MIN_TTL_MINUTES = 1;

    private String root = "/data";
    private Ephemeral ephemeral = new Ephemeral();

    public String getRoot() { return root; }
    public void setRoot(String root) { this.root = root; }

    // -- Ephemeral accessors (delegate to nested) --
    public long getTtlMinutes() { return Math.max(MIN_TTL_MINUTES, ephemeral.ttlMinutes); }
    public long getReapIntervalMs() { return ephemeral.reapIntervalMs; }
    public int getMaxSourceBytes() { return ephemeral.maxSourceBytes; }

    public Ephemeral getEphemeral() { return ephemeral; }
    public void setEphemeral(Ephemeral ephemeral) { this.ephemeral = ephemeral; }

    public static class Ephemeral {
        private long ttlMinutes = 60;
        private long reapIntervalMs = 60_000;
        private int maxSourceBytes = 5 * 1024 * 1024;

        public long getTtlMinutes() { return ttlMinutes; }
        public void setTtlMinutes(long ttlMinutes) { this.ttlMinutes = ttlMinutes; }
        public long getReapIntervalMs() { return reapIntervalMs; }
        public void setReapIntervalMs(long reapIntervalMs) { this.reapIntervalMs = reapIntervalMs; }
        public int getMaxSourceBytes() { return maxSourceBytes; }
        public void setMaxSourceBytes(int maxSourceBytes) { this.maxSourceBytes = maxSourceBytes; }
    }
}
