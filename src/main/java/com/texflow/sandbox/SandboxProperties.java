package com.texflow.sandbox;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

@Component
@ConfigurationProperties(prefix = "texflow")
public class SandboxProperties {

    private static final Pattern MEMORY_SIZE = Pattern.compile("^(\\d+(?:\\.\\d+)?)\\s*([kmgt]?)b?$");
    private static final long DEFAULT_MEMORY_BYTES = 1024L * 1024 * 1024;

    private Sandbox sandbox = new Sandbox();

    // -- Sandbox accessors (delegate to nested) --
    public String getProvider() { return sandbox.provider; }
    public String getImage() { return sandbox.image; }
    public String getMemory() { return sandbox.memory; }
    public double getCpus() { return sandbox.cpus; }
    public long getTimeoutMs() { return sandbox.timeoutMs; }
    public int getMaxConcurrent() { return sandbox.maxConcurrent; }
    public long getPidsLimit() { return sandbox.pidsLimit; }
    public long getCancelPollIntervalMs() { return sandbox.cancelPollIntervalMs; }
    public String getContainerWorkDir() { return sandbox.containerWorkDir; }

    public long getMemoryBytes() {
        return parseMemory(sandbox.memory);
    }

    public long getNanoCpus() {
        return Math.round(sandbox.cpus * 1_000_000_000L);
    }

    public Sandbox getSandbox() { return sandbox; }
    public void setSandbox(Sandbox sandbox) { this.sandbox = sandbox; }

    /**
     * Parses Docker-style sizes such as {@code 512m} or {@code 1.5g}.
     * Unparseable values fall back to 1 GiB.
     */
    static long parseMemory(String value) {
        if (value == null) {
            return DEFAULT_MEMORY_BYTES;
        }
        Matcher m = MEMORY_SIZE.matcher(value.trim().toLowerCase(Locale.ROOT));
        if (!m.matches()) {
            return DEFAULT_MEMORY_BYTES;
        }
        double amount = Double.parseDouble(m.group(1));
        long multiplier = switch (m.group(2)) {
            case "k" -> 1024L;
            case "m" -> 1024L * 1024;
            case "g" -> 1024L * 1024 * 1024;
            case "t" -> 1024L * 1024 * 1024 * 1024;
            default -> 1L;
        };
        return (long) Math.floor(amount * multiplier);
    }

    public static class Sandbox {
        private String provider = "docker";
        private String image = "texflow-compiler:latest";
        private String memory = "1g";
        private double cpus = 1.5;
        private long timeoutMs = 120_000;
        private int maxConcurrent = 5;
        private long pidsLimit = 256;
        private long cancelPollIntervalMs = 500;
        private String containerWorkDir = "/workspace";

        public String getProvider() { return provider; }
        public void setProvider(String provider) { this.provider = provider; }
        public String getImage() { return image; }
        public void setImage(String image) { this.image = image; }
        public String getMemory() { return memory; }
        public void setMemory(String memory) { this.memory = memory; }
        public double getCpus() { return cpus; }
        public void setCpus(double cpus) { this.cpus = cpus; }
        public long getTimeoutMs() { return timeoutMs; }
        public void setTimeoutMs(long timeoutMs) { this.timeoutMs = timeoutMs; }
        public int getMaxConcurrent() { return maxConcurrent; }
        public void setMaxConcurrent(int maxConcurrent) { this.maxConcurrent = maxConcurrent; }
        public long getPidsLimit() { return pidsLimit; }
        public void setPidsLimit(long pidsLimit) { this.pidsLimit = pidsLimit; }
        public long getCancelPollIntervalMs() { return cancelPollIntervalMs; }
        public void setCancelPollIntervalMs(long cancelPollIntervalMs) { this.cancelPollIntervalMs = cancelPollIntervalMs; }
        public String getContainerWorkDir() { return containerWorkDir; }
        public void setContainerWorkDir(String containerWorkDir) { this.containerWorkDir = containerWorkDir; }
    }
}
