package com.texflow.core.health;

import java.util.Comparator;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local heartbeat store for single-process deployments and tests.
 */
public class InMemoryHeartbeatStore implements HeartbeatStore {

    private final Map<String, Heartbeat> heartbeats = new ConcurrentHashMap<>();

    @Override
    public void publishHeartbeat(Heartbeat heartbeat) {
        heartbeats.put(heartbeat.instanceId(), heartbeat);
    }

    @Override
    public Optional<Heartbeat> latest() {
        return heartbeats.values().stream().max(Comparator.comparingLong(Heartbeat::timestampMs));
    }

    @Override
    public void remove(String instanceId) {
        heartbeats.remove(instanceId);
    }
}
