package com.texflow.core.ephemeral;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Deletes expired one-shot compile records and their artifacts on a fixed schedule.
 */
@Component
public class EphemeralJobReaper {

    private static final Logger log = LoggerFactory.getLogger(EphemeralJobReaper.class);

    private final EphemeralJobStore store;
    private final long intervalMs;

    private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "ephemeral-reaper");
        t.setDaemon(true);
        return t;
    });

    public EphemeralJobReaper(EphemeralJobStore store, StorageProperties properties) {
        this.store = store;
        this.intervalMs = Math.max(1_000, properties.getReapIntervalMs());
    }

    @PostConstruct
    void start() {
        scheduler.scheduleWithFixedDelay(this::reap, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        log.info("Ephemeral job reaper started (interval={}ms, ttl={}m)", intervalMs, store.getTtl().toMinutes());
    }

    @PreDestroy
    void stop() {
        scheduler.shutdownNow();
    }

    int reap() {
        try {
            return store.purgeExpired();
        } catch (RuntimeException e) {
            log.warn("Ephemeral job reap failed: {}", e.getMessage(), e);
            return 0;
        }
    }
}
