package com.texflow.core.queue;

import com.texflow.core.cancel.CancellationRegistry;
import com.texflow.core.events.JdbcNotifyChannel;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Background housekeeping for the broker tables: requeues jobs whose worker
 * stopped renewing its claim, drops finished jobs past retention, deletes
 * expired cancel markers and trims the status outbox.
 */
@Component
public class QueueMaintenance {

    private static final Logger log = LoggerFactory.getLogger(QueueMaintenance.class);

    private final JobQueue queue;
    private final CancellationRegistry cancellationRegistry;
    private final QueueProperties properties;
    private final JdbcNotifyChannel notifyChannel;

    private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "queue-maintenance");
        t.setDaemon(true);
        return t;
    });

    public QueueMaintenance(JobQueue queue, CancellationRegistry cancellationRegistry,
                            QueueProperties properties,
                            @Autowired(required = false) JdbcNotifyChannel notifyChannel) {
        this.queue = queue;
        this.cancellationRegistry = cancellationRegistry;
        this.properties = properties;
        this.notifyChannel = notifyChannel;
    }

    @PostConstruct
    void start() {
        long interval = Math.max(1_000, properties.getMaintenanceIntervalMs());
        scheduler.scheduleWithFixedDelay(this::runOnce, interval, interval, TimeUnit.MILLISECONDS);
        log.info("Queue maintenance started (interval={}ms, retention={}m)",
                interval, properties.getRetentionMinutes());
    }

    @PreDestroy
    void stop() {
        scheduler.shutdownNow();
    }

    void runOnce() {
        try {
            queue.requeueStalled(properties.getMaxStalledCount());
            int purged = queue.purgeFinished(properties.getRetention());
            int markers = cancellationRegistry.purgeExpired();
            if (notifyChannel != null) {
                notifyChannel.purgeOlderThan(properties.getRetention());
            }
            if (purged > 0 || markers > 0) {
                log.debug("Queue maintenance purged {} finished job(s), {} cancel marker(s)", purged, markers);
            }
        } catch (RuntimeException e) {
            log.warn("Queue maintenance failed: {}", e.getMessage());
        }
    }
}
