package com.texflow.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-memory pub/sub for job status events inside this process.
 * <p>
 * Supports per-job subscriptions and global subscriptions that receive all events.
 * Thread-safe for concurrent publish and subscribe operations.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    /** Per-job subscribers keyed by jobId. */
    private final ConcurrentHashMap<String, CopyOnWriteArrayList<Consumer<StatusEvent>>> jobSubscribers =
            new ConcurrentHashMap<>();

    /** Global subscribers that receive events for every job. */
    private final CopyOnWriteArrayList<Consumer<StatusEvent>> globalSubscribers =
            new CopyOnWriteArrayList<>();

    public void publish(StatusEvent event) {
        log.debug("Publishing {} for job {}", event.eventType(), event.jobId());

        List<Consumer<StatusEvent>> jobSubs = jobSubscribers.get(event.jobId());
        if (jobSubs != null) {
            for (Consumer<StatusEvent> subscriber : jobSubs) {
                deliverSafely(subscriber, event);
            }
        }

        for (Consumer<StatusEvent> subscriber : globalSubscribers) {
            deliverSafely(subscriber, event);
        }
    }

    /**
     * Subscribe to events for a single job.
     *
     * @return a {@link Subscription} handle to unsubscribe later
     */
    public Subscription subscribe(String jobId, Consumer<StatusEvent> consumer) {
        jobSubscribers.computeIfAbsent(jobId, k -> new CopyOnWriteArrayList<>()).add(consumer);
        return () -> jobSubscribers.computeIfPresent(jobId, (k, subs) -> {
            subs.remove(consumer);
            return subs.isEmpty() ? null : subs;
        });
    }

    public Subscription subscribeAll(Consumer<StatusEvent> consumer) {
        globalSubscribers.add(consumer);
        return () -> globalSubscribers.remove(consumer);
    }

    /**
     * Handle for cancelling a subscription.
     */
    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private void deliverSafely(Consumer<StatusEvent> subscriber, StatusEvent event) {
        try {
            subscriber.accept(event);
        } catch (Exception e) {
            log.warn("Subscriber threw exception processing {} for job {}: {}",
                    event.eventType(), event.jobId(), e.getMessage(), e);
        }
    }
}
