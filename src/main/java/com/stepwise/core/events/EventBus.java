package com.stepwise.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-memory pub/sub event bus for run events.
 * <p>
 * Subscriptions are per run. Thread-safe: batch workers publish concurrently.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final ConcurrentHashMap<String, CopyOnWriteArrayList<Consumer<SchedulerEvent>>> runSubscribers =
            new ConcurrentHashMap<>();

    public void publish(SchedulerEvent event) {
        log.debug("Publishing event: {} for run {}", event.eventType(), event.runId());

        List<Consumer<SchedulerEvent>> runSubs = runSubscribers.get(event.runId());
        if (runSubs != null) {
            for (Consumer<SchedulerEvent> subscriber : runSubs) {
                deliverSafely(subscriber, event);
            }
        }
    }

    /**
     * Subscribe to events of one run.
     *
     * @return a {@link Subscription} handle to unsubscribe later
     */
    public Subscription subscribe(String runId, Consumer<SchedulerEvent> consumer) {
        runSubscribers.computeIfAbsent(runId, k -> new CopyOnWriteArrayList<>()).add(consumer);
        return () -> runSubscribers.computeIfPresent(runId, (k, subs) -> {
            subs.remove(consumer);
            return subs.isEmpty() ? null : subs;
        });
    }

    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private void deliverSafely(Consumer<SchedulerEvent> subscriber, SchedulerEvent event) {
        try {
            subscriber.accept(event);
        } catch (Exception e) {
            log.warn("Subscriber threw exception processing event {}: {}",
                    event.eventType(), e.getMessage(), e);
        }
    }
}
