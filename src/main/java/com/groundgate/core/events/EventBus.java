package com.groundgate.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-memory pub/sub event bus for run execution events.
 * <p>
 * Supports per-run subscriptions and global subscriptions that receive all events.
 * Thread-safe for concurrent publish and subscribe operations, so engines running
 * independent root tasks on separate threads can share one bus.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    /** Per-run subscribers keyed by root task id. */
    private final ConcurrentHashMap<String, CopyOnWriteArrayList<Consumer<GroundgateEvent>>> runSubscribers =
            new ConcurrentHashMap<>();

    private final CopyOnWriteArrayList<Consumer<GroundgateEvent>> globalSubscribers =
            new CopyOnWriteArrayList<>();

    public void publish(GroundgateEvent event) {
        log.debug("Publishing event: {} for run {}", event.eventType(), event.rootTaskId());

        List<Consumer<GroundgateEvent>> runSubs = runSubscribers.get(event.rootTaskId());
        if (runSubs != null) {
            for (Consumer<GroundgateEvent> subscriber : runSubs) {
                deliverSafely(subscriber, event);
            }
        }

        for (Consumer<GroundgateEvent> subscriber : globalSubscribers) {
            deliverSafely(subscriber, event);
        }
    }

    /**
     * Subscribe to events for one root task.
     *
     * @return a {@link Subscription} handle to unsubscribe later
     */
    public Subscription subscribe(String rootTaskId, Consumer<GroundgateEvent> consumer) {
        runSubscribers.computeIfAbsent(rootTaskId, k -> new CopyOnWriteArrayList<>()).add(consumer);
        return () -> {
            CopyOnWriteArrayList<Consumer<GroundgateEvent>> subs = runSubscribers.get(rootTaskId);
            if (subs != null) {
                subs.remove(consumer);
            }
        };
    }

    public Subscription subscribeAll(Consumer<GroundgateEvent> consumer) {
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

    // A failing subscriber must not break the engine or starve other subscribers.
    private void deliverSafely(Consumer<GroundgateEvent> subscriber, GroundgateEvent event) {
        try {
            subscriber.accept(event);
        } catch (Exception e) {
            log.warn("Subscriber threw exception processing event {}: {}",
                    event.eventType(), e.getMessage(), e);
        }
    }
}
