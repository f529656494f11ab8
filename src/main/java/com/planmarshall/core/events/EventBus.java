package com.planmarshall.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-memory pub/sub event bus for plan lifecycle events.
 * <p>
 * Supports per-plan subscriptions and global subscriptions that receive all events.
 * Thread-safe for concurrent publish and subscribe operations.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    /** Per-plan subscribers keyed by planId. */
    private final ConcurrentHashMap<String, CopyOnWriteArrayList<Consumer<PlanEvent>>> planSubscribers =
            new ConcurrentHashMap<>();

    private final CopyOnWriteArrayList<Consumer<PlanEvent>> globalSubscribers = new CopyOnWriteArrayList<>();

    /**
     * Publish an event to the subscribers of its plan and to global subscribers.
     * A failing subscriber never affects the publisher or other subscribers.
     */
    public void publish(PlanEvent event) {
        log.debug("Publishing event: {} for plan {}", event.eventType(), event.planId());

        List<Consumer<PlanEvent>> subs = planSubscribers.get(event.planId());
        if (subs != null) {
            for (Consumer<PlanEvent> subscriber : subs) {
                deliverSafely(subscriber, event);
            }
        }
        for (Consumer<PlanEvent> subscriber : globalSubscribers) {
            deliverSafely(subscriber, event);
        }
    }

    public Subscription subscribe(String planId, Consumer<PlanEvent> consumer) {
        planSubscribers.computeIfAbsent(planId, k -> new CopyOnWriteArrayList<>()).add(consumer);
        log.debug("Subscribed to plan {}", planId);
        return () -> {
            CopyOnWriteArrayList<Consumer<PlanEvent>> current = planSubscribers.get(planId);
            if (current != null) {
                current.remove(consumer);
            }
        };
    }

    public Subscription subscribeAll(Consumer<PlanEvent> consumer) {
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

    private void deliverSafely(Consumer<PlanEvent> subscriber, PlanEvent event) {
        try {
            subscriber.accept(event);
        } catch (Exception e) {
            log.warn("Subscriber threw exception processing event {}: {}", event.eventType(), e.getMessage(), e);
        }
    }
}
