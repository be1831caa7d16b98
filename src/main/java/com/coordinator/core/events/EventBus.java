package com.coordinator.core.events;

import com.coordinator.core.config.CoordinatorProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-memory pub/sub event bus for coordinator lifecycle events.
 * <p>
 * Supports per-event-type subscriptions and global subscriptions that receive all events.
 * Thread-safe for concurrent publish and subscribe operations. A subscriber that throws
 * is logged and skipped; the remaining subscribers still receive the event.
 */
@Service
public class EventBus implements ObservabilityNotifier {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final String sessionId;
    private final Clock clock;

    /** Subscribers keyed by event type. */
    private final ConcurrentHashMap<String, CopyOnWriteArrayList<Consumer<CoordinatorEvent>>> typeSubscribers =
            new ConcurrentHashMap<>();

    /** Global subscribers that receive every event. */
    private final CopyOnWriteArrayList<Consumer<CoordinatorEvent>> globalSubscribers =
            new CopyOnWriteArrayList<>();

    public EventBus() {
        this("coordinator", Clock.systemUTC());
    }

    @Autowired
    public EventBus(CoordinatorProperties properties, Clock clock) {
        this(properties.getSessionId(), clock);
    }

    EventBus(String sessionId, Clock clock) {
        this.sessionId = sessionId;
        this.clock = clock;
    }

    @Override
    public void notify(String eventType, Map<String, Object> payload) {
        publish(new CoordinatorEvent(eventType, sessionId, payload, clock.instant()));
    }

    /**
     * Publish an event to all matching subscribers (type-specific and global).
     *
     * @param event the event to publish
     */
    public void publish(CoordinatorEvent event) {
        log.debug("Publishing event: {}", event.eventType());

        List<Consumer<CoordinatorEvent>> typeSubs = typeSubscribers.get(event.eventType());
        if (typeSubs != null) {
            for (Consumer<CoordinatorEvent> subscriber : typeSubs) {
                deliverSafely(subscriber, event);
            }
        }

        for (Consumer<CoordinatorEvent> subscriber : globalSubscribers) {
            deliverSafely(subscriber, event);
        }
    }

    /**
     * Subscribe to events of a single type.
     *
     * @param eventType the event type to receive
     * @param consumer  callback invoked for each event
     * @return a {@link Subscription} handle to unsubscribe later
     */
    public Subscription subscribe(String eventType, Consumer<CoordinatorEvent> consumer) {
        typeSubscribers.computeIfAbsent(eventType, k -> new CopyOnWriteArrayList<>()).add(consumer);
        log.debug("Subscribed to event type {}", eventType);
        return () -> {
            CopyOnWriteArrayList<Consumer<CoordinatorEvent>> subs = typeSubscribers.get(eventType);
            if (subs != null) {
                subs.remove(consumer);
            }
        };
    }

    /**
     * Subscribe to every event regardless of type.
     *
     * @param consumer callback invoked for each event
     * @return a {@link Subscription} handle to unsubscribe later
     */
    public Subscription subscribeAll(Consumer<CoordinatorEvent> consumer) {
        globalSubscribers.add(consumer);
        log.debug("Subscribed to all events (global)");
        return () -> globalSubscribers.remove(consumer);
    }

    public String getSessionId() {
        return sessionId;
    }

    /**
     * Handle for cancelling a subscription.
     */
    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private void deliverSafely(Consumer<CoordinatorEvent> subscriber, CoordinatorEvent event) {
        try {
            subscriber.accept(event);
        } catch (Exception e) {
            log.warn("Subscriber threw exception processing event {}: {}",
                    event.eventType(), e.getMessage(), e);
        }
    }
}
