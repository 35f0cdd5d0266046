package com.threadedmosaic.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-memory pub/sub for operation lifecycle events.
 * <p>
 * Subscribers either follow one operation or receive everything. A subscriber that throws
 * is logged and skipped; it never breaks delivery to the others or the publishing thread.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final ConcurrentHashMap<String, CopyOnWriteArrayList<Consumer<MosaicEvent>>> operationSubscribers =
            new ConcurrentHashMap<>();

    private final CopyOnWriteArrayList<Consumer<MosaicEvent>> globalSubscribers =
            new CopyOnWriteArrayList<>();

    public void publish(MosaicEvent event) {
        log.trace("Publishing {} for operation {}", event.eventType(), event.operationId());

        List<Consumer<MosaicEvent>> subs = operationSubscribers.get(event.operationId());
        if (subs != null) {
            for (Consumer<MosaicEvent> subscriber : subs) {
                deliverSafely(subscriber, event);
            }
        }
        for (Consumer<MosaicEvent> subscriber : globalSubscribers) {
            deliverSafely(subscriber, event);
        }
    }

    /**
     * Subscribe to events of a single operation.
     *
     * @return a handle that removes the subscription
     */
    public Subscription subscribe(String operationId, Consumer<MosaicEvent> consumer) {
        operationSubscribers.computeIfAbsent(operationId, k -> new CopyOnWriteArrayList<>()).add(consumer);
        log.debug("Subscribed to operation {}", operationId);
        return () -> operationSubscribers.computeIfPresent(operationId, (k, subs) -> {
            subs.remove(consumer);
            return subs.isEmpty() ? null : subs;
        });
    }

    public Subscription subscribeAll(Consumer<MosaicEvent> consumer) {
        globalSubscribers.add(consumer);
        log.debug("Subscribed to all operations");
        return () -> globalSubscribers.remove(consumer);
    }

    /**
     * Number of live per-operation subscribers, used by tests and diagnostics.
     */
    public int subscriberCount(String operationId) {
        List<Consumer<MosaicEvent>> subs = operationSubscribers.get(operationId);
        return subs == null ? 0 : subs.size();
    }

    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private void deliverSafely(Consumer<MosaicEvent> subscriber, MosaicEvent event) {
        try {
            subscriber.accept(event);
        } catch (Exception e) {
            log.warn("Subscriber threw exception processing event {}: {}",
                    event.eventType(), e.getMessage(), e);
        }
    }
}
