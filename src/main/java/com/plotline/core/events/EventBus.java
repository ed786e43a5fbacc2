package com.plotline.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-memory pub/sub bus for analysis events.
 * <p>
 * Subscribers register for one analysis id or for every analysis. A subscriber that throws
 * never prevents delivery to the others.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final ConcurrentHashMap<String, CopyOnWriteArrayList<Consumer<PlotlineEvent>>> analysisSubscribers =
            new ConcurrentHashMap<>();

    private final CopyOnWriteArrayList<Consumer<PlotlineEvent>> globalSubscribers =
            new CopyOnWriteArrayList<>();

    public void publish(PlotlineEvent event) {
        log.debug("Publishing {} for analysis {}", event.eventType(), event.analysisId());

        List<Consumer<PlotlineEvent>> subscribers = analysisSubscribers.get(event.analysisId());
        if (subscribers != null) {
            for (Consumer<PlotlineEvent> subscriber : subscribers) {
                deliverSafely(subscriber, event);
            }
        }
        for (Consumer<PlotlineEvent> subscriber : globalSubscribers) {
            deliverSafely(subscriber, event);
        }
    }

    /**
     * Subscribe to the events of one analysis.
     *
     * @return a handle that removes the subscription; the per-analysis list is dropped once empty
     */
    public Subscription subscribe(String analysisId, Consumer<PlotlineEvent> consumer) {
        analysisSubscribers.computeIfAbsent(analysisId, k -> new CopyOnWriteArrayList<>()).add(consumer);
        log.debug("Subscribed to analysis {}", analysisId);
        return () -> analysisSubscribers.computeIfPresent(analysisId, (id, subscribers) -> {
            subscribers.remove(consumer);
            return subscribers.isEmpty() ? null : subscribers;
        });
    }

    public Subscription subscribeAll(Consumer<PlotlineEvent> consumer) {
        globalSubscribers.add(consumer);
        return () -> globalSubscribers.remove(consumer);
    }

    public int subscriberCount(String analysisId) {
        List<Consumer<PlotlineEvent>> subscribers = analysisSubscribers.get(analysisId);
        return subscribers == null ? 0 : subscribers.size();
    }

    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private void deliverSafely(Consumer<PlotlineEvent> subscriber, PlotlineEvent event) {
        try {
            subscriber.accept(event);
        } catch (Exception e) {
            log.warn("Subscriber failed on {} for analysis {}: {}",
                    event.eventType(), event.analysisId(), e.getMessage(), e);
        }
    }
}
