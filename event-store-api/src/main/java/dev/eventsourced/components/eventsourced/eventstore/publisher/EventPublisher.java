package dev.eventsourced.components.eventsourced.eventstore.publisher;

import dev.eventsourced.components.eventsourced.eventstore.*;

import java.util.List;

/**
 * Notifies other components, in the same application or external services, after events have been persisted to an {@link EventStore}
 *
 * @param <EVENT> the base type of the events published
 * @see AsyncEventPublisher
 */
public interface EventPublisher<EVENT extends Event> {
    /**
     * Publish the events and wait for the delivery to complete
     *
     * @param events the events to publish, in order
     * @throws EventPublishingException in case the delivery failed
     */
    void publish(List<? extends EVENT> events);

    /**
     * Publish the events without waiting for the delivery to complete.<br>
     * Implementations must not block the caller and must never silently discard a delivery failure: failures
     * have to be captured and logged or handed to a dead letter handler
     *
     * @param events the events to publish, in order
     */
    void publishAndForget(List<? extends EVENT> events);

    /**
     * An {@link EventPublisher} that doesn't notify anyone
     *
     * @param <EVENT> the base type of the events
     */
    static <EVENT extends Event> EventPublisher<EVENT> noOp() {
        return new EventPublisher<>() {
            @Override
            public void publish(List<? extends EVENT> events) {
            }

            @Override
            public void publishAndForget(List<? extends EVENT> events) {
            }

            @Override
            public String toString() {
                return "NoOpEventPublisher";
            }
        };
    }
}
