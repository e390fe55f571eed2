package dev.eventsourced.components.eventsourced.eventstore.publisher;

import dev.eventsourced.components.eventsourced.eventstore.Event;

import java.util.List;

/**
 * Performs the actual delivery of a batch of events, e.g. to an in-process bus or a message broker client.<br>
 * Throwing an exception signals that the delivery failed and should be retried according to the {@link PublishRedeliveryPolicy}
 *
 * @param <EVENT> the base type of the events delivered
 */
@FunctionalInterface
public interface EventPublishingHandler<EVENT extends Event> {
    void handle(List<EVENT> events) throws Exception;
}
