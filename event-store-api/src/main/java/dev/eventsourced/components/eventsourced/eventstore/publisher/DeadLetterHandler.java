package dev.eventsourced.components.eventsourced.eventstore.publisher;

import dev.eventsourced.components.eventsourced.eventstore.Event;
import org.slf4j.*;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Receives batches of events that an {@link AsyncEventPublisher} gave up delivering
 *
 * @param <EVENT> the base type of the events
 */
@FunctionalInterface
public interface DeadLetterHandler<EVENT extends Event> {
    /**
     * @param events the events that couldn't be delivered
     * @param cause  the last delivery failure
     */
    void onDeadLetter(List<EVENT> events, Exception cause);

    /**
     * A {@link DeadLetterHandler} that logs every dead letter batch at ERROR level
     *
     * @param <EVENT> the base type of the events
     */
    static <EVENT extends Event> DeadLetterHandler<EVENT> logging() {
        var log = LoggerFactory.getLogger(DeadLetterHandler.class);
        return (events, cause) -> log.error("Dead letter: failed to publish {} event(s) {}",
                                            events.size(),
                                            events.stream()
                                                  .map(event -> event.getClass().getSimpleName())
                                                  .collect(Collectors.toList()),
                                            cause);
    }
}
