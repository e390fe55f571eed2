package dev.eventsourced.components.eventsourced.aggregates;

import dev.eventsourced.components.eventsourced.eventstore.Event;

import static com.google.common.base.Strings.lenientFormat;

/**
 * Thrown when an {@link AggregateRoot} is asked to apply an event variant it doesn't handle.<br>
 * This is a programming error: the aggregate's event family and its {@link AggregateRoot#apply(Event)} dispatch are out of sync
 */
public class UnsupportedEventException extends AggregateException {
    public final Class<? extends Event> eventType;
    public final Class<?>               aggregateType;

    public UnsupportedEventException(Class<? extends Event> eventType, Class<?> aggregateType) {
        super(lenientFormat("Aggregate '%s' doesn't support Event '%s'",
                            aggregateType != null ? aggregateType.getName() : null,
                            eventType != null ? eventType.getName() : null));
        this.eventType = eventType;
        this.aggregateType = aggregateType;
    }
}
