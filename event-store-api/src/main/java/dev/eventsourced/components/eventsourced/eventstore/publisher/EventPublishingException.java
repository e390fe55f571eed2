package dev.eventsourced.components.eventsourced.eventstore.publisher;

import dev.eventsourced.components.eventsourced.eventstore.EventStoreException;

public class EventPublishingException extends EventStoreException {
    public EventPublishingException(String message) {
        super(message);
    }

    public EventPublishingException(String message, Throwable cause) {
        super(message, cause);
    }
}
