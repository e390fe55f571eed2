package dev.eventsourced.components.eventsourced.eventstore.serializer.json;

import dev.eventsourced.components.eventsourced.eventstore.EventStoreException;

public class JSONDeserializationException extends EventStoreException {
    public JSONDeserializationException(String msg, Exception cause) {
        super(msg, cause);
    }
}
