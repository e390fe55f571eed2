package dev.eventsourced.components.eventsourced.eventstore.serializer.json;

import dev.eventsourced.components.eventsourced.eventstore.EventStoreException;

public class JSONSerializationException extends EventStoreException {
    public JSONSerializationException(String msg, Exception cause) {
        super(msg, cause);
    }
}
