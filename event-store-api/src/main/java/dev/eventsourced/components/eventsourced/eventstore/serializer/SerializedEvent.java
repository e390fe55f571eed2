package dev.eventsourced.components.eventsourced.eventstore.serializer;

import dev.eventsourced.components.eventsourced.eventstore.EventMetadata;

import java.util.Objects;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * The persisted form of an event: its serialized payload plus the {@link EventMetadata} required to read it back
 */
public class SerializedEvent {
    public final String        payload;
    public final EventMetadata metadata;

    public SerializedEvent(String payload, EventMetadata metadata) {
        this.payload = checkNotNull(payload, "No payload provided");
        this.metadata = checkNotNull(metadata, "No metadata provided");
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SerializedEvent)) return false;
        SerializedEvent that = (SerializedEvent) o;
        return payload.equals(that.payload) && metadata.equals(that.metadata);
    }

    @Override
    public int hashCode() {
        return Objects.hash(payload, metadata);
    }

    @Override
    public String toString() {
        return "SerializedEvent{" +
                "metadata=" + metadata +
                ", payload-length=" + payload.length() +
                '}';
    }
}
