package dev.eventsourced.components.eventsourced.eventstore.serializer;

import dev.eventsourced.components.eventsourced.eventstore.*;
import dev.eventsourced.components.eventsourced.eventstore.serializer.json.*;

/**
 * Converts events to and from their persisted form. Used by {@link EventStore} implementations, which must preserve
 * every field of every event variant a domain declares
 */
public interface EventSerializer {
    /**
     * Serialize an event together with the {@link EventMetadata} needed to deserialize it again
     *
     * @param event the event to serialize
     * @return the serialized event
     * @throws JSONSerializationException in case the event couldn't be serialized
     */
    SerializedEvent serialize(Event event);

    /**
     * Deserialize a payload into the Java type named by {@link EventMetadata#javaType}
     *
     * @param payload  the serialized payload
     * @param metadata the metadata captured when the event was serialized
     * @param <EVENT>  the expected event type
     * @return the deserialized event
     * @throws JSONDeserializationException in case the java type is unknown or the payload couldn't be deserialized
     */
    <EVENT extends Event> EVENT deserialize(String payload, EventMetadata metadata);

    /**
     * Deserialize a payload into the given Java type
     *
     * @param payload   the serialized payload
     * @param eventType the type to deserialize into
     * @param <EVENT>   the event type
     * @return the deserialized event
     * @throws JSONDeserializationException in case the payload couldn't be deserialized
     */
    <EVENT extends Event> EVENT deserialize(String payload, Class<EVENT> eventType);
}
