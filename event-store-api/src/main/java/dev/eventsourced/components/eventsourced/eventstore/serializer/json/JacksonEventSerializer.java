package dev.eventsourced.components.eventsourced.eventstore.serializer.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.*;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import dev.eventsourced.components.eventsourced.eventstore.*;
import dev.eventsourced.components.eventsourced.eventstore.serializer.*;

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Strings.lenientFormat;

/**
 * Jackson based {@link EventSerializer}.<br>
 * Use {@link #createDefaultObjectMapper()} as a starting point if you need to supply a customized {@link ObjectMapper}
 */
public class JacksonEventSerializer implements EventSerializer {
    private final ObjectMapper objectMapper;
    private final ClassLoader  classLoader;

    public JacksonEventSerializer() {
        this(createDefaultObjectMapper());
    }

    public JacksonEventSerializer(ObjectMapper objectMapper) {
        this(objectMapper, defaultClassLoader());
    }

    public JacksonEventSerializer(ObjectMapper objectMapper, ClassLoader classLoader) {
        this.objectMapper = checkNotNull(objectMapper, "No objectMapper provided");
        this.classLoader = checkNotNull(classLoader, "No classLoader provided");
    }

    /**
     * An {@link ObjectMapper} that handles java.time types as ISO-8601 strings (keeping the original offset) and ignores
     * properties that are unknown to the current revision of an event type
     */
    public static ObjectMapper createDefaultObjectMapper() {
        return new ObjectMapper().registerModule(new JavaTimeModule())
                                 .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                                 .disable(DeserializationFeature.ADJUST_DATES_TO_CONTEXT_TIME_ZONE)
                                 .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    private static ClassLoader defaultClassLoader() {
        var contextClassLoader = Thread.currentThread().getContextClassLoader();
        return contextClassLoader != null ? contextClassLoader : JacksonEventSerializer.class.getClassLoader();
    }

    @Override
    public SerializedEvent serialize(Event event) {
        checkNotNull(event, "No event provided");
        try {
            return new SerializedEvent(objectMapper.writeValueAsString(event),
                                       EventMetadata.of(event.getClass()));
        } catch (JsonProcessingException e) {
            throw new JSONSerializationException(lenientFormat("Failed to serialize event of type '%s'", event.getClass().getName()), e);
        }
    }

    @SuppressWarnings("unchecked")
    @Override
    public <EVENT extends Event> EVENT deserialize(String payload, EventMetadata metadata) {
        checkNotNull(metadata, "No metadata provided");
        Class<?> javaType;
        try {
            javaType = Class.forName(metadata.javaType, true, classLoader);
        } catch (ClassNotFoundException e) {
            throw new JSONDeserializationException(lenientFormat("Unknown event java type '%s' (revision '%s')", metadata.javaType, metadata.revision), e);
        }
        if (!Event.class.isAssignableFrom(javaType)) {
            throw new JSONDeserializationException(lenientFormat("Java type '%s' isn't an %s", metadata.javaType, Event.class.getName()), null);
        }
        return deserialize(payload, (Class<EVENT>) javaType);
    }

    @Override
    public <EVENT extends Event> EVENT deserialize(String payload, Class<EVENT> eventType) {
        checkNotNull(payload, "No payload provided");
        checkNotNull(eventType, "No eventType provided");
        try {
            return objectMapper.readValue(payload, eventType);
        } catch (JsonProcessingException e) {
            throw new JSONDeserializationException(lenientFormat("Failed to deserialize payload to '%s'", eventType.getName()), e);
        }
    }

    /**
     * The {@link ObjectMapper} used by this serializer
     */
    public ObjectMapper objectMapper() {
        return objectMapper;
    }
}
