package dev.eventsourced.components.eventsourced.eventstore;

import java.util.Objects;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Describes how a persisted event payload must be interpreted when it's read back from an {@link EventStore}
 */
public class EventMetadata {
    /**
     * The revision used when no explicit revision is given
     */
    public static final String FIRST_REVISION = "1";

    /**
     * The revision of the payload schema
     */
    public final String revision;
    /**
     * The logical type of event (the simple name of the event variant)
     */
    public final String eventType;
    /**
     * The Fully Qualified Class Name of the Java type used to create instances of the event when reading them from an {@link EventStore}
     */
    public final String javaType;

    public EventMetadata(String revision, String eventType, String javaType) {
        this.revision = checkNotNull(revision, "No revision provided");
        this.eventType = checkNotNull(eventType, "No eventType provided");
        this.javaType = checkNotNull(javaType, "No javaType provided");
    }

    /**
     * Create the metadata for the first revision of the given event type
     *
     * @param eventType the concrete event type
     * @return the metadata
     */
    public static EventMetadata of(Class<? extends Event> eventType) {
        return of(eventType, FIRST_REVISION);
    }

    /**
     * Create the metadata for a specific revision of the given event type
     *
     * @param eventType the concrete event type
     * @param revision  the revision of the event payload schema
     * @return the metadata
     */
    public static EventMetadata of(Class<? extends Event> eventType, String revision) {
        checkNotNull(eventType, "No eventType provided");
        return new EventMetadata(revision, eventType.getSimpleName(), eventType.getName());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EventMetadata)) return false;
        EventMetadata that = (EventMetadata) o;
        return revision.equals(that.revision) && eventType.equals(that.eventType) && javaType.equals(that.javaType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(revision, eventType, javaType);
    }

    @Override
    public String toString() {
        return "EventMetadata{" +
                "revision='" + revision + '\'' +
                ", eventType='" + eventType + '\'' +
                ", javaType='" + javaType + '\'' +
                '}';
    }
}
