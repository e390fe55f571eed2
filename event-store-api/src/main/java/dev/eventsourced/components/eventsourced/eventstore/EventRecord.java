package dev.eventsourced.components.eventsourced.eventstore;

import java.time.OffsetDateTime;
import java.util.Optional;

import static com.google.common.base.Preconditions.*;

/**
 * An event as it was persisted by an {@link EventStore}, together with its position in the aggregate's event stream
 *
 * @param <EVENT> the type of event payload
 */
public class EventRecord<EVENT extends Event> {
    /**
     * An incremental identifier, unique across all streams in the store
     */
    public final long             globalOrder;
    /**
     * The id of the aggregate whose stream this event belongs to
     */
    public final String           aggregateId;
    /**
     * The 1-based position of this event within the aggregate's stream. Equals the aggregate version
     * immediately after the event was applied
     */
    public final long             version;
    public final EVENT            payload;
    public final EventMetadata    metadata;
    /**
     * When the event was persisted
     */
    public final OffsetDateTime   timestamp;
    /**
     * Correlates workflows or processes that span multiple events
     */
    public final Optional<String> correlationId;

    public EventRecord(long globalOrder,
                       String aggregateId,
                       long version,
                       EVENT payload,
                       EventMetadata metadata,
                       OffsetDateTime timestamp,
                       Optional<String> correlationId) {
        checkArgument(version >= 1, "version must be 1 or larger, was %s", version);
        this.globalOrder = globalOrder;
        this.aggregateId = checkNotNull(aggregateId, "No aggregateId provided");
        this.version = version;
        this.payload = checkNotNull(payload, "No payload provided");
        this.metadata = checkNotNull(metadata, "No metadata provided");
        this.timestamp = checkNotNull(timestamp, "No timestamp provided");
        this.correlationId = checkNotNull(correlationId, "No correlationId option provided");
    }

    /**
     * The logical event type, as recorded in the {@link #metadata}
     */
    public String eventType() {
        return metadata.eventType;
    }

    @Override
    public String toString() {
        return "EventRecord{" +
                "globalOrder=" + globalOrder +
                ", aggregateId='" + aggregateId + '\'' +
                ", version=" + version +
                ", eventType='" + eventType() + '\'' +
                ", timestamp=" + timestamp +
                ", correlationId=" + correlationId +
                '}';
    }
}
