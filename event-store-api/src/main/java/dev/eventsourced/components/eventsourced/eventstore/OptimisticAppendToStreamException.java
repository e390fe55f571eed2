package dev.eventsourced.components.eventsourced.eventstore;

import static com.google.common.base.Strings.lenientFormat;

/**
 * Thrown by an {@link EventStore} when the stream version it holds for an aggregate differs from the version
 * the caller expected when appending new events. This typically means that another writer loaded the same
 * version of the aggregate and saved its changes first
 */
public class OptimisticAppendToStreamException extends EventStoreException {
    public final String aggregateId;
    public final long   expectedVersion;
    public final long   actualVersion;

    public OptimisticAppendToStreamException(String aggregateId, long expectedVersion, long actualVersion) {
        super(lenientFormat("Cannot append events to the stream of aggregate '%s'. Expected stream version %s but the stream is at version %s",
                            aggregateId,
                            expectedVersion,
                            actualVersion));
        this.aggregateId = aggregateId;
        this.expectedVersion = expectedVersion;
        this.actualVersion = actualVersion;
    }
}
