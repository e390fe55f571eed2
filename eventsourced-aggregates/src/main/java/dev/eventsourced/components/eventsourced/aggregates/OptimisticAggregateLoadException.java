package dev.eventsourced.components.eventsourced.aggregates;

import dev.eventsourced.components.eventsourced.eventstore.EventStoreException;

import static com.google.common.base.Strings.lenientFormat;

public class OptimisticAggregateLoadException extends EventStoreException {
    public final String   aggregateId;
    public final Class<?> aggregateType;
    public final long     expectedLatestVersion;
    public final long     actualLatestVersion;

    public OptimisticAggregateLoadException(String aggregateId, Class<?> aggregateType, long expectedLatestVersion, long actualLatestVersion) {
        super(lenientFormat("Expected expectedLatestVersion '%s' for '%s' with id '%s' but found '%s' (actualLatestVersion) in the EventStore",
                            expectedLatestVersion,
                            aggregateType.getName(),
                            aggregateId,
                            actualLatestVersion));
        this.aggregateId = aggregateId;
        this.aggregateType = aggregateType;
        this.expectedLatestVersion = expectedLatestVersion;
        this.actualLatestVersion = actualLatestVersion;
    }
}
