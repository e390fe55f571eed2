package dev.eventsourced.components.eventsourced.eventstore;

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Strings.lenientFormat;

/**
 * Thrown by a repository when no event stream exists for the requested aggregate id
 */
public class AggregateNotFoundException extends EventStoreException {
    public final String   aggregateId;
    public final Class<?> aggregateImplementationType;

    public AggregateNotFoundException(String aggregateId, Class<?> aggregateImplementationType) {
        super(generateMessage(aggregateId, aggregateImplementationType));
        this.aggregateId = checkNotNull(aggregateId, "You must supply an aggregateId");
        this.aggregateImplementationType = checkNotNull(aggregateImplementationType, "You must supply an aggregateImplementationType");
    }

    public AggregateNotFoundException(String aggregateId, Class<?> aggregateImplementationType, Exception cause) {
        super(generateMessage(aggregateId, aggregateImplementationType), cause);
        this.aggregateId = checkNotNull(aggregateId, "You must supply an aggregateId");
        this.aggregateImplementationType = checkNotNull(aggregateImplementationType, "You must supply an aggregateImplementationType");
    }

    private static String generateMessage(String aggregateId, Class<?> aggregateImplementationType) {
        return lenientFormat("Couldn't find a '%s' aggregate with id '%s'",
                             aggregateImplementationType != null ? aggregateImplementationType.getName() : null,
                             aggregateId);
    }
}
