package dev.eventsourced.components.eventsourced.aggregates;

import static com.google.common.base.Strings.lenientFormat;

/**
 * Thrown by an {@link AggregateInstanceFactory} that failed to create an aggregate instance
 */
public class AggregateInstantiationException extends AggregateException {
    public final Class<?> aggregateType;

    public AggregateInstantiationException(Class<?> aggregateType, Throwable cause) {
        super(lenientFormat("Failed to create an instance of aggregate '%s'",
                            aggregateType != null ? aggregateType.getName() : null),
              cause);
        this.aggregateType = aggregateType;
    }
}
