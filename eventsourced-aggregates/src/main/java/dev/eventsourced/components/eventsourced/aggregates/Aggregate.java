package dev.eventsourced.components.eventsourced.aggregates;

import dev.eventsourced.components.eventsourced.eventstore.*;

import java.util.List;
import java.util.stream.Stream;

/**
 * Common interface that all event sourced aggregates must implement. Most concrete implementations choose to extend the {@link AggregateRoot} class.
 *
 * @param <EVENT>          the base type of the aggregate's event family
 * @param <AGGREGATE_TYPE> the aggregate self type (i.e. your concrete aggregate type)
 * @see AggregateRoot
 */
public interface Aggregate<EVENT extends Event, AGGREGATE_TYPE extends Aggregate<EVENT, AGGREGATE_TYPE>> {
    /**
     * The identity of the aggregate (aka. the stream-id)
     *
     * @throws IllegalStateException if no identity has been assigned yet
     */
    String identity();

    boolean hasIdentity();

    /**
     * The number of events applied to the aggregate, either through replay or as new changes
     */
    long version();

    /**
     * Snapshot of the events applied since the aggregate was created, replayed or last flushed.
     * These events haven't been persisted to the {@link EventStore} yet
     */
    List<EVENT> pendingEvents();

    /**
     * The version the aggregate's stream had in the {@link EventStore} before the {@link #pendingEvents()} were applied
     */
    default long versionBeforePendingEvents() {
        return version() - pendingEvents().size();
    }

    /**
     * Is this an aggregate that was never persisted, i.e. it has new changes and wasn't built from its history
     */
    boolean isNew();

    /**
     * Has the aggregate been initialized using previously persisted events (aka. historic events) using {@link #replay(List)}
     */
    boolean hasBeenReplayed();

    /**
     * Effectively performs a leftFold over all the previously persisted events related to this aggregate instance.<br>
     * Only valid on a freshly created instance (version 0, never replayed)
     *
     * @param persistedEvents the aggregate's history in persisted order
     * @return the same aggregate instance (self)
     * @throws IllegalStateException if the aggregate has pending events, already holds state or has already been replayed
     */
    AGGREGATE_TYPE replay(List<? extends EVENT> persistedEvents);

    AGGREGATE_TYPE replay(Stream<? extends EVENT> persistedEvents);

    /**
     * Clear the {@link #pendingEvents()}, marking them as persisted
     *
     * @return the events that were pending
     */
    List<EVENT> flush();
}
