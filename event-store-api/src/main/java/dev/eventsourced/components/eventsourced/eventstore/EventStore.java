package dev.eventsourced.components.eventsourced.eventstore;

import java.util.*;
import java.util.stream.Collectors;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Stores and retrieves the ordered stream of events related to a single aggregate instance.<br>
 * This is a contract only; concrete stores (SQL, document databases, etc.) live outside this library.
 * <p>
 * Implementations must:
 * <ul>
 *     <li>return events in persisted order</li>
 *     <li>assign each persisted event the next consecutive version of the stream (the first event has version 1)</li>
 *     <li>throw {@link OptimisticAppendToStreamException} from {@link #save(String, long, List, Optional)} when the expected version
 *     isn't {@link #ANY_VERSION} and doesn't match the current version of the stream</li>
 * </ul>
 * Blocking calls are cancelled by interrupting the calling thread.
 *
 * @param <EVENT> the base type of the events stored
 */
public interface EventStore<EVENT extends Event> {
    /**
     * Special expected version that disables the optimistic concurrency check when appending
     */
    long ANY_VERSION = -1;
    /**
     * The version of a stream that doesn't contain any events
     */
    long NO_EVENTS   = 0;

    /**
     * Append events to the stream of the given aggregate
     *
     * @param aggregateId     the id of the aggregate the events belong to
     * @param expectedVersion the version the caller expects the stream to be at before the events are appended,
     *                        or {@link #ANY_VERSION} to skip the optimistic concurrency check
     * @param events          the events to append, in order
     * @param correlationId   optional correlation id stored with every event
     * @throws OptimisticAppendToStreamException if the stream isn't at the expected version
     */
    void save(String aggregateId, long expectedVersion, List<? extends EVENT> events, Optional<String> correlationId);

    default void save(String aggregateId, long expectedVersion, List<? extends EVENT> events) {
        save(aggregateId, expectedVersion, events, Optional.empty());
    }

    default void save(String aggregateId, List<? extends EVENT> events) {
        save(aggregateId, ANY_VERSION, events, Optional.empty());
    }

    default void save(String aggregateId, List<? extends EVENT> events, String correlationId) {
        save(aggregateId, ANY_VERSION, events, Optional.of(checkNotNull(correlationId, "No correlationId provided")));
    }

    default void save(String aggregateId, EVENT event) {
        save(aggregateId, List.of(checkNotNull(event, "No event provided")));
    }

    default void save(String aggregateId, EVENT event, String correlationId) {
        save(aggregateId, List.of(checkNotNull(event, "No event provided")), correlationId);
    }

    /**
     * Load all event records of the given aggregate in persisted order
     *
     * @param aggregateId the id of the aggregate
     * @return the records, or an empty list if the stream doesn't exist
     */
    List<EventRecord<EVENT>> loadRecords(String aggregateId);

    /**
     * Load the event records of the given aggregate that match the query, in persisted order.<br>
     * The default implementation loads the full stream and filters it in memory. Stores that support range queries natively should override it.
     *
     * @param aggregateId the id of the aggregate
     * @param query       the bounds of the stream to load
     * @return the matching records
     */
    default List<EventRecord<EVENT>> loadRecords(String aggregateId, EventStreamQuery query) {
        checkNotNull(query, "No query provided");
        var records = loadRecords(aggregateId);
        if (query.isUnbounded()) {
            return records;
        }
        return records.stream()
                      .filter(query::matches)
                      .collect(Collectors.toList());
    }

    /**
     * Load all events of the given aggregate in persisted order
     *
     * @param aggregateId the id of the aggregate
     * @return the events, or an empty list if the stream doesn't exist
     */
    default List<EVENT> loadEvents(String aggregateId) {
        return loadEvents(aggregateId, EventStreamQuery.all());
    }

    default List<EVENT> loadEvents(String aggregateId, EventStreamQuery query) {
        return loadRecords(aggregateId, query).stream()
                                              .map(record -> record.payload)
                                              .collect(Collectors.toList());
    }

    /**
     * The current version of the aggregate's stream
     *
     * @param aggregateId the id of the aggregate
     * @return the version of the last persisted event or {@link #NO_EVENTS}
     */
    default long currentVersion(String aggregateId) {
        var records = loadRecords(aggregateId);
        return records.isEmpty() ? NO_EVENTS : records.get(records.size() - 1).version;
    }
}
