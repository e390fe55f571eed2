package dev.eventsourced.components.eventsourced.aggregates.repository;

import dev.eventsourced.components.eventsourced.aggregates.*;
import dev.eventsourced.components.eventsourced.eventstore.*;
import dev.eventsourced.components.eventsourced.eventstore.publisher.EventPublisher;
import org.slf4j.*;

import java.util.*;
import java.util.concurrent.*;
import java.util.stream.Collectors;

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

/**
 * Repository facade that saves and loads a specific type of {@link Aggregate} through an {@link EventStore}.<br>
 * Saving an aggregate:
 * <ol>
 *     <li>appends the aggregate's {@link Aggregate#pendingEvents()} to the {@link EventStore}, expecting the stream to be at
 *     {@link Aggregate#versionBeforePendingEvents()}</li>
 *     <li>hands the events to the {@link EventPublisher#publishAndForget(List)}</li>
 *     <li>{@link Aggregate#flush() flushes} the aggregate</li>
 * </ol>
 * If the {@link EventStore} rejects the events, nothing is published and the aggregate keeps its pending events.<br>
 * Loading an aggregate creates a fresh instance using the {@link AggregateInstanceFactory} and {@link Aggregate#replay(List) replays}
 * the persisted events into it.
 *
 * @param <EVENT>     the base type of the aggregate's event family
 * @param <AGGREGATE> the concrete aggregate type
 */
public interface AggregateRepository<EVENT extends Event, AGGREGATE extends Aggregate<EVENT, AGGREGATE>> {
    /**
     * Create a repository that doesn't publish the saved events
     */
    static <EVENT extends Event, AGGREGATE extends Aggregate<EVENT, AGGREGATE>> AggregateRepository<EVENT, AGGREGATE> from(EventStore<EVENT> eventStore,
                                                                                                                            AggregateInstanceFactory aggregateInstanceFactory,
                                                                                                                            Class<AGGREGATE> aggregateType) {
        return new DefaultAggregateRepository<>(eventStore,
                                                EventPublisher.noOp(),
                                                aggregateInstanceFactory,
                                                aggregateType);
    }

    static <EVENT extends Event, AGGREGATE extends Aggregate<EVENT, AGGREGATE>> AggregateRepository<EVENT, AGGREGATE> from(EventStore<EVENT> eventStore,
                                                                                                                            EventPublisher<EVENT> eventPublisher,
                                                                                                                            AggregateInstanceFactory aggregateInstanceFactory,
                                                                                                                            Class<AGGREGATE> aggregateType) {
        return new DefaultAggregateRepository<>(eventStore,
                                                eventPublisher,
                                                aggregateInstanceFactory,
                                                aggregateType);
    }

    // -------------------------------------------------------------------------------------------------------------------------------------------------

    /**
     * Try to load the aggregate by replaying its full event stream
     *
     * @param aggregateId the aggregate id
     * @return the aggregate or {@link Optional#empty()} if its stream contains no events
     */
    default Optional<AGGREGATE> tryLoad(String aggregateId) {
        return tryLoad(aggregateId, EventStreamQuery.all());
    }

    /**
     * Try to load a partial or point in time view of the aggregate, e.g. the state as of a given timestamp or up to a given version.<br>
     * Such views are read-only. When the query starts after the first event:
     * <ul>
     *     <li>the creation event isn't replayed, so the aggregate may have no {@link Aggregate#identity()}</li>
     *     <li>the resulting {@link Aggregate#version()} counts the replayed events only</li>
     * </ul>
     * Saving changes made to a view is rejected, either by {@link #save(Aggregate)} (no identity) or by the {@link EventStore}'s
     * optimistic version check
     *
     * @param aggregateId the aggregate id
     * @param query       the bounds of the event stream to replay
     * @return the aggregate or {@link Optional#empty()} if no events match the query
     */
    Optional<AGGREGATE> tryLoad(String aggregateId, EventStreamQuery query);

    /**
     * Try to load the aggregate and verify that its stream is at the expected version
     *
     * @param aggregateId           the aggregate id
     * @param expectedLatestVersion the version of the latest event the caller expects
     * @return the aggregate or {@link Optional#empty()} if its stream contains no events
     * @throws OptimisticAggregateLoadException in case the latest persisted version differs from the expected version
     */
    Optional<AGGREGATE> tryLoad(String aggregateId, long expectedLatestVersion);

    /**
     * @throws AggregateNotFoundException in case the aggregate's stream contains no events
     */
    default AGGREGATE load(String aggregateId) {
        return tryLoad(aggregateId).orElseThrow(() -> new AggregateNotFoundException(aggregateId, aggregateType()));
    }

    /**
     * @throws AggregateNotFoundException in case no events match the query
     */
    default AGGREGATE load(String aggregateId, EventStreamQuery query) {
        return tryLoad(aggregateId, query).orElseThrow(() -> new AggregateNotFoundException(aggregateId, aggregateType()));
    }

    /**
     * @throws AggregateNotFoundException       in case the aggregate's stream contains no events
     * @throws OptimisticAggregateLoadException in case the latest persisted version differs from the expected version
     */
    default AGGREGATE load(String aggregateId, long expectedLatestVersion) {
        return tryLoad(aggregateId, expectedLatestVersion).orElseThrow(() -> new AggregateNotFoundException(aggregateId, aggregateType()));
    }

    /**
     * Save the aggregate's pending events. Does nothing if the aggregate has no pending events
     *
     * @throws OptimisticAppendToStreamException in case another writer appended to the aggregate's stream since it was loaded
     */
    default void save(AGGREGATE aggregate) {
        save(aggregate, Optional.empty());
    }

    default void save(AGGREGATE aggregate, String correlationId) {
        save(aggregate, Optional.of(checkNotNull(correlationId, "No correlationId provided")));
    }

    void save(AGGREGATE aggregate, Optional<String> correlationId);

    /**
     * Save the aggregates one by one in iteration order. Stops at the first failure
     */
    default void saveAll(Iterable<? extends AGGREGATE> aggregates) {
        checkNotNull(aggregates, "No aggregates provided");
        aggregates.forEach(this::save);
    }

    /**
     * Run {@link #save(Aggregate)} on the executor.
     * Cancelling the returned future before the task has started prevents the save
     */
    default CompletableFuture<Void> saveAsync(AGGREGATE aggregate, Executor executor) {
        checkNotNull(executor, "No executor provided");
        return CompletableFuture.runAsync(() -> save(aggregate), executor);
    }

    /**
     * Run {@link #load(String)} on the executor.
     * Cancelling the returned future before the task has started prevents the load
     */
    default CompletableFuture<AGGREGATE> loadAsync(String aggregateId, Executor executor) {
        checkNotNull(executor, "No executor provided");
        return CompletableFuture.supplyAsync(() -> load(aggregateId), executor);
    }

    default CompletableFuture<Optional<AGGREGATE>> tryLoadAsync(String aggregateId, Executor executor) {
        checkNotNull(executor, "No executor provided");
        return CompletableFuture.supplyAsync(() -> tryLoad(aggregateId), executor);
    }

    Class<AGGREGATE> aggregateType();

    // -------------------------------------------------------------------------------------------------------------------------------------------------

    class DefaultAggregateRepository<EVENT extends Event, AGGREGATE extends Aggregate<EVENT, AGGREGATE>> implements AggregateRepository<EVENT, AGGREGATE> {
        private static final Logger log = LoggerFactory.getLogger(AggregateRepository.class);

        private final EventStore<EVENT>        eventStore;
        private final EventPublisher<EVENT>    eventPublisher;
        private final AggregateInstanceFactory aggregateInstanceFactory;
        private final Class<AGGREGATE>         aggregateType;

        public DefaultAggregateRepository(EventStore<EVENT> eventStore,
                                          EventPublisher<EVENT> eventPublisher,
                                          AggregateInstanceFactory aggregateInstanceFactory,
                                          Class<AGGREGATE> aggregateType) {
            this.eventStore = checkNotNull(eventStore, "You must supply an EventStore instance");
            this.eventPublisher = checkNotNull(eventPublisher, "You must supply an EventPublisher instance");
            this.aggregateInstanceFactory = checkNotNull(aggregateInstanceFactory, "You must supply an AggregateInstanceFactory instance");
            this.aggregateType = checkNotNull(aggregateType, "You must supply an aggregateType");
        }

        protected EventStore<EVENT> eventStore() {
            return eventStore;
        }

        @Override
        public Optional<AGGREGATE> tryLoad(String aggregateId, EventStreamQuery query) {
            checkNotNull(aggregateId, "No aggregateId provided");
            checkNotNull(query, "No query provided");
            log.trace("Trying to load {} with id '{}' using {}", aggregateType.getName(), aggregateId, query);
            var records = eventStore.loadRecords(aggregateId, query);
            if (records.isEmpty()) {
                log.trace("Didn't find a {} with id '{}'", aggregateType.getName(), aggregateId);
                return Optional.empty();
            }
            return Optional.of(replay(aggregateId, records));
        }

        @Override
        public Optional<AGGREGATE> tryLoad(String aggregateId, long expectedLatestVersion) {
            checkNotNull(aggregateId, "No aggregateId provided");
            log.trace("Trying to load {} with id '{}' and expectedLatestVersion {}", aggregateType.getName(), aggregateId, expectedLatestVersion);
            var records = eventStore.loadRecords(aggregateId);
            if (records.isEmpty()) {
                log.trace("Didn't find a {} with id '{}'", aggregateType.getName(), aggregateId);
                return Optional.empty();
            }
            var actualLatestVersion = records.get(records.size() - 1).version;
            if (actualLatestVersion != expectedLatestVersion) {
                log.trace("Found {} with id '{}' but expectedLatestVersion {} != actualLatestVersion {}",
                          aggregateType.getName(),
                          aggregateId,
                          expectedLatestVersion,
                          actualLatestVersion);
                throw new OptimisticAggregateLoadException(aggregateId,
                                                           aggregateType,
                                                           expectedLatestVersion,
                                                           actualLatestVersion);
            }
            return Optional.of(replay(aggregateId, records));
        }

        private AGGREGATE replay(String aggregateId, List<EventRecord<EVENT>> records) {
            log.debug("Found {} with id '{}'. Replaying {} event(s)", aggregateType.getName(), aggregateId, records.size());
            var aggregate = aggregateInstanceFactory.create(aggregateType);
            return aggregate.replay(records.stream()
                                           .map(record -> record.payload)
                                           .collect(Collectors.toList()));
        }

        @Override
        public void save(AGGREGATE aggregate, Optional<String> correlationId) {
            checkNotNull(aggregate, "No aggregate provided");
            checkNotNull(correlationId, "No correlationId provided");
            var eventsToPersist = aggregate.pendingEvents();
            if (eventsToPersist.isEmpty()) {
                log.trace("No changes detected for '{}' with id '{}'",
                          aggregateType.getName(),
                          aggregate.hasIdentity() ? aggregate.identity() : null);
                return;
            }
            checkState(aggregate.hasIdentity(),
                       "Cannot save %s pending event(s) for '%s' since the aggregate has no identity. Aggregates loaded from a partial event stream are read-only",
                       eventsToPersist.size(),
                       aggregateType.getName());
            var aggregateId     = aggregate.identity();
            var expectedVersion = aggregate.versionBeforePendingEvents();
            if (log.isTraceEnabled()) {
                log.trace("Persisting {} event(s) related to '{}' with id '{}' and expected version {}: {}",
                          eventsToPersist.size(),
                          aggregateType.getName(),
                          aggregateId,
                          expectedVersion,
                          eventsToPersist.stream()
                                         .map(event -> event.getClass().getSimpleName())
                                         .collect(Collectors.joining(", ")));
            } else {
                log.debug("Persisting {} event(s) related to '{}' with id '{}'",
                          eventsToPersist.size(),
                          aggregateType.getName(),
                          aggregateId);
            }
            eventStore.save(aggregateId, expectedVersion, eventsToPersist, correlationId);
            try {
                eventPublisher.publishAndForget(eventsToPersist);
            } finally {
                aggregate.flush();
            }
        }

        @Override
        public Class<AGGREGATE> aggregateType() {
            return aggregateType;
        }

        @Override
        public String toString() {
            return "AggregateRepository{" +
                    "aggregateType=" + aggregateType.getName() +
                    ", eventStore=" + eventStore +
                    ", eventPublisher=" + eventPublisher +
                    '}';
        }
    }
}
