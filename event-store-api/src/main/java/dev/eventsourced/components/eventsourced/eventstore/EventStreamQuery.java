package dev.eventsourced.components.eventsourced.eventstore;

import java.time.OffsetDateTime;
import java.util.*;

import static com.google.common.base.Preconditions.*;

/**
 * Restricts which part of an aggregate's event stream is loaded. All bounds are inclusive and all of them are optional:
 * <ul>
 *     <li>{@link #fromVersion}: only events on or after this version</li>
 *     <li>{@link #toVersion}: only events up to and including this version</li>
 *     <li>{@link #asOf}: only events persisted on or before this timestamp</li>
 * </ul>
 * Instances are immutable; the <code>withXXX</code> methods return a new query
 */
public class EventStreamQuery {
    private static final EventStreamQuery ALL = new EventStreamQuery(Optional.empty(), Optional.empty(), Optional.empty());

    public final Optional<Long>           fromVersion;
    public final Optional<Long>           toVersion;
    public final Optional<OffsetDateTime> asOf;

    private EventStreamQuery(Optional<Long> fromVersion, Optional<Long> toVersion, Optional<OffsetDateTime> asOf) {
        this.fromVersion = checkNotNull(fromVersion, "No fromVersion option provided");
        this.toVersion = checkNotNull(toVersion, "No toVersion option provided");
        this.asOf = checkNotNull(asOf, "No asOf option provided");
        fromVersion.ifPresent(version -> checkArgument(version >= 1, "fromVersion must be 1 or larger, was %s", version));
        toVersion.ifPresent(version -> checkArgument(version >= 1, "toVersion must be 1 or larger, was %s", version));
        if (fromVersion.isPresent() && toVersion.isPresent()) {
            checkArgument(fromVersion.get() <= toVersion.get(),
                          "fromVersion %s must be less than or equal to toVersion %s",
                          fromVersion.get(),
                          toVersion.get());
        }
    }

    /**
     * @return a query that matches the complete event stream
     */
    public static EventStreamQuery all() {
        return ALL;
    }

    public static EventStreamQuery fromVersion(long fromVersion) {
        return ALL.withFromVersion(fromVersion);
    }

    public static EventStreamQuery toVersion(long toVersion) {
        return ALL.withToVersion(toVersion);
    }

    public static EventStreamQuery asOf(OffsetDateTime timestamp) {
        return ALL.withAsOf(timestamp);
    }

    public EventStreamQuery withFromVersion(long fromVersion) {
        return new EventStreamQuery(Optional.of(fromVersion), toVersion, asOf);
    }

    public EventStreamQuery withToVersion(long toVersion) {
        return new EventStreamQuery(fromVersion, Optional.of(toVersion), asOf);
    }

    public EventStreamQuery withAsOf(OffsetDateTime timestamp) {
        return new EventStreamQuery(fromVersion, toVersion, Optional.of(checkNotNull(timestamp, "No timestamp provided")));
    }

    /**
     * @return true if this query matches the complete event stream
     */
    public boolean isUnbounded() {
        return fromVersion.isEmpty() && toVersion.isEmpty() && asOf.isEmpty();
    }

    /**
     * Does the given record fall within the bounds of this query
     *
     * @param record the record to test
     * @return true if the record matches all bounds
     */
    public boolean matches(EventRecord<?> record) {
        checkNotNull(record, "No record provided");
        return fromVersion.map(version -> record.version >= version).orElse(true) &&
                toVersion.map(version -> record.version <= version).orElse(true) &&
                asOf.map(timestamp -> !record.timestamp.isAfter(timestamp)).orElse(true);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EventStreamQuery)) return false;
        EventStreamQuery that = (EventStreamQuery) o;
        return fromVersion.equals(that.fromVersion) && toVersion.equals(that.toVersion) && asOf.equals(that.asOf);
    }

    @Override
    public int hashCode() {
        return Objects.hash(fromVersion, toVersion, asOf);
    }

    @Override
    public String toString() {
        return "EventStreamQuery{" +
                "fromVersion=" + fromVersion +
                ", toVersion=" + toVersion +
                ", asOf=" + asOf +
                '}';
    }
}
