package dev.eventsourced.components.eventsourced.aggregates;

import dev.eventsourced.components.eventsourced.eventstore.Event;

import java.util.Objects;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * The outcome of successfully applying a new event to an {@link AggregateRoot}
 *
 * @param <EVENT> the event type
 */
public final class AppliedEvent<EVENT extends Event> {
    public final EVENT event;
    /**
     * The aggregate version right after the event was applied
     */
    public final long  version;

    public AppliedEvent(EVENT event, long version) {
        this.event = checkNotNull(event, "No event provided");
        this.version = version;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AppliedEvent)) return false;
        AppliedEvent<?> that = (AppliedEvent<?>) o;
        return version == that.version && event.equals(that.event);
    }

    @Override
    public int hashCode() {
        return Objects.hash(event, version);
    }

    @Override
    public String toString() {
        return "AppliedEvent{" +
                "event=" + event +
                ", version=" + version +
                '}';
    }
}
