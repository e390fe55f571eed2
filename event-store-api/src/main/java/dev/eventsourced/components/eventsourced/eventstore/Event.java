package dev.eventsourced.components.eventsourced.eventstore;

import java.time.OffsetDateTime;

/**
 * An immutable record of something that happened in the domain.<br>
 * Each domain declares its own event family as a sub interface of {@link Event}, with one concrete type per event variant.
 * Example:
 * <pre>{@code
 * public interface CartEvent extends Event {
 * }
 *
 * public record ItemAdded(String itemId, BigDecimal price, int quantity, OffsetDateTime occurredAt) implements CartEvent {
 * }
 * }</pre>
 * All other fields than {@link #occurredAt()} are domain specific payload
 */
public interface Event {
    /**
     * The instant when the event occurred
     */
    OffsetDateTime occurredAt();
}
