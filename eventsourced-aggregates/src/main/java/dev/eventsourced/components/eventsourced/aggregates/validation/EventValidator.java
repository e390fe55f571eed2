package dev.eventsourced.components.eventsourced.aggregates.validation;

import dev.eventsourced.components.eventsourced.eventstore.Event;

/**
 * Decides whether a new event may be applied to an aggregate. Must not have side effects
 *
 * @param <EVENT> the event type
 * @see AsyncEventValidator
 */
@FunctionalInterface
public interface EventValidator<EVENT extends Event> {
    EventValidationResult<EVENT> validate(EVENT event);

    /**
     * Combine this validator with another. The other validator is only consulted if this validator accepts the event
     */
    default EventValidator<EVENT> and(EventValidator<EVENT> other) {
        return event -> {
            var result = validate(event);
            return result.isSuccessful() ? other.validate(event) : result;
        };
    }

    static <EVENT extends Event> EventValidator<EVENT> acceptAll() {
        return EventValidationResult::success;
    }
}
