package dev.eventsourced.components.eventsourced.aggregates.validation;

import dev.eventsourced.components.eventsourced.eventstore.Event;

import java.util.*;

import static com.google.common.base.Preconditions.*;

/**
 * The outcome of validating an event before it is applied to an aggregate.<br>
 * The result is successful if and only if it carries no {@link EventValidationError}'s
 *
 * @param <EVENT> the event type
 */
public final class EventValidationResult<EVENT extends Event> {
    public final EVENT                      event;
    public final Optional<String>           message;
    public final List<EventValidationError> errors;

    private EventValidationResult(EVENT event, Optional<String> message, List<EventValidationError> errors) {
        this.event = checkNotNull(event, "No event provided");
        this.message = checkNotNull(message, "No message provided");
        this.errors = List.copyOf(checkNotNull(errors, "No errors provided"));
    }

    public static <EVENT extends Event> EventValidationResult<EVENT> success(EVENT event) {
        return new EventValidationResult<>(event, Optional.empty(), List.of());
    }

    /**
     * @param event   the rejected event
     * @param message the overall message
     * @param errors  the individual errors, at least one
     */
    public static <EVENT extends Event> EventValidationResult<EVENT> failure(EVENT event, String message, List<EventValidationError> errors) {
        checkNotNull(errors, "No errors provided");
        checkArgument(!errors.isEmpty(), "A failed validation must contain at least one error");
        return new EventValidationResult<>(event, Optional.ofNullable(message), errors);
    }

    public static <EVENT extends Event> EventValidationResult<EVENT> failure(EVENT event, EventValidationError... errors) {
        return failure(event, null, Arrays.asList(checkNotNull(errors, "No errors provided")));
    }

    /**
     * Failure with a single error that reuses the message
     */
    public static <EVENT extends Event> EventValidationResult<EVENT> failure(EVENT event, String message) {
        checkNotNull(message, "No message provided");
        return failure(event, message, List.of(EventValidationError.of(message)));
    }

    public boolean isSuccessful() {
        return errors.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EventValidationResult)) return false;
        EventValidationResult<?> that = (EventValidationResult<?>) o;
        return event.equals(that.event) && message.equals(that.message) && errors.equals(that.errors);
    }

    @Override
    public int hashCode() {
        return Objects.hash(event, message, errors);
    }

    @Override
    public String toString() {
        return "EventValidationResult{" +
                "event=" + event.getClass().getSimpleName() +
                ", successful=" + isSuccessful() +
                ", message=" + message +
                ", errors=" + errors +
                '}';
    }
}
