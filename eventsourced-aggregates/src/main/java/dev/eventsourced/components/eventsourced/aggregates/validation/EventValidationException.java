package dev.eventsourced.components.eventsourced.aggregates.validation;

import dev.eventsourced.components.eventsourced.aggregates.AggregateException;

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Strings.lenientFormat;

/**
 * Thrown when a validator rejects an event. The aggregate is left untouched, so the caller may correct the input and retry
 */
public class EventValidationException extends AggregateException {
    private final EventValidationResult<?> validationResult;

    public EventValidationException(EventValidationResult<?> validationResult) {
        super(generateMessage(checkNotNull(validationResult, "No validationResult provided")));
        this.validationResult = validationResult;
    }

    public EventValidationResult<?> validationResult() {
        return validationResult;
    }

    private static String generateMessage(EventValidationResult<?> validationResult) {
        return validationResult.message.orElseGet(() -> lenientFormat("Event '%s' is invalid",
                                                                      validationResult.event.getClass().getSimpleName()));
    }
}
