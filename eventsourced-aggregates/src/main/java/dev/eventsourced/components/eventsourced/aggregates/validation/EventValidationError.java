package dev.eventsourced.components.eventsourced.aggregates.validation;

import java.util.*;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A single reason why an event was rejected
 */
public final class EventValidationError {
    public final String           message;
    public final Optional<String> code;

    public EventValidationError(String message, Optional<String> code) {
        this.message = checkNotNull(message, "No message provided");
        this.code = checkNotNull(code, "No code provided");
    }

    public static EventValidationError of(String message) {
        return new EventValidationError(message, Optional.empty());
    }

    public static EventValidationError of(String message, String code) {
        return new EventValidationError(message, Optional.of(checkNotNull(code, "No code provided")));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EventValidationError)) return false;
        EventValidationError that = (EventValidationError) o;
        return message.equals(that.message) && code.equals(that.code);
    }

    @Override
    public int hashCode() {
        return Objects.hash(message, code);
    }

    @Override
    public String toString() {
        return code.map(c -> "[" + c + "] " + message).orElse(message);
    }
}
