package dev.eventsourced.components.eventsourced.aggregates.validation;

import dev.eventsourced.components.eventsourced.eventstore.Event;

import java.util.concurrent.*;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Validator for rules that need I/O, e.g. a lookup in a read model or a remote service
 *
 * @param <EVENT> the event type
 */
@FunctionalInterface
public interface AsyncEventValidator<EVENT extends Event> {
    CompletionStage<EventValidationResult<EVENT>> validate(EVENT event);

    static <EVENT extends Event> AsyncEventValidator<EVENT> acceptAll() {
        return event -> CompletableFuture.completedFuture(EventValidationResult.success(event));
    }

    /**
     * Adapt a synchronous validator. The validation completes on the calling thread
     */
    static <EVENT extends Event> AsyncEventValidator<EVENT> from(EventValidator<EVENT> validator) {
        checkNotNull(validator, "No validator provided");
        return event -> {
            try {
                return CompletableFuture.completedFuture(validator.validate(event));
            } catch (RuntimeException e) {
                return CompletableFuture.failedFuture(e);
            }
        };
    }

    /**
     * Adapt a synchronous validator by running it on the given executor
     */
    static <EVENT extends Event> AsyncEventValidator<EVENT> from(EventValidator<EVENT> validator, Executor executor) {
        checkNotNull(validator, "No validator provided");
        checkNotNull(executor, "No executor provided");
        return event -> CompletableFuture.supplyAsync(() -> validator.validate(event), executor);
    }
}
