package dev.eventsourced.components.eventsourced.aggregates;

import dev.eventsourced.components.eventsourced.aggregates.validation.*;
import dev.eventsourced.components.eventsourced.eventstore.*;
import org.slf4j.*;

import java.util.*;
import java.util.concurrent.*;
import java.util.stream.Stream;

import static com.google.common.base.Preconditions.*;

/**
 * A mutable, single threaded {@link Aggregate} base class.<br>
 * Domain behaviour methods decide which event should happen and call {@link #applyChange(Event)}, which validates the event,
 * applies it through {@link #apply(Event)}, increments the {@link #version()} and buffers the event in {@link #pendingEvents()}.<br>
 * {@link #replay(List)} rebuilds the state from the persisted history without buffering anything.
 * <p>
 * {@link #apply(Event)} must be an exhaustive dispatch over the aggregate's event family:
 * <pre>{@code
 * @Override
 * protected void apply(CartEvent event) {
 *     if (event instanceof CartCreated) {
 *         var e = (CartCreated) event;
 *         assignIdentity(e.cartId);
 *         ...
 *     } else if (event instanceof ItemAdded) {
 *         ...
 *     } else {
 *         throw unsupportedEvent(event);
 *     }
 * }
 * }</pre>
 * Validation is a composed capability: override {@link #eventValidator()} or pass an {@link AsyncEventValidator}
 * to {@link #applyChangeAsync(Event, AsyncEventValidator)}.
 * <p>
 * Instances may be created by Objenesis (see {@link AggregateInstanceFactory#objenesisFactory()}), which neither calls a constructor nor
 * runs field initializers. All internal state is therefore initialized lazily.
 * <p>
 * Instances are not thread safe. Callers must serialize access to an instance, including while a
 * {@link #applyChangeAsync(Event, AsyncEventValidator)} future is incomplete.
 *
 * @param <EVENT>          the base type of the aggregate's event family
 * @param <AGGREGATE_TYPE> the aggregate self type (i.e. your concrete aggregate type)
 */
public abstract class AggregateRoot<EVENT extends Event, AGGREGATE_TYPE extends AggregateRoot<EVENT, AGGREGATE_TYPE>> implements Aggregate<EVENT, AGGREGATE_TYPE> {
    private static final Logger log = LoggerFactory.getLogger(AggregateRoot.class);

    private String      identity;
    private long        version;
    private List<EVENT> pendingEvents;
    private boolean     isNew;
    private boolean     hasBeenReplayed;
    private boolean     isReplaying;

    /**
     * Apply the event to the aggregate instance to reflect the event as a state change.<br>
     * Called both for new changes and during {@link #replay(List)}, so it must only mutate the aggregate's own state and
     * must be deterministic. Unknown event variants must end in <code>throw unsupportedEvent(event)</code>
     *
     * @param event the event to apply
     * @see #isReplaying()
     */
    protected abstract void apply(EVENT event);

    /**
     * The validator consulted by {@link #applyChange(Event)}. Accepts every event unless overridden
     */
    protected EventValidator<EVENT> eventValidator() {
        return EventValidator.acceptAll();
    }

    /**
     * Apply a new event to this aggregate instance.<br>
     * Nothing changes if the event is rejected by the {@link #eventValidator()} or if {@link #apply(Event)} throws
     *
     * @param event the new event
     * @return the applied event together with the aggregate version after applying it
     * @throws EventValidationException  if the event was rejected
     * @throws UnsupportedEventException if the aggregate doesn't support the event
     */
    protected AppliedEvent<EVENT> applyChange(EVENT event) {
        checkNotNull(event, "You must supply an event");
        return applyValidatedChange(event, eventValidator().validate(event));
    }

    /**
     * Validate the event using the {@link AsyncEventValidator} and apply it once the validation has completed.<br>
     * Cancelling the returned future before the validation completes prevents the event from being applied.
     * Once the event is being applied, the change runs to completion even if the future is cancelled
     *
     * @param event     the new event
     * @param validator the validator that must accept the event
     * @return future completed with the applied event, or completed exceptionally with {@link EventValidationException},
     * {@link UnsupportedEventException} or the validator's failure
     */
    protected CompletableFuture<AppliedEvent<EVENT>> applyChangeAsync(EVENT event, AsyncEventValidator<EVENT> validator) {
        checkNotNull(event, "You must supply an event");
        checkNotNull(validator, "You must supply a validator");
        var result = new CompletableFuture<AppliedEvent<EVENT>>();
        validator.validate(event).whenComplete((validationResult, failure) -> {
            if (failure != null) {
                result.completeExceptionally(failure instanceof CompletionException && failure.getCause() != null ? failure.getCause() : failure);
                return;
            }
            if (result.isDone()) {
                log.debug("[{}:{}] Skipping '{}' since the change was cancelled",
                          getClass().getSimpleName(),
                          identity,
                          event.getClass().getSimpleName());
                return;
            }
            try {
                result.complete(applyValidatedChange(event, validationResult));
            } catch (RuntimeException e) {
                result.completeExceptionally(e);
            }
        });
        return result;
    }

    /**
     * Equivalent to {@link #applyChangeAsync(Event, AsyncEventValidator)} using the {@link #eventValidator()}
     */
    protected CompletableFuture<AppliedEvent<EVENT>> applyChangeAsync(EVENT event) {
        return applyChangeAsync(event, AsyncEventValidator.from(eventValidator()));
    }

    private AppliedEvent<EVENT> applyValidatedChange(EVENT event, EventValidationResult<EVENT> validationResult) {
        checkNotNull(validationResult, "The validator returned no result for Event '%s'", event.getClass().getName());
        if (!validationResult.isSuccessful()) {
            log.trace("[{}:{}] Rejected '{}': {}",
                      getClass().getSimpleName(),
                      identity,
                      event.getClass().getSimpleName(),
                      validationResult.errors);
            throw new EventValidationException(validationResult);
        }
        var firstChange = version == 0 && !hasBeenReplayed;
        apply(event);
        version++;
        _pendingEvents().add(event);
        if (firstChange) {
            isNew = true;
        }
        return new AppliedEvent<>(event, version);
    }

    @Override
    public AGGREGATE_TYPE replay(List<? extends EVENT> persistedEvents) {
        checkNotNull(persistedEvents, "You must provide a persistedEvents list");
        return replay(persistedEvents.stream());
    }

    @Override
    @SuppressWarnings("unchecked")
    public AGGREGATE_TYPE replay(Stream<? extends EVENT> persistedEvents) {
        checkNotNull(persistedEvents, "You must provide a persistedEvents stream");
        checkState(_pendingEvents().isEmpty(),
                   "Cannot replay Aggregate '%s' with id '%s' while it has %s pending event(s)",
                   getClass().getName(),
                   identity,
                   _pendingEvents().size());
        checkState(version == 0 && !hasBeenReplayed,
                   "Cannot replay Aggregate '%s' with id '%s' since it already holds state at version %s. Replay into a fresh instance",
                   getClass().getName(),
                   identity,
                   version);
        isReplaying = true;
        try {
            persistedEvents.forEachOrdered(event -> {
                checkNotNull(event, "Cannot replay a null event");
                apply(event);
                version++;
            });
        } finally {
            isReplaying = false;
        }
        hasBeenReplayed = true;
        isNew = false;
        log.trace("[{}:{}] Replayed to version {}", getClass().getSimpleName(), identity, version);
        return (AGGREGATE_TYPE) this;
    }

    @Override
    public List<EVENT> flush() {
        var flushed = List.copyOf(_pendingEvents());
        pendingEvents = new ArrayList<>();
        isNew = false;
        return flushed;
    }

    /**
     * Assign the aggregate identity. Typically called when applying the aggregate's creation event.<br>
     * Assigning the identity already held is a no-op
     *
     * @param identity the identity
     * @throws IdentityAlreadyAssignedException if a different identity has already been assigned
     */
    protected void assignIdentity(String identity) {
        checkArgument(identity != null && !identity.isBlank(), "You must supply a non blank identity");
        if (this.identity == null) {
            this.identity = identity;
        } else if (!this.identity.equals(identity)) {
            throw new IdentityAlreadyAssignedException(getClass(), this.identity, identity);
        }
    }

    /**
     * Create the exception every {@link #apply(Event)} dispatch ends with for event variants it doesn't handle
     */
    protected final UnsupportedEventException unsupportedEvent(EVENT event) {
        return new UnsupportedEventException(event != null ? event.getClass() : null, getClass());
    }

    /**
     * Is the event being supplied to {@link #apply(Event)} a historic event
     */
    protected final boolean isReplaying() {
        return isReplaying;
    }

    @Override
    public String identity() {
        checkState(identity != null, "No identity has been assigned to Aggregate '%s'", getClass().getName());
        return identity;
    }

    @Override
    public boolean hasIdentity() {
        return identity != null;
    }

    @Override
    public long version() {
        return version;
    }

    @Override
    public List<EVENT> pendingEvents() {
        return List.copyOf(_pendingEvents());
    }

    @Override
    public boolean isNew() {
        return isNew;
    }

    @Override
    public boolean hasBeenReplayed() {
        return hasBeenReplayed;
    }

    /**
     * Since the aggregate instance MAY have been created using Objenesis (which doesn't
     * initialize fields nor call a constructor) the list is initialized lazily
     */
    private List<EVENT> _pendingEvents() {
        if (pendingEvents == null) {
            pendingEvents = new ArrayList<>();
        }
        return pendingEvents;
    }
}
