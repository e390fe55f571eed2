package dev.eventsourced.components.eventsourced.eventstore.publisher;

import java.time.Duration;

import static com.google.common.base.Preconditions.*;

/**
 * Determines how often, and with which delays, an {@link AsyncEventPublisher} retries a failed delivery before the
 * events are handed to the {@link DeadLetterHandler}
 */
public class PublishRedeliveryPolicy {
    public final Duration initialRedeliveryDelay;
    public final Duration followupRedeliveryDelay;
    public final double   followupRedeliveryDelayMultiplier;
    /**
     * Added once per redelivery attempt on top of the (multiplied) followup delay
     */
    public final Duration followupRedeliveryDelayIncrement;
    public final Duration maximumFollowupRedeliveryThreshold;
    public final int      maximumNumberOfRedeliveries;

    public PublishRedeliveryPolicy(Duration initialRedeliveryDelay,
                                   Duration followupRedeliveryDelay,
                                   double followupRedeliveryDelayMultiplier,
                                   Duration maximumFollowupRedeliveryDelayThreshold,
                                   int maximumNumberOfRedeliveries) {
        this(initialRedeliveryDelay,
             followupRedeliveryDelay,
             followupRedeliveryDelayMultiplier,
             Duration.ZERO,
             maximumFollowupRedeliveryDelayThreshold,
             maximumNumberOfRedeliveries);
    }

    public PublishRedeliveryPolicy(Duration initialRedeliveryDelay,
                                   Duration followupRedeliveryDelay,
                                   double followupRedeliveryDelayMultiplier,
                                   Duration followupRedeliveryDelayIncrement,
                                   Duration maximumFollowupRedeliveryDelayThreshold,
                                   int maximumNumberOfRedeliveries) {
        this.initialRedeliveryDelay = checkNotNull(initialRedeliveryDelay, "You must specify an initialRedeliveryDelay");
        this.followupRedeliveryDelay = checkNotNull(followupRedeliveryDelay, "You must specify a followupRedeliveryDelay");
        this.maximumFollowupRedeliveryThreshold = checkNotNull(maximumFollowupRedeliveryDelayThreshold, "You must specify a maximumFollowupRedeliveryDelayThreshold");
        this.followupRedeliveryDelayIncrement = checkNotNull(followupRedeliveryDelayIncrement, "You must specify a followupRedeliveryDelayIncrement");
        checkArgument(!followupRedeliveryDelayIncrement.isNegative(), "followupRedeliveryDelayIncrement must be 0 or larger");
        checkArgument(followupRedeliveryDelayMultiplier >= 1.0d, "followupRedeliveryDelayMultiplier must be 1.0 or larger");
        checkArgument(maximumNumberOfRedeliveries >= 0, "maximumNumberOfRedeliveries must be 0 or larger");
        this.followupRedeliveryDelayMultiplier = followupRedeliveryDelayMultiplier;
        this.maximumNumberOfRedeliveries = maximumNumberOfRedeliveries;
    }

    /**
     * Calculate the delay before the next redelivery
     *
     * @param currentNumberOfRedeliveryAttempts the number of redeliveries already performed
     * @return the delay, never above {@link #maximumFollowupRedeliveryThreshold}
     */
    public Duration calculateNextRedeliveryDelay(int currentNumberOfRedeliveryAttempts) {
        checkArgument(currentNumberOfRedeliveryAttempts >= 0, "currentNumberOfRedeliveryAttempts must be 0 or larger");
        if (currentNumberOfRedeliveryAttempts == 0) {
            return initialRedeliveryDelay;
        }
        var factor                    = Math.pow(followupRedeliveryDelayMultiplier, currentNumberOfRedeliveryAttempts - 1);
        var calculatedRedeliveryDelay = Duration.ofMillis((long) (followupRedeliveryDelay.toMillis() * factor))
                                                .plus(followupRedeliveryDelayIncrement.multipliedBy(currentNumberOfRedeliveryAttempts));
        if (calculatedRedeliveryDelay.compareTo(maximumFollowupRedeliveryThreshold) >= 0) {
            return maximumFollowupRedeliveryThreshold;
        } else {
            return calculatedRedeliveryDelay;
        }
    }

    /**
     * A policy that never redelivers: the first failure sends the events to the {@link DeadLetterHandler}
     */
    public static PublishRedeliveryPolicy noRedelivery() {
        return fixedBackoff(Duration.ZERO, 0);
    }

    public static PublishRedeliveryPolicy fixedBackoff(Duration redeliveryDelay,
                                                       int maximumNumberOfRedeliveries) {
        return new PublishRedeliveryPolicy(redeliveryDelay,
                                           redeliveryDelay,
                                           1.0d,
                                           redeliveryDelay,
                                           maximumNumberOfRedeliveries);
    }

    /**
     * Redeliver after <code>redeliveryDelay</code>, <code>2 * redeliveryDelay</code>, <code>3 * redeliveryDelay</code>, ...
     * capped by <code>maximumFollowupRedeliveryDelayThreshold</code>
     */
    public static PublishRedeliveryPolicy linearBackoff(Duration redeliveryDelay,
                                                        Duration maximumFollowupRedeliveryDelayThreshold,
                                                        int maximumNumberOfRedeliveries) {
        return new PublishRedeliveryPolicy(redeliveryDelay,
                                           redeliveryDelay,
                                           1.0d,
                                           redeliveryDelay,
                                           maximumFollowupRedeliveryDelayThreshold,
                                           maximumNumberOfRedeliveries);
    }

    public static PublishRedeliveryPolicy exponentialBackoff(Duration initialRedeliveryDelay,
                                                             Duration followupRedeliveryDelay,
                                                             double followupRedeliveryDelayMultiplier,
                                                             Duration maximumFollowupRedeliveryDelayThreshold,
                                                             int maximumNumberOfRedeliveries) {
        return new PublishRedeliveryPolicy(initialRedeliveryDelay,
                                           followupRedeliveryDelay,
                                           followupRedeliveryDelayMultiplier,
                                           maximumFollowupRedeliveryDelayThreshold,
                                           maximumNumberOfRedeliveries);
    }

    @Override
    public String toString() {
        return "PublishRedeliveryPolicy{" +
                "initialRedeliveryDelay=" + initialRedeliveryDelay +
                ", followupRedeliveryDelay=" + followupRedeliveryDelay +
                ", followupRedeliveryDelayMultiplier=" + followupRedeliveryDelayMultiplier +
                ", followupRedeliveryDelayIncrement=" + followupRedeliveryDelayIncrement +
                ", maximumFollowupRedeliveryThreshold=" + maximumFollowupRedeliveryThreshold +
                ", maximumNumberOfRedeliveries=" + maximumNumberOfRedeliveries +
                '}';
    }
}
