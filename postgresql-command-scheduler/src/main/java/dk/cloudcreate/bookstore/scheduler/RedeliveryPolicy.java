package dk.cloudcreate.bookstore.scheduler;

import java.time.Duration;

import static com.google.common.base.Preconditions.*;

/**
 * Delay before a scheduled command whose dispatch failed transiently is dispatched again
 */
public final class RedeliveryPolicy {
    public enum Backoff {
        FIXED,
        LINEAR,
        EXPONENTIAL
    }

    public final Backoff  backoff;
    public final Duration initialRedeliveryDelay;
    /**
     * Added per redelivery for {@link Backoff#LINEAR}
     */
    public final Duration followupRedeliveryDelay;
    /**
     * Multiplied per redelivery for {@link Backoff#EXPONENTIAL}
     */
    public final double   followupRedeliveryDelayMultiplier;
    public final Duration maximumRedeliveryDelay;
    public final int      maximumNumberOfRedeliveries;

    private RedeliveryPolicy(Backoff backoff,
                             Duration initialRedeliveryDelay,
                             Duration followupRedeliveryDelay,
                             double followupRedeliveryDelayMultiplier,
                             Duration maximumRedeliveryDelay,
                             int maximumNumberOfRedeliveries) {
        this.backoff = checkNotNull(backoff, "No backoff provided");
        this.initialRedeliveryDelay = checkNotNull(initialRedeliveryDelay, "No initialRedeliveryDelay provided");
        this.followupRedeliveryDelay = checkNotNull(followupRedeliveryDelay, "No followupRedeliveryDelay provided");
        this.maximumRedeliveryDelay = checkNotNull(maximumRedeliveryDelay, "No maximumRedeliveryDelay provided");
        checkArgument(followupRedeliveryDelayMultiplier >= 1.0d, "followupRedeliveryDelayMultiplier must be >= 1.0");
        checkArgument(maximumNumberOfRedeliveries >= 0, "maximumNumberOfRedeliveries must be >= 0");
        checkArgument(maximumRedeliveryDelay.compareTo(initialRedeliveryDelay) >= 0, "maximumRedeliveryDelay must be >= initialRedeliveryDelay");
        this.followupRedeliveryDelayMultiplier = followupRedeliveryDelayMultiplier;
        this.maximumNumberOfRedeliveries = maximumNumberOfRedeliveries;
    }

    public static RedeliveryPolicy fixedBackoff(Duration redeliveryDelay, int maximumNumberOfRedeliveries) {
        return new RedeliveryPolicy(Backoff.FIXED, redeliveryDelay, Duration.ZERO, 1.0d, redeliveryDelay, maximumNumberOfRedeliveries);
    }

    public static RedeliveryPolicy linearBackoff(Duration redeliveryDelay, Duration maximumRedeliveryDelay, int maximumNumberOfRedeliveries) {
        return new RedeliveryPolicy(Backoff.LINEAR, redeliveryDelay, redeliveryDelay, 1.0d, maximumRedeliveryDelay, maximumNumberOfRedeliveries);
    }

    public static RedeliveryPolicy exponentialBackoff(Duration initialRedeliveryDelay,
                                                      double followupRedeliveryDelayMultiplier,
                                                      Duration maximumRedeliveryDelay,
                                                      int maximumNumberOfRedeliveries) {
        return new RedeliveryPolicy(Backoff.EXPONENTIAL, initialRedeliveryDelay, Duration.ZERO, followupRedeliveryDelayMultiplier, maximumRedeliveryDelay, maximumNumberOfRedeliveries);
    }

    /**
     * @param redeliveryAttempts number of redeliveries that already happened (0 for the first redelivery)
     */
    public Duration calculateNextRedeliveryDelay(int redeliveryAttempts) {
        checkArgument(redeliveryAttempts >= 0, "redeliveryAttempts must be 0 or larger");
        Duration delay;
        switch (backoff) {
            case LINEAR:
                delay = initialRedeliveryDelay.plus(followupRedeliveryDelay.multipliedBy(redeliveryAttempts));
                break;
            case EXPONENTIAL:
                var millis = initialRedeliveryDelay.toMillis() * Math.pow(followupRedeliveryDelayMultiplier, redeliveryAttempts);
                delay = millis >= maximumRedeliveryDelay.toMillis() ? maximumRedeliveryDelay : Duration.ofMillis((long) millis);
                break;
            default:
                delay = initialRedeliveryDelay;
        }
        return delay.compareTo(maximumRedeliveryDelay) >= 0 ? maximumRedeliveryDelay : delay;
    }

    /**
     * @param dispatchAttempts number of dispatches made so far, including the one that just failed
     */
    public boolean isExhausted(int dispatchAttempts) {
        return dispatchAttempts >= maximumNumberOfRedeliveries + 1;
    }

    @Override
    public String toString() {
        return "RedeliveryPolicy{" +
                backoff +
                ", initialRedeliveryDelay=" + initialRedeliveryDelay +
                (backoff == Backoff.LINEAR ? ", followupRedeliveryDelay=" + followupRedeliveryDelay : "") +
                (backoff == Backoff.EXPONENTIAL ? ", multiplier=" + followupRedeliveryDelayMultiplier : "") +
                ", maximumRedeliveryDelay=" + maximumRedeliveryDelay +
                ", maximumNumberOfRedeliveries=" + maximumNumberOfRedeliveries +
                '}';
    }
}
