package dk.cloudcreate.bookstore.aggregates.command;

import java.time.Duration;

import static com.google.common.base.Preconditions.*;

public final class CommandBusConfiguration {
    public static final CommandBusConfiguration DEFAULT = builder().build();

    /**
     * How many times a command without an ETag is re-executed against freshly read state after a concurrency conflict
     */
    public final int      maxConflictRetries;
    /**
     * How many times a transient storage error is retried
     */
    public final int      maxTransientRetries;
    /**
     * Backoff before the first transient retry; doubled for every subsequent retry
     */
    public final Duration transientRetryBackoff;
    public final Duration requestTimeout;
    /**
     * Default for commands targeting an existing stream when the envelope doesn't demand an ETag itself
     */
    public final boolean  etagRequired;

    private CommandBusConfiguration(Builder builder) {
        checkArgument(builder.maxConflictRetries >= 0, "maxConflictRetries must be >= 0");
        checkArgument(builder.maxTransientRetries >= 0, "maxTransientRetries must be >= 0");
        this.maxConflictRetries = builder.maxConflictRetries;
        this.maxTransientRetries = builder.maxTransientRetries;
        this.transientRetryBackoff = checkNotNull(builder.transientRetryBackoff, "No transientRetryBackoff provided");
        this.requestTimeout = checkNotNull(builder.requestTimeout, "No requestTimeout provided");
        checkArgument(!requestTimeout.isNegative() && !requestTimeout.isZero(), "requestTimeout must be positive");
        this.etagRequired = builder.etagRequired;
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return "CommandBusConfiguration{" +
                "maxConflictRetries=" + maxConflictRetries +
                ", maxTransientRetries=" + maxTransientRetries +
                ", transientRetryBackoff=" + transientRetryBackoff +
                ", requestTimeout=" + requestTimeout +
                ", etagRequired=" + etagRequired +
                '}';
    }

    public static final class Builder {
        private int      maxConflictRetries    = 3;
        private int      maxTransientRetries   = 3;
        private Duration transientRetryBackoff = Duration.ofMillis(50);
        private Duration requestTimeout        = Duration.ofSeconds(30);
        private boolean  etagRequired          = false;

        public Builder maxConflictRetries(int maxConflictRetries) {
            this.maxConflictRetries = maxConflictRetries;
            return this;
        }

        public Builder maxTransientRetries(int maxTransientRetries) {
            this.maxTransientRetries = maxTransientRetries;
            return this;
        }

        public Builder transientRetryBackoff(Duration transientRetryBackoff) {
            this.transientRetryBackoff = transientRetryBackoff;
            return this;
        }

        public Builder requestTimeout(Duration requestTimeout) {
            this.requestTimeout = requestTimeout;
            return this;
        }

        public Builder etagRequired(boolean etagRequired) {
            this.etagRequired = etagRequired;
            return this;
        }

        public CommandBusConfiguration build() {
            return new CommandBusConfiguration(this);
        }
    }
}
