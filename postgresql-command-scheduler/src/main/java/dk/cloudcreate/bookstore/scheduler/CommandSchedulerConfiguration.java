package dk.cloudcreate.bookstore.scheduler;

import java.time.Duration;

import static com.google.common.base.Preconditions.*;

public final class CommandSchedulerConfiguration {
    public static final CommandSchedulerConfiguration DEFAULT = builder().build();

    public final Duration         pollingInterval;
    /**
     * Max number of due commands claimed per poll
     */
    public final int              batchSize;
    public final int              parallelDispatchers;
    /**
     * A claim older than this is considered abandoned (crashed dispatcher) and the command is dispatched again
     */
    public final Duration         claimTimeout;
    public final RedeliveryPolicy redeliveryPolicy;
    public final Duration         shutdownTimeout;

    private CommandSchedulerConfiguration(Duration pollingInterval,
                                          int batchSize,
                                          int parallelDispatchers,
                                          Duration claimTimeout,
                                          RedeliveryPolicy redeliveryPolicy,
                                          Duration shutdownTimeout) {
        this.pollingInterval = checkNotNull(pollingInterval, "No pollingInterval provided");
        checkArgument(!pollingInterval.isNegative() && !pollingInterval.isZero(), "pollingInterval must be positive");
        checkArgument(batchSize > 0, "batchSize must be > 0");
        checkArgument(parallelDispatchers > 0, "parallelDispatchers must be > 0");
        this.batchSize = batchSize;
        this.parallelDispatchers = parallelDispatchers;
        this.claimTimeout = checkNotNull(claimTimeout, "No claimTimeout provided");
        this.redeliveryPolicy = checkNotNull(redeliveryPolicy, "No redeliveryPolicy provided");
        this.shutdownTimeout = checkNotNull(shutdownTimeout, "No shutdownTimeout provided");
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return "CommandSchedulerConfiguration{" +
                "pollingInterval=" + pollingInterval +
                ", batchSize=" + batchSize +
                ", parallelDispatchers=" + parallelDispatchers +
                ", claimTimeout=" + claimTimeout +
                ", redeliveryPolicy=" + redeliveryPolicy +
                '}';
    }

    public static final class Builder {
        private Duration         pollingInterval     = Duration.ofMillis(500);
        private int              batchSize           = 50;
        private int              parallelDispatchers = 4;
        private Duration         claimTimeout        = Duration.ofMinutes(5);
        private RedeliveryPolicy redeliveryPolicy    = RedeliveryPolicy.exponentialBackoff(Duration.ofSeconds(1), 2.0d, Duration.ofMinutes(5), 5);
        private Duration         shutdownTimeout     = Duration.ofSeconds(10);

        public Builder pollingInterval(Duration pollingInterval) {
            this.pollingInterval = pollingInterval;
            return this;
        }

        public Builder batchSize(int batchSize) {
            this.batchSize = batchSize;
            return this;
        }

        public Builder parallelDispatchers(int parallelDispatchers) {
            this.parallelDispatchers = parallelDispatchers;
            return this;
        }

        public Builder claimTimeout(Duration claimTimeout) {
            this.claimTimeout = claimTimeout;
            return this;
        }

        public Builder redeliveryPolicy(RedeliveryPolicy redeliveryPolicy) {
            this.redeliveryPolicy = redeliveryPolicy;
            return this;
        }

        public Builder shutdownTimeout(Duration shutdownTimeout) {
            this.shutdownTimeout = shutdownTimeout;
            return this;
        }

        public CommandSchedulerConfiguration build() {
            return new CommandSchedulerConfiguration(pollingInterval, batchSize, parallelDispatchers, claimTimeout, redeliveryPolicy, shutdownTimeout);
        }
    }
}
