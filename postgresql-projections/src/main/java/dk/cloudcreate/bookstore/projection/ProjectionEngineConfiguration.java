package dk.cloudcreate.bookstore.projection;

import java.time.Duration;

import static com.google.common.base.Preconditions.*;

public final class ProjectionEngineConfiguration {
    public static final ProjectionEngineConfiguration DEFAULT = builder().build();

    /**
     * Max number of events read and committed per batch
     */
    public final int      batchSize;
    /**
     * Delay between polls of the event store. Committed event notifications trigger a poll immediately
     */
    public final Duration pollingInterval;
    /**
     * How long {@link ProjectionEngine#stop()} waits for in-flight batches
     */
    public final Duration shutdownTimeout;

    private ProjectionEngineConfiguration(int batchSize, Duration pollingInterval, Duration shutdownTimeout) {
        checkArgument(batchSize > 0, "batchSize must be > 0");
        this.batchSize = batchSize;
        this.pollingInterval = checkNotNull(pollingInterval, "No pollingInterval provided");
        checkArgument(!pollingInterval.isNegative() && !pollingInterval.isZero(), "pollingInterval must be positive");
        this.shutdownTimeout = checkNotNull(shutdownTimeout, "No shutdownTimeout provided");
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return "ProjectionEngineConfiguration{" +
                "batchSize=" + batchSize +
                ", pollingInterval=" + pollingInterval +
                ", shutdownTimeout=" + shutdownTimeout +
                '}';
    }

    public static final class Builder {
        private int      batchSize       = 500;
        private Duration pollingInterval = Duration.ofMillis(250);
        private Duration shutdownTimeout = Duration.ofSeconds(10);

        public Builder batchSize(int batchSize) {
            this.batchSize = batchSize;
            return this;
        }

        public Builder pollingInterval(Duration pollingInterval) {
            this.pollingInterval = pollingInterval;
            return this;
        }

        public Builder shutdownTimeout(Duration shutdownTimeout) {
            this.shutdownTimeout = shutdownTimeout;
            return this;
        }

        public ProjectionEngineConfiguration build() {
            return new ProjectionEngineConfiguration(batchSize, pollingInterval, shutdownTimeout);
        }
    }
}
