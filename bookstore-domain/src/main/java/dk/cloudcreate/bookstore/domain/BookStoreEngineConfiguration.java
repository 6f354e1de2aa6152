package dk.cloudcreate.bookstore.domain;

import dk.cloudcreate.bookstore.aggregates.command.CommandBusConfiguration;
import dk.cloudcreate.bookstore.projection.ProjectionEngineConfiguration;
import dk.cloudcreate.bookstore.scheduler.CommandSchedulerConfiguration;

import java.time.Duration;

import static com.google.common.base.Preconditions.*;

public final class BookStoreEngineConfiguration {
    public static final BookStoreEngineConfiguration DEFAULT = builder().build();

    public final CommandBusConfiguration       commandBus;
    public final ProjectionEngineConfiguration projectionEngine;
    public final CommandSchedulerConfiguration commandScheduler;
    public final long                          cacheMaximumSize;
    /**
     * Upper bound for the time a query result stays cached, even when no invalidation arrives
     */
    public final Duration                      cacheMaximumTtl;
    public final Duration                      queryCacheTtl;
    /**
     * How long a tenant lookup is cached by the tenant registry
     */
    public final Duration                      tenantValidity;

    private BookStoreEngineConfiguration(Builder builder) {
        this.commandBus = checkNotNull(builder.commandBus, "No commandBus configuration provided");
        this.projectionEngine = checkNotNull(builder.projectionEngine, "No projectionEngine configuration provided");
        this.commandScheduler = checkNotNull(builder.commandScheduler, "No commandScheduler configuration provided");
        checkArgument(builder.cacheMaximumSize > 0, "cacheMaximumSize must be > 0");
        this.cacheMaximumSize = builder.cacheMaximumSize;
        this.cacheMaximumTtl = checkNotNull(builder.cacheMaximumTtl, "No cacheMaximumTtl provided");
        this.queryCacheTtl = checkNotNull(builder.queryCacheTtl, "No queryCacheTtl provided");
        checkArgument(queryCacheTtl.compareTo(cacheMaximumTtl) <= 0, "queryCacheTtl cannot exceed cacheMaximumTtl");
        this.tenantValidity = checkNotNull(builder.tenantValidity, "No tenantValidity provided");
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return "BookStoreEngineConfiguration{" +
                "commandBus=" + commandBus +
                ", projectionEngine=" + projectionEngine +
                ", commandScheduler=" + commandScheduler +
                ", cacheMaximumSize=" + cacheMaximumSize +
                ", cacheMaximumTtl=" + cacheMaximumTtl +
                ", queryCacheTtl=" + queryCacheTtl +
                ", tenantValidity=" + tenantValidity +
                '}';
    }

    public static final class Builder {
        private CommandBusConfiguration       commandBus       = CommandBusConfiguration.DEFAULT;
        private ProjectionEngineConfiguration projectionEngine = ProjectionEngineConfiguration.DEFAULT;
        private CommandSchedulerConfiguration commandScheduler = CommandSchedulerConfiguration.DEFAULT;
        private long                          cacheMaximumSize = 10_000;
        private Duration                      cacheMaximumTtl  = Duration.ofMinutes(10);
        private Duration                      queryCacheTtl    = Duration.ofMinutes(5);
        private Duration                      tenantValidity   = Duration.ofMinutes(5);

        public Builder commandBus(CommandBusConfiguration commandBus) {
            this.commandBus = commandBus;
            return this;
        }

        public Builder projectionEngine(ProjectionEngineConfiguration projectionEngine) {
            this.projectionEngine = projectionEngine;
            return this;
        }

        public Builder commandScheduler(CommandSchedulerConfiguration commandScheduler) {
            this.commandScheduler = commandScheduler;
            return this;
        }

        public Builder cacheMaximumSize(long cacheMaximumSize) {
            this.cacheMaximumSize = cacheMaximumSize;
            return this;
        }

        public Builder cacheMaximumTtl(Duration cacheMaximumTtl) {
            this.cacheMaximumTtl = cacheMaximumTtl;
            return this;
        }

        public Builder queryCacheTtl(Duration queryCacheTtl) {
            this.queryCacheTtl = queryCacheTtl;
            return this;
        }

        public Builder tenantValidity(Duration tenantValidity) {
            this.tenantValidity = tenantValidity;
            return this;
        }

        public BookStoreEngineConfiguration build() {
            return new BookStoreEngineConfiguration(this);
        }
    }
}
