package dk.cloudcreate.bookstore.aggregates.command;

import dk.cloudcreate.bookstore.aggregates.ETag;
import dk.cloudcreate.bookstore.common.types.*;

import java.time.Duration;
import java.util.Optional;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A {@link Command} together with the metadata of the submission: tenant, optional <code>If-Match</code> ETag,
 * correlation and causation id
 */
public final class CommandEnvelope {
    public final TenantId           tenantId;
    public final Command            command;
    public final Optional<String>   ifMatch;
    public final boolean            etagRequired;
    public final CorrelationId      correlationId;
    public final Optional<EventId>  causationId;
    public final Optional<Duration> timeout;

    private CommandEnvelope(Builder builder) {
        this.tenantId = checkNotNull(builder.tenantId, "No tenantId provided");
        this.command = checkNotNull(builder.command, "No command provided");
        this.ifMatch = Optional.ofNullable(builder.ifMatch).map(String::trim).filter(value -> !value.isEmpty());
        this.etagRequired = builder.etagRequired;
        this.correlationId = builder.correlationId != null ? builder.correlationId : CorrelationId.random();
        this.causationId = Optional.ofNullable(builder.causationId);
        this.timeout = Optional.ofNullable(builder.timeout);
    }

    public static CommandEnvelope of(TenantId tenantId, Command command) {
        return builder(tenantId, command).build();
    }

    public static Builder builder(TenantId tenantId, Command command) {
        return new Builder(tenantId, command);
    }

    @Override
    public String toString() {
        return "CommandEnvelope{" +
                "tenantId=" + tenantId +
                ", command=" + command.getClass().getSimpleName() +
                ", streamId=" + command.streamId() +
                ", ifMatch=" + ifMatch +
                ", correlationId=" + correlationId +
                '}';
    }

    public static final class Builder {
        private final TenantId      tenantId;
        private final Command       command;
        private       String        ifMatch;
        private       boolean       etagRequired;
        private       CorrelationId correlationId;
        private       EventId       causationId;
        private       Duration      timeout;

        private Builder(TenantId tenantId, Command command) {
            this.tenantId = tenantId;
            this.command = command;
        }

        /**
         * @param ifMatch the raw <code>If-Match</code> value, may be <code>null</code>
         */
        public Builder ifMatch(String ifMatch) {
            this.ifMatch = ifMatch;
            return this;
        }

        public Builder ifMatch(ETag etag) {
            this.ifMatch = etag == null ? null : etag.toString();
            return this;
        }

        public Builder etagRequired(boolean etagRequired) {
            this.etagRequired = etagRequired;
            return this;
        }

        public Builder correlationId(CorrelationId correlationId) {
            this.correlationId = correlationId;
            return this;
        }

        public Builder causationId(EventId causationId) {
            this.causationId = causationId;
            return this;
        }

        /**
         * Overrides the default request timeout of the {@link CommandBus}
         */
        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public CommandEnvelope build() {
            return new CommandEnvelope(this);
        }
    }
}
