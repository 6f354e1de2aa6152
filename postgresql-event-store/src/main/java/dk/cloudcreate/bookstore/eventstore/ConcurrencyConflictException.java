package dk.cloudcreate.bookstore.eventstore;

import dk.cloudcreate.bookstore.common.types.TenantId;
import dk.cloudcreate.bookstore.eventstore.types.*;

import java.util.Optional;

import static com.google.common.base.Strings.lenientFormat;

/**
 * The expected version supplied to {@link EventStore#append} didn't match the current version of the stream.
 * Retryable: re-read the stream and re-apply the command
 */
@SuppressWarnings("OptionalUsedAsFieldOrParameterType")
public class ConcurrencyConflictException extends EventStoreException {
    public final TenantId                tenantId;
    public final StreamId                streamId;
    public final StreamVersion           expectedVersion;
    /**
     * The actual stream version if it was known at the time of the conflict
     */
    public final Optional<StreamVersion> actualVersion;

    public ConcurrencyConflictException(TenantId tenantId, StreamId streamId, StreamVersion expectedVersion, Optional<StreamVersion> actualVersion) {
        this(tenantId, streamId, expectedVersion, actualVersion, null);
    }

    public ConcurrencyConflictException(TenantId tenantId, StreamId streamId, StreamVersion expectedVersion, Optional<StreamVersion> actualVersion, Throwable cause) {
        super(lenientFormat("[%s:%s] Concurrency conflict: expected stream version %s but the stream is at version %s",
                            tenantId,
                            streamId,
                            expectedVersion,
                            actualVersion.map(StreamVersion::toString).orElse("<unknown>")),
              cause);
        this.tenantId = tenantId;
        this.streamId = streamId;
        this.expectedVersion = expectedVersion;
        this.actualVersion = actualVersion;
    }
}
