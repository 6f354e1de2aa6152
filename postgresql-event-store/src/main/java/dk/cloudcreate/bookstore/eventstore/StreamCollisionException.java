package dk.cloudcreate.bookstore.eventstore;

import dk.cloudcreate.bookstore.common.types.TenantId;
import dk.cloudcreate.bookstore.eventstore.types.StreamId;

import static com.google.common.base.Strings.lenientFormat;

/**
 * An append with {@link dk.cloudcreate.bookstore.eventstore.types.StreamVersion#NEW_STREAM} targeted a stream that already exists.
 * Not retryable
 */
public class StreamCollisionException extends EventStoreException {
    public final TenantId tenantId;
    public final StreamId streamId;

    public StreamCollisionException(TenantId tenantId, StreamId streamId) {
        this(tenantId, streamId, null);
    }

    public StreamCollisionException(TenantId tenantId, StreamId streamId, Throwable cause) {
        super(lenientFormat("[%s:%s] Cannot create stream, a stream with this id already exists", tenantId, streamId), cause);
        this.tenantId = tenantId;
        this.streamId = streamId;
    }
}
