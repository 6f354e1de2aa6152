package dk.cloudcreate.bookstore.aggregates;

import dk.cloudcreate.bookstore.common.types.TenantId;
import dk.cloudcreate.bookstore.eventstore.types.*;

import static com.google.common.base.Strings.lenientFormat;

/**
 * The persisted stream violates the gap free version sequence. Data integrity emergency, never retried
 */
public class StreamIntegrityException extends AggregateException {
    public final TenantId      tenantId;
    public final StreamId      streamId;
    public final StreamVersion expectedVersion;
    public final StreamVersion actualVersion;

    public StreamIntegrityException(TenantId tenantId, StreamId streamId, StreamVersion expectedVersion, StreamVersion actualVersion) {
        super(lenientFormat("[%s:%s] Stream has a version gap: expected version %s but found %s", tenantId, streamId, expectedVersion, actualVersion));
        this.tenantId = tenantId;
        this.streamId = streamId;
        this.expectedVersion = expectedVersion;
        this.actualVersion = actualVersion;
    }
}
