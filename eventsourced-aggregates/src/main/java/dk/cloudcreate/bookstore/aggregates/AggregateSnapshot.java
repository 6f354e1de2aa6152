package dk.cloudcreate.bookstore.aggregates;

import dk.cloudcreate.bookstore.common.types.TenantId;
import dk.cloudcreate.bookstore.eventstore.types.*;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * The rehydrated state of one aggregate together with the stream version it reflects
 *
 * @param <STATE> the aggregate state type
 */
public final class AggregateSnapshot<STATE> {
    public final TenantId      tenantId;
    public final StreamId      streamId;
    public final STATE         state;
    public final StreamVersion version;

    public AggregateSnapshot(TenantId tenantId, StreamId streamId, STATE state, StreamVersion version) {
        this.tenantId = checkNotNull(tenantId, "No tenantId provided");
        this.streamId = checkNotNull(streamId, "No streamId provided");
        this.state = checkNotNull(state, "No state provided");
        this.version = checkNotNull(version, "No version provided");
    }

    public ETag etag() {
        return ETag.of(version);
    }

    @Override
    public String toString() {
        return "AggregateSnapshot{" +
                "tenantId=" + tenantId +
                ", streamId=" + streamId +
                ", version=" + version +
                ", state=" + state +
                '}';
    }
}
