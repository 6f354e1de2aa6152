package dk.cloudcreate.bookstore.eventstore;

import dk.cloudcreate.bookstore.common.types.TenantId;
import dk.cloudcreate.bookstore.eventstore.types.*;

import java.util.List;

/**
 * Outcome of a successful {@link EventStore#append}
 */
public final class AppendResult {
    public final TenantId             tenantId;
    public final StreamId             streamId;
    public final StreamVersion        newVersion;
    public final List<PersistedEvent> persistedEvents;

    public AppendResult(TenantId tenantId, StreamId streamId, StreamVersion newVersion, List<PersistedEvent> persistedEvents) {
        this.tenantId = tenantId;
        this.streamId = streamId;
        this.newVersion = newVersion;
        this.persistedEvents = List.copyOf(persistedEvents);
    }
}
