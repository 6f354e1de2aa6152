package dk.cloudcreate.bookstore.eventstore;

import dk.cloudcreate.bookstore.common.types.TenantId;
import dk.cloudcreate.bookstore.eventstore.types.*;
import reactor.core.publisher.Flux;

import java.util.List;

/**
 * Append-only, tenant partitioned store of event streams with optimistic concurrency control.<br>
 * The event store is the single source of truth; every other component derives its state from it.
 * <br>
 * Every persisted event gets a strictly increasing {@link GlobalEventOrder}. Within a tenant the global order is also the commit
 * order, which allows a consumer to use the highest {@link GlobalEventOrder} it has processed as a resume checkpoint.
 */
public interface EventStore {
    /**
     * Append events to a stream.<br>
     * The concurrency check and the append are atomic. If a unit of work is active the append joins it and the
     * events are published on {@link #committedEvents()} once the unit of work commits
     *
     * @param tenantId        the tenant owning the stream
     * @param streamId        the stream
     * @param expectedVersion the version the caller believes the stream has. {@link StreamVersion#NEW_STREAM} demands that the stream doesn't exist yet
     * @param events          the events to append (in order)
     * @return the result including the new stream version
     * @throws ConcurrencyConflictException if the stream isn't at <code>expectedVersion</code>
     * @throws StreamCollisionException     if <code>expectedVersion</code> is {@link StreamVersion#NEW_STREAM} and the stream already exists
     * @throws AppendToStreamException      on storage failures (nothing was appended)
     */
    AppendResult append(TenantId tenantId, StreamId streamId, StreamVersion expectedVersion, List<PersistableEvent> events);

    /**
     * @return all events of the stream ordered by version, or an empty list if the stream doesn't exist
     */
    List<PersistedEvent> readStream(TenantId tenantId, StreamId streamId);

    /**
     * @return the current version of the stream ({@link StreamVersion#NEW_STREAM} if it doesn't exist)
     */
    StreamVersion currentVersion(TenantId tenantId, StreamId streamId);

    /**
     * Read events across all streams and tenants in global order
     *
     * @param fromGlobalEventOrder the first global order to include
     * @param batchSize            max number of events to return
     */
    List<PersistedEvent> readAll(GlobalEventOrder fromGlobalEventOrder, int batchSize);

    /**
     * Read events across all streams of a single tenant in global order. This is the variant to use for checkpointed consumption
     *
     * @param tenantId             the tenant
     * @param fromGlobalEventOrder the first global order to include
     * @param batchSize            max number of events to return
     */
    List<PersistedEvent> readAll(TenantId tenantId, GlobalEventOrder fromGlobalEventOrder, int batchSize);

    /**
     * @return the highest committed {@link GlobalEventOrder} for the tenant ({@link GlobalEventOrder#NONE} if the tenant has no events)
     */
    GlobalEventOrder headPosition(TenantId tenantId);

    /**
     * Hot feed of events, published after the transaction that appended them has committed.
     * Delivery is best effort; consumers that need completeness must read using {@link #readAll(TenantId, GlobalEventOrder, int)}
     */
    Flux<PersistedEvent> committedEvents();

    EventTypeRegistry eventTypes();
}
