package dk.cloudcreate.bookstore.eventstore;

import dk.cloudcreate.bookstore.common.types.*;
import dk.cloudcreate.bookstore.eventstore.types.*;

import java.time.OffsetDateTime;
import java.util.Optional;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * An immutable event as stored in the {@link EventStore}
 */
@SuppressWarnings("OptionalUsedAsFieldOrParameterType")
public final class PersistedEvent {
    private final EventId                 eventId;
    private final TenantId                tenantId;
    private final StreamId                streamId;
    private final StreamVersion           version;
    private final GlobalEventOrder        globalEventOrder;
    private final EventJSON               eventJSON;
    private final Optional<CorrelationId> correlationId;
    private final Optional<EventId>       causationId;
    private final OffsetDateTime          timestamp;

    public PersistedEvent(EventId eventId,
                          TenantId tenantId,
                          StreamId streamId,
                          StreamVersion version,
                          GlobalEventOrder globalEventOrder,
                          EventJSON eventJSON,
                          Optional<CorrelationId> correlationId,
                          Optional<EventId> causationId,
                          OffsetDateTime timestamp) {
        this.eventId = checkNotNull(eventId, "No eventId provided");
        this.tenantId = checkNotNull(tenantId, "No tenantId provided");
        this.streamId = checkNotNull(streamId, "No streamId provided");
        this.version = checkNotNull(version, "No version provided");
        this.globalEventOrder = checkNotNull(globalEventOrder, "No globalEventOrder provided");
        this.eventJSON = checkNotNull(eventJSON, "No eventJSON provided");
        this.correlationId = checkNotNull(correlationId, "No correlationId option provided");
        this.causationId = checkNotNull(causationId, "No causationId option provided");
        this.timestamp = checkNotNull(timestamp, "No timestamp provided");
    }

    public EventId eventId() {
        return eventId;
    }

    public TenantId tenantId() {
        return tenantId;
    }

    public StreamId streamId() {
        return streamId;
    }

    /**
     * The 1-based position of the event within its stream
     */
    public StreamVersion version() {
        return version;
    }

    public GlobalEventOrder globalEventOrder() {
        return globalEventOrder;
    }

    public EventType eventType() {
        return eventJSON.eventType();
    }

    public EventJSON eventJSON() {
        return eventJSON;
    }

    /**
     * @return the deserialized event payload
     * @throws UnknownEventTypeException if the event type isn't registered in this process
     */
    public Object event() {
        return eventJSON.deserialize();
    }

    public Optional<CorrelationId> correlationId() {
        return correlationId;
    }

    public Optional<EventId> causationId() {
        return causationId;
    }

    public OffsetDateTime timestamp() {
        return timestamp;
    }

    @Override
    public String toString() {
        return "PersistedEvent{" +
                "tenantId=" + tenantId +
                ", streamId=" + streamId +
                ", version=" + version +
                ", globalEventOrder=" + globalEventOrder +
                ", eventType=" + eventType() +
                ", eventId=" + eventId +
                '}';
    }
}
