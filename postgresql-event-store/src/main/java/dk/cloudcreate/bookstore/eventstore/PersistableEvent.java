package dk.cloudcreate.bookstore.eventstore;

import dk.cloudcreate.bookstore.common.types.*;
import dk.cloudcreate.bookstore.eventstore.types.EventType;

import java.util.Optional;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * An event that is about to be appended to a stream, together with its correlation/causation information.<br>
 * Tenant, stream, version, global order and timestamp are assigned by the {@link EventStore} during the append.<br>
 * The {@link EventType} is normally resolved through the {@link EventTypeRegistry}; it can be supplied explicitly, which is
 * how events of types unknown to this process (e.g. written by a newer version) end up in a stream
 */
@SuppressWarnings("OptionalUsedAsFieldOrParameterType")
public final class PersistableEvent {
    private final EventId                 eventId;
    private final Object                  event;
    private final Optional<EventType>     eventType;
    private final Optional<CorrelationId> correlationId;
    private final Optional<EventId>       causationId;

    private PersistableEvent(EventId eventId, Object event, Optional<EventType> eventType, Optional<CorrelationId> correlationId, Optional<EventId> causationId) {
        this.eventId = checkNotNull(eventId, "No eventId provided");
        this.event = checkNotNull(event, "No event provided");
        this.eventType = checkNotNull(eventType, "No eventType option provided");
        this.correlationId = checkNotNull(correlationId, "No correlationId option provided");
        this.causationId = checkNotNull(causationId, "No causationId option provided");
    }

    public static PersistableEvent of(Object event) {
        return new PersistableEvent(EventId.random(), event, Optional.empty(), Optional.empty(), Optional.empty());
    }

    public static PersistableEvent of(Object event, CorrelationId correlationId, Optional<EventId> causationId) {
        return new PersistableEvent(EventId.random(), event, Optional.empty(), Optional.of(correlationId), causationId);
    }

    /**
     * Create a {@link PersistableEvent} with an explicit {@link EventType} that bypasses the {@link EventTypeRegistry}
     */
    public static PersistableEvent ofType(EventType eventType, Object event) {
        return new PersistableEvent(EventId.random(), event, Optional.of(eventType), Optional.empty(), Optional.empty());
    }

    public EventId eventId() {
        return eventId;
    }

    public Object event() {
        return event;
    }

    public Optional<EventType> eventType() {
        return eventType;
    }

    public Optional<CorrelationId> correlationId() {
        return correlationId;
    }

    public Optional<EventId> causationId() {
        return causationId;
    }

    @Override
    public String toString() {
        return "PersistableEvent{" +
                "eventId=" + eventId +
                ", event=" + event.getClass().getSimpleName() +
                ", correlationId=" + correlationId.orElse(null) +
                ", causationId=" + causationId.orElse(null) +
                '}';
    }
}
