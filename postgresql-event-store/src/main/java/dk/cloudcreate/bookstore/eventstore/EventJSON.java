package dk.cloudcreate.bookstore.eventstore;

import dk.cloudcreate.bookstore.eventstore.serializer.json.JSONSerializer;
import dk.cloudcreate.bookstore.eventstore.types.EventType;

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Strings.lenientFormat;

/**
 * The serialized payload of a persisted event. Deserialization is lazy and the result is cached
 */
public final class EventJSON {
    private final EventTypeRegistry eventTypeRegistry;
    private final JSONSerializer    jsonSerializer;
    private final EventType         eventType;
    private final String            json;
    private volatile Object         deserialized;

    public EventJSON(EventTypeRegistry eventTypeRegistry, JSONSerializer jsonSerializer, EventType eventType, String json) {
        this.eventTypeRegistry = checkNotNull(eventTypeRegistry, "No eventTypeRegistry provided");
        this.jsonSerializer = checkNotNull(jsonSerializer, "No jsonSerializer provided");
        this.eventType = checkNotNull(eventType, "No eventType provided");
        this.json = checkNotNull(json, "No json provided");
    }

    public EventType eventType() {
        return eventType;
    }

    public String json() {
        return json;
    }

    public boolean isKnownEventType() {
        return eventTypeRegistry.isRegistered(eventType);
    }

    /**
     * @return the deserialized payload
     * @throws UnknownEventTypeException if the {@link EventType} isn't registered in the {@link EventTypeRegistry}
     */
    public Object deserialize() {
        var result = deserialized;
        if (result == null) {
            var javaType = eventTypeRegistry.javaTypeOf(eventType)
                                            .orElseThrow(() -> new UnknownEventTypeException(eventType,
                                                                                             lenientFormat("EventType '%s' isn't registered", eventType)));
            result = jsonSerializer.deserialize(json, javaType);
            deserialized = result;
        }
        return result;
    }

    @Override
    public String toString() {
        return eventType + ":" + json;
    }
}
