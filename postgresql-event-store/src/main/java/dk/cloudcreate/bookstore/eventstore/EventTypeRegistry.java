package dk.cloudcreate.bookstore.eventstore;

import com.google.common.collect.*;
import dk.cloudcreate.bookstore.eventstore.types.EventType;

import java.util.*;

import static com.google.common.base.Preconditions.*;
import static com.google.common.base.Strings.lenientFormat;

/**
 * Explicit, bidirectional mapping between the {@link EventType} tag persisted with an event and the Java class of its payload.<br>
 * Registration happens once at startup (in the composition root). Reading an event whose tag isn't registered fails with an
 * {@link UnknownEventTypeException}
 */
public class EventTypeRegistry {
    private final BiMap<EventType, Class<?>> eventTypes = Maps.synchronizedBiMap(HashBiMap.create());

    /**
     * Register the event type using the simple class name as tag
     */
    public EventTypeRegistry register(Class<?> javaType) {
        checkNotNull(javaType, "No javaType provided");
        return register(EventType.of(javaType.getSimpleName()), javaType);
    }

    public EventTypeRegistry register(EventType eventType, Class<?> javaType) {
        checkNotNull(eventType, "No eventType provided");
        checkNotNull(javaType, "No javaType provided");
        synchronized (eventTypes) {
            var existingJavaType = eventTypes.get(eventType);
            checkArgument(existingJavaType == null || existingJavaType.equals(javaType),
                          "EventType '%s' is already registered for %s", eventType, existingJavaType);
            var existingEventType = eventTypes.inverse().get(javaType);
            checkArgument(existingEventType == null || existingEventType.equals(eventType),
                          "%s is already registered as EventType '%s'", javaType.getName(), existingEventType);
            eventTypes.put(eventType, javaType);
        }
        return this;
    }

    public EventTypeRegistry registerAll(Collection<Class<?>> javaTypes) {
        checkNotNull(javaTypes, "No javaTypes provided").forEach(this::register);
        return this;
    }

    /**
     * @throws UnknownEventTypeException if the Java type hasn't been registered
     */
    public EventType eventTypeOf(Class<?> javaType) {
        checkNotNull(javaType, "No javaType provided");
        var eventType = eventTypes.inverse().get(javaType);
        if (eventType == null) {
            throw new UnknownEventTypeException(javaType.getName(),
                                                lenientFormat("%s hasn't been registered as an event type", javaType.getName()));
        }
        return eventType;
    }

    public Optional<Class<?>> javaTypeOf(EventType eventType) {
        checkNotNull(eventType, "No eventType provided");
        return Optional.ofNullable(eventTypes.get(eventType));
    }

    public boolean isRegistered(EventType eventType) {
        return eventTypes.containsKey(eventType);
    }

    public Set<EventType> registeredEventTypes() {
        synchronized (eventTypes) {
            return ImmutableSet.copyOf(eventTypes.keySet());
        }
    }
}
