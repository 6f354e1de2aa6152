package dk.cloudcreate.bookstore.eventstore;

import dk.cloudcreate.bookstore.eventstore.types.EventType;

/**
 * An event carries a type that isn't known where it is being consumed (schema drift).
 * Fatal on the rehydration path
 */
public class UnknownEventTypeException extends EventStoreException {
    public final String eventType;

    public UnknownEventTypeException(EventType eventType, String message) {
        super(message);
        this.eventType = eventType.toString();
    }

    public UnknownEventTypeException(String eventType, String message) {
        super(message);
        this.eventType = eventType;
    }
}
