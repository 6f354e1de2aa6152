package dk.cloudcreate.bookstore.eventstore.serializer.json;

import dk.cloudcreate.bookstore.eventstore.EventStoreException;

public class JSONSerializationException extends EventStoreException {
    public JSONSerializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
