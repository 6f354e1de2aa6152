package dk.cloudcreate.bookstore.eventstore.serializer.json;

import dk.cloudcreate.bookstore.eventstore.EventStoreException;

public class JSONDeserializationException extends EventStoreException {
    public JSONDeserializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
