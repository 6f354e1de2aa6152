package dk.cloudcreate.bookstore.eventstore;

/**
 * Storage level failure while appending, e.g. a lost connection. Nothing was appended and the append may be retried
 */
public class AppendToStreamException extends EventStoreException {
    public AppendToStreamException(String message, Throwable cause) {
        super(message, cause);
    }
}
