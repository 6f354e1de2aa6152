package dk.cloudcreate.bookstore.common.types;

import java.util.*;

/**
 * Globally unique id of a persisted event. Also used as causation id for events (and scheduled commands)
 * caused by another event
 */
public class EventId extends CharSequenceType<EventId> {
    public EventId(CharSequence value) {
        super(value);
    }

    public static EventId of(CharSequence value) {
        return new EventId(value);
    }

    public static EventId random() {
        return new EventId(UUID.randomUUID().toString());
    }

    public static Optional<EventId> optionalFrom(CharSequence value) {
        return value == null ? Optional.empty() : Optional.of(new EventId(value));
    }
}
