package dk.cloudcreate.bookstore.eventstore.types;

import dk.cloudcreate.bookstore.common.types.CharSequenceType;

/**
 * The discriminating tag stored with each event, e.g. <code>BookAdded</code> or <code>BookAdded.v2</code>.<br>
 * The tag is decoupled from the Java class name, the mapping between the two is maintained by the
 * {@link dk.cloudcreate.bookstore.eventstore.EventTypeRegistry}
 */
public class EventType extends CharSequenceType<EventType> {
    public EventType(CharSequence value) {
        super(value);
    }

    public static EventType of(CharSequence value) {
        return new EventType(value);
    }
}
