package dk.cloudcreate.bookstore.eventstore.types;

import dk.cloudcreate.bookstore.common.types.CharSequenceType;

/**
 * Identity of an event stream (one aggregate instance). A stream is always addressed together with the
 * {@link dk.cloudcreate.bookstore.common.types.TenantId} that owns it
 */
public class StreamId extends CharSequenceType<StreamId> {
    public StreamId(CharSequence value) {
        super(value);
    }

    public static StreamId of(CharSequence value) {
        return new StreamId(value);
    }
}
