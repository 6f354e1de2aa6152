package dk.cloudcreate.bookstore.eventstore.types;

import dk.cloudcreate.bookstore.common.types.LongType;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * The version of a stream is the number of events it contains. The first event appended to a stream gets version 1.<br>
 * Used both as the per-event sequence number within a stream and as the <i>expected version</i> of an append, where
 * {@link #NEW_STREAM} means the stream must not exist yet
 */
public class StreamVersion extends LongType<StreamVersion> {
    /**
     * Version of a stream without events. As expected version it demands creation of a new stream
     */
    public static final StreamVersion NEW_STREAM    = new StreamVersion(0L);
    public static final StreamVersion FIRST_VERSION = new StreamVersion(1L);

    public StreamVersion(Long value) {
        super(value);
        checkArgument(value >= 0, "StreamVersion must be 0 or larger, was %s", value);
    }

    public static StreamVersion of(long value) {
        return new StreamVersion(value);
    }

    public StreamVersion increment() {
        return new StreamVersion(value + 1);
    }

    public StreamVersion plus(long numberOfEvents) {
        return new StreamVersion(value + numberOfEvents);
    }

    public boolean isNewStream() {
        return value == 0L;
    }
}
