package dk.cloudcreate.bookstore.aggregates.command;

import dk.cloudcreate.bookstore.eventstore.types.StreamId;

/**
 * A request to change exactly one aggregate instance (stream)
 */
public interface Command {
    /**
     * @return the stream the command targets
     */
    StreamId streamId();
}
