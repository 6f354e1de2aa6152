package dk.cloudcreate.bookstore.aggregates.command;

import dk.cloudcreate.bookstore.aggregates.AggregateException;

public class CommandException extends AggregateException {
    public CommandException(String message) {
        super(message);
    }

    public CommandException(String message, Throwable cause) {
        super(message, cause);
    }
}
