package dk.cloudcreate.bookstore.aggregates.command;

import java.time.Duration;

/**
 * The request scoped deadline passed before the events were appended. Nothing was appended, so the command is safe to retry
 */
public class CommandTimeoutException extends CommandException {
    public final String   commandType;
    public final Duration timeout;

    public CommandTimeoutException(String commandType, Duration timeout) {
        super("Command " + commandType + " didn't complete within " + timeout);
        this.commandType = commandType;
        this.timeout = timeout;
    }
}
