package dk.cloudcreate.bookstore.aggregates.command;

public class UnknownCommandException extends CommandException {
    public final Class<?> commandType;

    public UnknownCommandException(Class<?> commandType) {
        super("No CommandHandler registered for " + commandType.getName());
        this.commandType = commandType;
    }
}
