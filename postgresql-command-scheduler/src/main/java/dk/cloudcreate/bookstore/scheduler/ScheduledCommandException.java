package dk.cloudcreate.bookstore.scheduler;

public class ScheduledCommandException extends RuntimeException {
    public ScheduledCommandException(String message) {
        super(message);
    }

    public ScheduledCommandException(String message, Throwable cause) {
        super(message, cause);
    }
}
