package dk.cloudcreate.bookstore.aggregates.command;

import dk.cloudcreate.bookstore.aggregates.*;
import dk.cloudcreate.bookstore.common.tenant.TenantException;
import dk.cloudcreate.bookstore.eventstore.*;

/**
 * Translation of command submission failures to HTTP semantics for the boundary that hosts the engine
 */
public final class CommandFailures {
    private CommandFailures() {
    }

    public static int httpStatusOf(Throwable failure) {
        if (failure instanceof PreconditionFailedException || failure instanceof ConcurrencyConflictException) {
            return 412;
        }
        if (failure instanceof PreconditionRequiredException) {
            return 428;
        }
        if (failure instanceof ValidationFailedException) {
            switch (((ValidationFailedException) failure).failure.kind) {
                case NOT_FOUND:
                    return 404;
                case CONFLICT:
                    return 409;
                default:
                    return 400;
            }
        }
        if (failure instanceof AggregateNotFoundException) {
            return 404;
        }
        if (failure instanceof StreamCollisionException) {
            return 409;
        }
        if (failure instanceof TenantException) {
            return 400;
        }
        if (failure instanceof CommandTimeoutException) {
            return 503;
        }
        return 500;
    }

    /**
     * @return the message that may be shown to the end user
     */
    public static String userMessageOf(Throwable failure) {
        if (failure instanceof PreconditionFailedException || failure instanceof ConcurrencyConflictException) {
            return PreconditionFailedException.USER_MESSAGE;
        }
        if (failure instanceof ValidationFailedException) {
            return ((ValidationFailedException) failure).failure.message;
        }
        if (httpStatusOf(failure) == 500) {
            return "An unexpected error occurred";
        }
        return failure.getMessage();
    }

    /**
     * Concurrency conflicts and storage level append failures may succeed when retried
     */
    public static boolean isRetryable(Throwable failure) {
        return failure instanceof ConcurrencyConflictException
                || failure instanceof AppendToStreamException
                || failure instanceof CommandTimeoutException;
    }
}
