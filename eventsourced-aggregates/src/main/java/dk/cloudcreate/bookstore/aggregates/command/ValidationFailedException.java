package dk.cloudcreate.bookstore.aggregates.command;

import dk.cloudcreate.bookstore.common.types.TenantId;
import dk.cloudcreate.bookstore.eventstore.types.StreamId;

import static com.google.common.base.Strings.lenientFormat;

/**
 * A {@link CommandHandler} rejected the command. Never retried
 */
public class ValidationFailedException extends CommandException {
    public final TenantId          tenantId;
    public final StreamId          streamId;
    public final ValidationFailure failure;

    public ValidationFailedException(TenantId tenantId, StreamId streamId, ValidationFailure failure) {
        super(lenientFormat("[%s:%s] %s", tenantId, streamId, failure));
        this.tenantId = tenantId;
        this.streamId = streamId;
        this.failure = failure;
    }
}
