package dk.cloudcreate.bookstore.aggregates.command;

import dk.cloudcreate.bookstore.common.types.TenantId;
import dk.cloudcreate.bookstore.eventstore.types.StreamId;

import static com.google.common.base.Strings.lenientFormat;

/**
 * The boundary requires an ETag for the mutating command, but none was supplied (HTTP 428)
 */
public class PreconditionRequiredException extends CommandException {
    public final TenantId tenantId;
    public final StreamId streamId;

    public PreconditionRequiredException(TenantId tenantId, StreamId streamId) {
        super(lenientFormat("[%s:%s] An If-Match ETag is required to modify this resource", tenantId, streamId));
        this.tenantId = tenantId;
        this.streamId = streamId;
    }
}
