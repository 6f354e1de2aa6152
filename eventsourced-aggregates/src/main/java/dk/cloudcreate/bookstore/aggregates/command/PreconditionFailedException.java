package dk.cloudcreate.bookstore.aggregates.command;

import dk.cloudcreate.bookstore.common.types.TenantId;
import dk.cloudcreate.bookstore.eventstore.types.*;

import java.util.Optional;

import static com.google.common.base.Strings.lenientFormat;

/**
 * The ETag supplied by the caller doesn't match the current version of the stream (HTTP 412)
 */
@SuppressWarnings("OptionalUsedAsFieldOrParameterType")
public class PreconditionFailedException extends CommandException {
    public static final String USER_MESSAGE = "The resource has been modified since you last retrieved it. Please refresh and try again.";

    public final TenantId                tenantId;
    public final StreamId                streamId;
    public final String                  suppliedETag;
    public final Optional<StreamVersion> currentVersion;

    public PreconditionFailedException(TenantId tenantId, StreamId streamId, String suppliedETag, Optional<StreamVersion> currentVersion) {
        this(tenantId, streamId, suppliedETag, currentVersion, null);
    }

    public PreconditionFailedException(TenantId tenantId, StreamId streamId, String suppliedETag, Optional<StreamVersion> currentVersion, Throwable cause) {
        super(lenientFormat("[%s:%s] %s (If-Match %s, current version %s)",
                            tenantId, streamId, USER_MESSAGE, suppliedETag, currentVersion.map(StreamVersion::toString).orElse("<unknown>")),
              cause);
        this.tenantId = tenantId;
        this.streamId = streamId;
        this.suppliedETag = suppliedETag;
        this.currentVersion = currentVersion;
    }
}
