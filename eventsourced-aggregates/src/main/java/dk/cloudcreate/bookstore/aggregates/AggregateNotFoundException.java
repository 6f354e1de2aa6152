package dk.cloudcreate.bookstore.aggregates;

import dk.cloudcreate.bookstore.common.types.TenantId;
import dk.cloudcreate.bookstore.eventstore.types.StreamId;

import static com.google.common.base.Strings.lenientFormat;

public class AggregateNotFoundException extends AggregateException {
    public final TenantId tenantId;
    public final StreamId streamId;
    public final String   aggregateName;

    public AggregateNotFoundException(TenantId tenantId, StreamId streamId, String aggregateName) {
        super(lenientFormat("[%s:%s] Didn't find a %s", tenantId, streamId, aggregateName));
        this.tenantId = tenantId;
        this.streamId = streamId;
        this.aggregateName = aggregateName;
    }
}
