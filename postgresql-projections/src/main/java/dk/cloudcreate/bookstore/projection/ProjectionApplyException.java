package dk.cloudcreate.bookstore.projection;

import dk.cloudcreate.bookstore.common.types.TenantId;
import dk.cloudcreate.bookstore.eventstore.PersistedEvent;
import dk.cloudcreate.bookstore.eventstore.types.*;

import static com.google.common.base.Strings.lenientFormat;

/**
 * A single event failed to apply to a projection. The projection halts for the tenant and its checkpoint
 * stays at the last event that applied successfully
 */
public class ProjectionApplyException extends ProjectionException {
    public final ProjectionName   projectionName;
    public final TenantId         tenantId;
    public final GlobalEventOrder globalEventOrder;
    public final EventType        eventType;

    public ProjectionApplyException(ProjectionName projectionName, TenantId tenantId, PersistedEvent event, Throwable cause) {
        super(lenientFormat("[%s:%s] Failed to apply %s (global order %s, stream %s version %s): %s",
                            projectionName, tenantId, event.eventType(), event.globalEventOrder(), event.streamId(), event.version(), cause.getMessage()),
              cause);
        this.projectionName = projectionName;
        this.tenantId = tenantId;
        this.globalEventOrder = event.globalEventOrder();
        this.eventType = event.eventType();
    }
}
