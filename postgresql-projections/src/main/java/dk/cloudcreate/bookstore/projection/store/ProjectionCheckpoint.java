package dk.cloudcreate.bookstore.projection.store;

import dk.cloudcreate.bookstore.common.types.TenantId;
import dk.cloudcreate.bookstore.eventstore.types.GlobalEventOrder;
import dk.cloudcreate.bookstore.projection.ProjectionName;

import java.util.Optional;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Durable progress of one projection for one tenant
 */
@SuppressWarnings("OptionalUsedAsFieldOrParameterType")
public final class ProjectionCheckpoint {
    public static final int FIRST_GENERATION = 1;

    public final ProjectionName    projectionName;
    public final TenantId          tenantId;
    /**
     * The generation queries read from
     */
    public final int               activeGeneration;
    /**
     * The highest {@link GlobalEventOrder} applied to the active generation
     */
    public final GlobalEventOrder  checkpoint;
    public final Optional<Integer> rebuildGeneration;
    public final GlobalEventOrder  rebuildCheckpoint;
    public final Optional<String>  haltedError;

    public ProjectionCheckpoint(ProjectionName projectionName,
                                TenantId tenantId,
                                int activeGeneration,
                                GlobalEventOrder checkpoint,
                                Optional<Integer> rebuildGeneration,
                                GlobalEventOrder rebuildCheckpoint,
                                Optional<String> haltedError) {
        this.projectionName = checkNotNull(projectionName, "No projectionName provided");
        this.tenantId = checkNotNull(tenantId, "No tenantId provided");
        this.activeGeneration = activeGeneration;
        this.checkpoint = checkNotNull(checkpoint, "No checkpoint provided");
        this.rebuildGeneration = checkNotNull(rebuildGeneration, "No rebuildGeneration option provided");
        this.rebuildCheckpoint = checkNotNull(rebuildCheckpoint, "No rebuildCheckpoint provided");
        this.haltedError = checkNotNull(haltedError, "No haltedError option provided");
    }

    public static ProjectionCheckpoint initial(ProjectionName projectionName, TenantId tenantId) {
        return new ProjectionCheckpoint(projectionName, tenantId, FIRST_GENERATION, GlobalEventOrder.NONE, Optional.empty(), GlobalEventOrder.NONE, Optional.empty());
    }

    public boolean isHalted() {
        return haltedError.isPresent();
    }

    public boolean isRebuilding() {
        return rebuildGeneration.isPresent();
    }

    @Override
    public String toString() {
        return "ProjectionCheckpoint{" +
                projectionName + ":" + tenantId +
                ", activeGeneration=" + activeGeneration +
                ", checkpoint=" + checkpoint +
                rebuildGeneration.map(generation -> ", rebuildGeneration=" + generation + ", rebuildCheckpoint=" + rebuildCheckpoint).orElse("") +
                haltedError.map(error -> ", halted='" + error + "'").orElse("") +
                '}';
    }
}
