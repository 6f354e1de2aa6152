package dk.cloudcreate.bookstore.projection.store;

import dk.cloudcreate.bookstore.common.types.TenantId;
import dk.cloudcreate.bookstore.eventstore.types.GlobalEventOrder;
import dk.cloudcreate.bookstore.projection.*;

import java.util.*;

/**
 * Storage of read model documents and projection checkpoints.<br>
 * Documents are partitioned by projection, tenant and generation. Queries read the active generation; a rebuild writes
 * a new generation that replaces the active one in {@link #completeRebuild(ProjectionName, TenantId, int)}.
 */
public interface ProjectionStore {
    /**
     * @return the checkpoint, or {@link ProjectionCheckpoint#initial(ProjectionName, TenantId)} if the projection never ran for the tenant
     */
    ProjectionCheckpoint checkpoint(ProjectionName projectionName, TenantId tenantId);

    Optional<ProjectionDocument> findDocument(ProjectionName projectionName, TenantId tenantId, int generation, String documentType, String documentId);

    /**
     * @return all documents of the type ordered by document id
     */
    List<ProjectionDocument> findDocuments(ProjectionName projectionName, TenantId tenantId, int generation, String documentType);

    /**
     * Atomically apply the document writes and advance the checkpoint of the generation (the active checkpoint, or the rebuild
     * checkpoint if <code>generation</code> is being rebuilt). Checkpoints never move backwards
     *
     * @throws ProjectionException if <code>generation</code> is neither active nor being rebuilt
     */
    void commit(ProjectionName projectionName, TenantId tenantId, int generation, List<DocumentWrite> writes, GlobalEventOrder checkpoint);

    /**
     * Start a new generation with an empty document set. Any unfinished rebuild generation is discarded
     *
     * @return the new generation
     */
    int beginRebuild(ProjectionName projectionName, TenantId tenantId);

    /**
     * Atomically make the rebuilt generation the active one (including its checkpoint) and drop the previous generation
     */
    void completeRebuild(ProjectionName projectionName, TenantId tenantId, int generation);

    void halt(ProjectionName projectionName, TenantId tenantId, String error);

    void clearHalt(ProjectionName projectionName, TenantId tenantId);
}
