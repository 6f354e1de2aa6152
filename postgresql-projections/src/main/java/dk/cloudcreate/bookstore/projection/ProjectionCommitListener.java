package dk.cloudcreate.bookstore.projection;

import dk.cloudcreate.bookstore.common.types.TenantId;

import java.util.List;

/**
 * Receives the outcome of live projection batches after they have been committed durably.
 * Never called for batches applied while rebuilding
 */
public interface ProjectionCommitListener {
    ProjectionCommitListener NONE = new ProjectionCommitListener() {
        @Override
        public void onCommitted(ProjectionName projectionName, TenantId tenantId, List<DocumentChange> changes) {
        }

        @Override
        public void onRebuildCompleted(ProjectionName projectionName, TenantId tenantId) {
        }
    };

    /**
     * @param changes the net document changes of the batch (never empty)
     */
    void onCommitted(ProjectionName projectionName, TenantId tenantId, List<DocumentChange> changes);

    /**
     * Called once the rebuilt generation has replaced the previous one
     */
    void onRebuildCompleted(ProjectionName projectionName, TenantId tenantId);
}
